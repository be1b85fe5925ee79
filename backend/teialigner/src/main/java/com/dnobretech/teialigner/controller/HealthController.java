package com.dnobretech.teialigner.controller;

import com.dnobretech.teialigner.client.EmbeddingModel;
import com.dnobretech.teialigner.dto.HealthResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final EmbeddingModel model;

    @Value("${teialigner.version:0.2.0}")
    private String version;

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", version, model.isLoaded());
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("message", "TEI Aligner API");
        m.put("version", version);
        m.put("endpoints", List.of("POST /align/tei", "GET /health"));
        return m;
    }
}
