package com.dnobretech.teialigner.controller;

import com.dnobretech.teialigner.dto.TeiAlignmentRequest;
import com.dnobretech.teialigner.dto.TeiAlignmentResponse;
import com.dnobretech.teialigner.service.TeiAlignmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequiredArgsConstructor
@RequestMapping("/align")
public class AlignmentController {

    private final TeiAlignmentService service;

    /**
     * Aligns two TEI documents and returns them as one teiCorpus with a standOff link group.
     * Languages default to the TEI headers, then to "en".
     */
    @PostMapping("/tei")
    public ResponseEntity<TeiAlignmentResponse> alignTei(@RequestBody @Valid TeiAlignmentRequest request) {
        TeiAlignmentResponse r = service.align(request);
        return ResponseEntity.ok()
                .header("X-Processing-Time", String.format(Locale.ROOT, "%.3f", r.processingTime()))
                .body(r);
    }
}
