package com.dnobretech.teialigner.client;

import com.dnobretech.teialigner.dto.EmbedResponse;
import com.dnobretech.teialigner.exception.AlignmentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Embedding model served by the embedding worker over HTTP. The client is built once,
 * on first use, and shared by every request.
 */
@Slf4j
@Component
public class HttpEmbeddingModel implements EmbeddingModel {

    private final String baseUrl;
    private final int batchSize;
    private final long timeoutSeconds;

    private volatile WebClient client;
    private volatile String modelName;

    public HttpEmbeddingModel(@Value("${teialigner.embeddings.base-url:http://localhost:8001}") String baseUrl,
                              @Value("${teialigner.embeddings.batch-size:256}") int batchSize,
                              @Value("${teialigner.embeddings.timeout-seconds:60}") long timeoutSeconds) {
        this.baseUrl = baseUrl;
        this.batchSize = Math.max(1, batchSize);
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public List<double[]> embed(List<String> texts) {
        List<double[]> out = new ArrayList<>(texts.size());
        if (texts.isEmpty()) return out;

        WebClient web = client();
        for (int i = 0; i < texts.size(); i += batchSize) {
            int to = Math.min(i + batchSize, texts.size());
            List<String> slice = texts.subList(i, to);

            EmbedResponse resp;
            try {
                resp = web.post()
                        .uri("/embed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(Map.of("texts", slice, "normalize", true))
                        .retrieve()
                        .bodyToMono(EmbedResponse.class)
                        .timeout(Duration.ofSeconds(timeoutSeconds))
                        .block();
            } catch (WebClientException e) {
                throw new AlignmentException("Embedding worker call failed (batch " + i + ".." + to + ")", e);
            }

            if (resp == null || resp.vectors() == null || resp.vectors().size() != slice.size()) {
                throw new AlignmentException("Embedding worker returned "
                        + (resp == null || resp.vectors() == null ? 0 : resp.vectors().size())
                        + " vectors for " + slice.size() + " texts");
            }
            if (modelName == null) {
                modelName = resp.model();
                log.info("Embedding model '{}' ({} dims) at {}", resp.model(), resp.dims(), baseUrl);
            }
            out.addAll(resp.vectors());
        }
        return out;
    }

    @Override
    public boolean isLoaded() {
        return modelName != null;
    }

    private WebClient client() {
        WebClient c = client;
        if (c == null) {
            synchronized (this) {
                c = client;
                if (c == null) {
                    c = WebClient.builder()
                            .baseUrl(baseUrl)
                            .clientConnector(new ReactorClientHttpConnector(
                                    HttpClient.create().responseTimeout(Duration.ofSeconds(timeoutSeconds + 30))
                            ))
                            // batching keeps each response below this
                            .exchangeStrategies(ExchangeStrategies.builder()
                                    .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                                    .build())
                            .build();
                    client = c;
                }
            }
        }
        return c;
    }
}
