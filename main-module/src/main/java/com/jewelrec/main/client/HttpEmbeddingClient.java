package com.jewelrec.main.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jewelrec.common.exception.EmbeddingUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Embedding client backed by an HTTP embedding service exposing
 * {@code POST /embed/text} and {@code POST /embed/image}.
 */
@Slf4j
public class HttpEmbeddingClient implements EmbeddingClient {

    private static final String TEXT_PATH = "/embed/text";
    private static final String IMAGE_PATH = "/embed/image";

    private final WebClient embeddingWebClient;
    private final Duration timeout;

    public HttpEmbeddingClient(WebClient embeddingWebClient, Duration timeout) {
        this.embeddingWebClient = embeddingWebClient;
        this.timeout = timeout;
    }

    @Override
    public Optional<float[]> embedText(String text) {
        log.debug("Embedding text of length {} via embedding service", text.length());
        return call(TEXT_PATH, Map.of("text", text));
    }

    @Override
    public Optional<float[]> embedImage(String imageBase64) {
        log.debug("Embedding image of {} base64 chars via embedding service", imageBase64.length());
        return call(IMAGE_PATH, Map.of("image_base64", imageBase64));
    }

    private Optional<float[]> call(String path, Map<String, String> body) {
        try {
            EmbeddingResponse response = embeddingWebClient
                    .post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(EmbeddingResponse.class)
                    .doOnError(error -> log.error("Embedding service call {} failed: {}", path, error.getMessage()))
                    .block(timeout);

            if (response == null || response.embedding() == null || response.embedding().length == 0) {
                log.warn("Embedding service returned no embedding for {}", path);
                return Optional.empty();
            }
            return Optional.of(response.embedding());
        } catch (WebClientException e) {
            throw new EmbeddingUnavailableException("Embedding service call failed: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout) signals a timeout this way
            throw new EmbeddingUnavailableException("Embedding service timed out after " + timeout, e);
        }
    }

    record EmbeddingResponse(@JsonProperty("embedding") float[] embedding) {
    }
}
