package com.jewelrec.main.client;

import com.jewelrec.common.exception.EmbeddingUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpEmbeddingClientTest {

    @Test
    void postsTextAndReadsEmbedding() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        HttpEmbeddingClient client = client(request -> {
            captured.set(request);
            return Mono.just(json(HttpStatus.OK, "{\"embedding\": [0.6, 0.8]}"));
        });

        assertThat(client.embedText("oval ring")).hasValueSatisfying(v -> assertThat(v).containsExactly(0.6f, 0.8f));
        assertThat(captured.get().url().getPath()).isEqualTo("/embed/text");
    }

    @Test
    void imageUsesImageEndpoint() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        HttpEmbeddingClient client = client(request -> {
            captured.set(request);
            return Mono.just(json(HttpStatus.OK, "{\"embedding\": [1.0]}"));
        });

        assertThat(client.embedImage("aW1n")).isPresent();
        assertThat(captured.get().url().getPath()).isEqualTo("/embed/image");
    }

    @Test
    void emptyEmbeddingIsAbsent() {
        HttpEmbeddingClient client = client(request -> Mono.just(json(HttpStatus.OK, "{\"embedding\": []}")));

        assertThat(client.embedText("ring")).isEmpty();
    }

    @Test
    void serverErrorIsUnavailable() {
        HttpEmbeddingClient client = client(request -> Mono.just(json(HttpStatus.BAD_GATEWAY, "{}")));

        assertThatThrownBy(() -> client.embedText("ring")).isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    void timeoutIsUnavailable() {
        HttpEmbeddingClient client = new HttpEmbeddingClient(
            WebClient.builder().baseUrl("http://embedder").exchangeFunction(request -> Mono.never()).build(),
            Duration.ofMillis(50));

        assertThatThrownBy(() -> client.embedText("ring"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessageContaining("timed out");
    }

    private static HttpEmbeddingClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder().baseUrl("http://embedder").exchangeFunction(exchange).build();
        return new HttpEmbeddingClient(webClient, Duration.ofSeconds(5));
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
