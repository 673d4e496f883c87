package com.jewelrec.main.config;

import com.jewelrec.main.client.EmbeddingClient;
import com.jewelrec.main.client.HttpEmbeddingClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

@Configuration
public class EmbeddingClientConfig {

    @Bean
    public WebClient embeddingWebClient(WebClient.Builder builder, RecommenderProperties properties) {
        RecommenderProperties.Embedding embedding = properties.getEmbedding();
        long readTimeoutMillis = embedding.getReadTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) embedding.getConnectionTimeout().toMillis())
                .responseTimeout(embedding.getReadTimeout())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(readTimeoutMillis, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(readTimeoutMillis, TimeUnit.MILLISECONDS)));

        return builder
                .baseUrl(embedding.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @Bean
    public EmbeddingClient embeddingClient(WebClient embeddingWebClient, RecommenderProperties properties) {
        return new HttpEmbeddingClient(embeddingWebClient, properties.getEmbedding().getReadTimeout());
    }
}
