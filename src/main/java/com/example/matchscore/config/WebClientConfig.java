package com.example.matchscore.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    private static WebClient mk(String baseUrl, Duration responseTimeout) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(responseTimeout)
                .httpResponseDecoder(h -> h
                        .maxHeaderSize(64 * 1024)
                        .maxInitialLineLength(8 * 1024));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                        .build())
                .defaultHeader("User-Agent", "match-score-engine")
                .build();
    }

    // Hard upper bound; the per-call timeout in OpenRouterClient is usually shorter.
    @Bean("llmHttp")
    public WebClient llmHttp(@Value("${llm.openrouter.base-url:https://openrouter.ai}") String baseUrl,
                             @Value("${llm.openrouter.response-timeout:60s}") Duration responseTimeout) {
        return mk(baseUrl, responseTimeout);
    }
}
