package com.example.matchscore.http;

import reactor.core.publisher.Mono;

/**
 * Completion endpoint of a language-model provider. Implementations signal
 * {@link com.example.matchscore.exception.ProviderException} on any failure.
 */
public interface LlmProvider {

    Mono<LlmCompletion> complete(LlmRequest request);

    /** False when the provider has no credentials configured. */
    default boolean isEnabled() {
        return true;
    }
}
