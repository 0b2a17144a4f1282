package com.example.matchscore.http;

import com.example.matchscore.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

@Component
public class OpenRouterClient implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterClient.class);

    private final WebClient http;
    private final String apiKey;
    private final double costPer1kTokens;

    public OpenRouterClient(@Qualifier("llmHttp") WebClient http,
                            @Value("${llm.openrouter.apiKey:}") String apiKey,
                            @Value("${llm.openrouter.cost-per-1k-tokens:0.0}") double costPer1kTokens) {
        this.http = http;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.costPer1kTokens = costPer1kTokens;
    }

    @Override
    public boolean isEnabled() { return !apiKey.isBlank(); }

    /** Chat completion: POST https://openrouter.ai/api/v1/chat/completions */
    @Override
    public Mono<LlmCompletion> complete(LlmRequest request) {
        if (!isEnabled()) return Mono.error(new ProviderException("OpenRouter API key is not configured"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.getModel());
        body.put("messages", List.of(Map.of("role", "user", "content", request.getPrompt())));
        body.put("max_tokens", request.getMaxTokens());
        body.put("temperature", request.getTemperature());
        body.put("response_format", Map.of("type", "json_object"));
        body.put("usage", Map.of("include", true));

        return http.post()
                .uri("/api/v1/chat/completions")
                .header("Authorization", "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(request.getTimeout())
                .map(json -> toCompletion(json, request.getModel()))
                .onErrorMap(e -> !(e instanceof ProviderException), e -> e instanceof TimeoutException
                        ? new ProviderException("OpenRouter call timed out after " + request.getTimeout().toMillis() + " ms", e)
                        : new ProviderException("OpenRouter call failed: " + e.getMessage(), e))
                .doOnError(e -> log.warn("OpenRouter completion failed for model {}: {}", request.getModel(), e.toString()));
    }

    private LlmCompletion toCompletion(JsonNode json, String requestedModel) {
        JsonNode error = json.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ProviderException("OpenRouter error: " + error.path("message").asText(error.toString()));
        }
        String text = json.path("choices").path(0).path("message").path("content").asText("");
        if (text.isBlank()) throw new ProviderException("OpenRouter returned an empty completion");

        JsonNode usage = json.path("usage");
        int prompt = usage.path("prompt_tokens").asInt(0);
        int completion = usage.path("completion_tokens").asInt(0);
        double cost = usage.hasNonNull("cost")
                ? usage.path("cost").asDouble(0.0)
                : (prompt + completion) / 1000.0 * costPer1kTokens;
        String model = json.path("model").asText(requestedModel);
        return new LlmCompletion(text, model, prompt, completion, cost);
    }
}
