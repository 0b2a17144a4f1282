package com.example.matchscore.service.enrichment;

import com.example.matchscore.exception.LimitExceededException;
import com.example.matchscore.exception.ProviderException;
import com.example.matchscore.http.LlmCompletion;
import com.example.matchscore.http.LlmProvider;
import com.example.matchscore.http.LlmRequest;
import com.example.matchscore.model.Opportunity;
import com.example.matchscore.model.Profile;
import com.example.matchscore.model.ScoringMethod;
import com.example.matchscore.model.score.MatchScore;
import com.example.matchscore.model.score.ScoreAdjustment;
import com.example.matchscore.model.score.StrategicInsights;
import com.example.matchscore.service.quota.UsageQuotaGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Adds language-model insight to a deterministic score. Never fails: any quota denial,
 * provider error, timeout or unparseable reply yields the base score marked degraded.
 */
@Service
public class SemanticEnrichmentClient {

    private static final Logger log = LoggerFactory.getLogger(SemanticEnrichmentClient.class);

    private final LlmProvider provider;
    private final UsageQuotaGuard quota;
    private final EnrichmentPromptBuilder prompts;
    private final EnrichmentResponseParser parser;

    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final Duration timeout;
    private final double blendRatio;
    private final int maxAdjustment;

    public SemanticEnrichmentClient(LlmProvider provider,
                                    UsageQuotaGuard quota,
                                    EnrichmentPromptBuilder prompts,
                                    EnrichmentResponseParser parser,
                                    @Value("${matchscore.enrichment.model:anthropic/claude-3.5-sonnet}") String model,
                                    @Value("${matchscore.enrichment.max-tokens:2500}") int maxTokens,
                                    @Value("${matchscore.enrichment.temperature:0.4}") double temperature,
                                    @Value("${matchscore.enrichment.timeout:30s}") Duration timeout,
                                    @Value("${matchscore.enrichment.hybrid-blend:0.3}") double blendRatio,
                                    @Value("${matchscore.enrichment.max-adjustment:10}") int maxAdjustment) {
        this.provider = provider;
        this.quota = quota;
        this.prompts = prompts;
        this.parser = parser;
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.timeout = timeout;
        this.blendRatio = Math.max(0.0, Math.min(1.0, blendRatio));
        this.maxAdjustment = Math.max(0, maxAdjustment);
    }

    public Mono<MatchScore> enrich(Profile profile, Opportunity opportunity, MatchScore base, ScoringMethod method) {
        if (method == null || !method.needsEnrichment()) return Mono.just(base);
        MatchScore target = base.copy();
        if (!provider.isEnabled()) {
            return Mono.just(degrade(target, "Language-model provider is not configured"));
        }

        return quota.checkAndConsume(base.getOrganizationId(), UsageQuotaGuard.LLM_SCORING, 1)
                .then(Mono.defer(() -> provider.complete(new LlmRequest(
                        prompts.build(profile, opportunity, base), model, maxTokens, temperature, timeout))))
                .timeout(timeout)
                .map(completion -> apply(target, parser.parse(completion.getText()), completion, method))
                .onErrorResume(e -> Mono.just(degrade(target, reason(e))));
    }

    private MatchScore apply(MatchScore target, EnrichmentPayload payload, LlmCompletion completion, ScoringMethod method) {
        target.setSemanticAnalysis(payload.getSemanticAnalysis());
        target.setStrategicInsights(payload.getStrategicInsights());
        target.setEnrichmentModel(completion.getModel());
        target.setCostUsd(target.getCostUsd() + completion.getCostUsd());
        target.setScoringMethod(method);
        target.setDegraded(false);
        target.setDegradationReason(null);
        addGapRecommendations(target, payload.getStrategicInsights());

        if (method == ScoringMethod.HYBRID) {
            int deterministic = target.getDeterministicScore();
            ScoreAdjustment adj = adjustment(deterministic, payload.getSuggestedScore(), payload.getScoreRationale());
            target.setAdjustment(adj);
            target.setOverallScore(Math.max(0, Math.min(100, deterministic + adj.getDelta())));
        }
        log.debug("Enriched {} / {} via {} ({} tokens, ${})", target.getProfileId(), target.getOpportunityId(),
                completion.getModel(), completion.getTotalTokens(), completion.getCostUsd());
        return target;
    }

    /** delta = clamp(round(blend * (suggested - deterministic)), +-maxAdjustment). */
    ScoreAdjustment adjustment(int deterministic, Integer suggested, String rationale) {
        if (suggested == null) {
            return new ScoreAdjustment(0, deterministic, blendRatio, maxAdjustment, "Model returned no suggested score");
        }
        int raw = (int) Math.round(blendRatio * (suggested - deterministic));
        int delta = Math.max(-maxAdjustment, Math.min(maxAdjustment, raw));
        return new ScoreAdjustment(delta, suggested, blendRatio, maxAdjustment, rationale);
    }

    private static void addGapRecommendations(MatchScore target, StrategicInsights insights) {
        if (insights == null || insights.getCriticalGaps() == null) return;
        for (StrategicInsights.Gap g : insights.getCriticalGaps()) {
            if (g == null || g.getGap() == null) continue;
            String severity = g.getSeverity() == null ? "" : g.getSeverity().toUpperCase();
            if (severity.equals("DISQUALIFYING") || severity.equals("CRITICAL")) {
                String r = "Address gap: " + g.getGap()
                        + (g.getMitigation() == null || g.getMitigation().isBlank() ? "" : " (" + g.getMitigation() + ")");
                if (!target.getRecommendations().contains(r)) target.getRecommendations().add(r);
            }
        }
    }

    private MatchScore degrade(MatchScore target, String reason) {
        log.warn("Enrichment degraded for {} / {}: {}", target.getProfileId(), target.getOpportunityId(), reason);
        target.setScoringMethod(ScoringMethod.CALCULATION);
        target.setDegraded(true);
        target.setDegradationReason(reason);
        target.setSemanticAnalysis(null);
        target.setStrategicInsights(null);
        target.setAdjustment(null);
        target.setOverallScore(target.getDeterministicScore());
        return target;
    }

    private String reason(Throwable e) {
        if (e instanceof LimitExceededException) return "Quota exceeded: " + e.getMessage();
        if (e instanceof TimeoutException) return "Provider timed out after " + timeout.toMillis() + " ms";
        if (e instanceof ProviderException) return e.getMessage();
        return "Enrichment failed: " + e;
    }
}
