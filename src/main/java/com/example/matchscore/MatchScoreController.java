package com.example.matchscore;

import com.example.matchscore.model.batch.BatchResult;
import com.example.matchscore.model.batch.BulkCheckResult;
import com.example.matchscore.model.request.BatchScoreRequest;
import com.example.matchscore.model.request.BulkCheckRequest;
import com.example.matchscore.model.request.ScoreRequest;
import com.example.matchscore.model.score.MatchScore;
import com.example.matchscore.model.score.NotificationReadiness;
import com.example.matchscore.service.BatchCoordinator;
import com.example.matchscore.service.MatchScoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@Tag(name = "Match Score API", description = "Profile/opportunity compatibility scoring")
public class MatchScoreController {

    static final String ORG_HEADER = "X-Organization-Id";

    private final MatchScoringService scoringService;
    private final BatchCoordinator batchCoordinator;

    public MatchScoreController(MatchScoringService scoringService, BatchCoordinator batchCoordinator) {
        this.scoringService = scoringService;
        this.batchCoordinator = batchCoordinator;
    }

    @PostMapping("/match-scores")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Score one pair", description = "Cached per profile, opportunity, method and algorithm version. "
            + "method=llm|hybrid adds language-model insight and degrades to calculation on provider failure")
    public Mono<MatchScore> score(@RequestHeader(ORG_HEADER) String orgId,
                                  @RequestBody ScoreRequest request) {
        return scoringService.score(orgId, request);
    }

    @PostMapping("/match-scores/batch")
    @Operation(summary = "Score many opportunities", description = "Up to 50 opportunities for one profile; per-item failures are reported, not thrown")
    public Mono<BatchResult> batch(@RequestHeader(ORG_HEADER) String orgId,
                                   @RequestBody BatchScoreRequest request) {
        return batchCoordinator.scoreBatch(orgId, request);
    }

    @PostMapping("/match-scores/bulk-check")
    @Operation(summary = "Existing scores for many opportunities",
            description = "Latest stored score per opportunity (default last 24 hours) and the ids that still need scoring; computes nothing")
    public Mono<BulkCheckResult> bulkCheck(@RequestHeader(ORG_HEADER) String orgId,
                                           @RequestBody BulkCheckRequest request) {
        return scoringService.bulkCheck(orgId, request);
    }

    @GetMapping("/match-scores/recent")
    @Operation(summary = "Recent scores", description = "Newest first, at most 100")
    public Mono<List<MatchScore>> recent(@RequestHeader(ORG_HEADER) String orgId,
                                         @Parameter(description = "Look-back window in hours (1-168)")
                                         @RequestParam(defaultValue = "24") int hours) {
        return scoringService.recent(orgId, hours);
    }

    @GetMapping("/match-scores/history")
    @Operation(summary = "Score history of a pair", description = "Every computed score, oldest first")
    public Mono<List<MatchScore>> history(@RequestHeader(ORG_HEADER) String orgId,
                                          @RequestParam String profileId,
                                          @RequestParam String opportunityId) {
        return scoringService.history(orgId, profileId, opportunityId);
    }

    @GetMapping("/match-scores/usage")
    @Operation(summary = "Usage this month", description = "Units consumed per resource type")
    public Mono<Map<String, Long>> usage(@RequestHeader(ORG_HEADER) String orgId) {
        return scoringService.usage(orgId);
    }

    @GetMapping("/match-scores/{id}")
    @Operation(summary = "Get a score")
    public Mono<MatchScore> get(@RequestHeader(ORG_HEADER) String orgId, @PathVariable String id) {
        return scoringService.getScore(orgId, id);
    }

    @GetMapping("/match-scores/{id}/notification-readiness")
    @Operation(summary = "Notification readiness", description = "Notify when overall >= 75, credibility >= 60 and confidence >= 65")
    public Mono<NotificationReadiness> readiness(@RequestHeader(ORG_HEADER) String orgId, @PathVariable String id) {
        return scoringService.notificationReadiness(orgId, id);
    }
}
