package com.example.matchscore;

import com.example.matchscore.model.feedback.FeedbackRecord;
import com.example.matchscore.model.request.FeedbackRequest;
import com.example.matchscore.service.FeedbackRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@Tag(name = "Feedback API", description = "Ratings, comments and bid outcomes on scores")
public class FeedbackController {

    private final FeedbackRecorder feedbackRecorder;

    public FeedbackController(FeedbackRecorder feedbackRecorder) {
        this.feedbackRecorder = feedbackRecorder;
    }

    @PostMapping("/match-scores/{id}/feedback")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Record feedback", description = "Rating 1-5, comment up to 2000 chars, outcome won|lost|no_bid|withdrawn")
    public Mono<FeedbackRecord> record(@RequestHeader(MatchScoreController.ORG_HEADER) String orgId,
                                       @PathVariable String id,
                                       @RequestBody FeedbackRequest request) {
        return feedbackRecorder.recordFeedback(orgId, id, request);
    }

    @GetMapping("/match-scores/{id}/feedback")
    @Operation(summary = "List feedback", description = "Oldest first")
    public Mono<List<FeedbackRecord>> list(@RequestHeader(MatchScoreController.ORG_HEADER) String orgId,
                                           @PathVariable String id) {
        return feedbackRecorder.listFeedback(orgId, id).collectList();
    }
}
