package com.example.matchscore;

import com.example.matchscore.exception.NotFoundException;
import com.example.matchscore.model.batch.BatchJobStatus;
import com.example.matchscore.model.request.BatchScoreRequest;
import com.example.matchscore.service.dispatch.BatchScorePayload;
import com.example.matchscore.service.dispatch.TaskTrigger;
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

import java.util.Map;

@RestController
@Tag(name = "Job API", description = "Background batch scoring")
public class JobController {

    private final TaskTrigger taskTrigger;

    public JobController(TaskTrigger taskTrigger) {
        this.taskTrigger = taskTrigger;
    }

    @PostMapping("/match-scores/batch/trigger")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "Dispatch a batch", description = "Returns a job id immediately; poll /jobs/{id}")
    public Mono<Map<String, String>> trigger(@RequestHeader(MatchScoreController.ORG_HEADER) String orgId,
                                             @RequestBody BatchScoreRequest request) {
        return taskTrigger.enqueue(TaskTrigger.BATCH_SCORE_EVENT, new BatchScorePayload(orgId, request))
                .map(jobId -> Map.of("jobId", jobId));
    }

    @GetMapping("/jobs/{id}")
    @Operation(summary = "Job status", description = "Kept for one hour after submission")
    public Mono<BatchJobStatus> status(@PathVariable String id) {
        return taskTrigger.status(id)
                .switchIfEmpty(Mono.error(() -> NotFoundException.of("Job", id)));
    }
}
