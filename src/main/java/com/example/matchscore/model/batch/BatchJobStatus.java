package com.example.matchscore.model.batch;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Schema(description = "Status of a dispatched background job")
public class BatchJobStatus {

    public enum State { QUEUED, RUNNING, COMPLETED, FAILED }

    private String jobId;
    private String eventName;
    private State state;
    private Instant createdAt;
    private Instant finishedAt;
    private BatchResult result;
    private String error;
}
