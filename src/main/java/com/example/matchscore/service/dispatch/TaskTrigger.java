package com.example.matchscore.service.dispatch;

import com.example.matchscore.model.batch.BatchJobStatus;
import reactor.core.publisher.Mono;

/**
 * Fire-and-forget dispatch of long-running work. The returned job id can be polled
 * with {@link #status(String)}.
 */
public interface TaskTrigger {

    String BATCH_SCORE_EVENT = "match-score/batch.requested";

    Mono<String> enqueue(String eventName, Object payload);

    /** Empty once the job is unknown or its status has expired. */
    Mono<BatchJobStatus> status(String jobId);
}
