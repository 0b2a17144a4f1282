package com.example.matchscore.service.dispatch;

import com.example.matchscore.exception.ValidationException;
import com.example.matchscore.model.batch.BatchJobStatus;
import com.example.matchscore.service.BatchCoordinator;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/** Runs dispatched batch jobs in-process on a bounded Reactor scheduler. */
@Component
public class LocalTaskTrigger implements TaskTrigger {

    private static final Logger log = LoggerFactory.getLogger(LocalTaskTrigger.class);

    private final BatchCoordinator batches;
    private final Clock clock;
    private final Cache<String, BatchJobStatus> jobs;
    private final Scheduler scheduler = Schedulers.boundedElastic();

    public LocalTaskTrigger(BatchCoordinator batches,
                            Clock clock,
                            @Value("${matchscore.jobs.retention:1h}") Duration retention) {
        this.batches = batches;
        this.clock = clock;
        this.jobs = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(retention)
                .build();
    }

    @Override
    public Mono<String> enqueue(String eventName, Object payload) {
        return Mono.fromSupplier(() -> {
            if (!BATCH_SCORE_EVENT.equals(eventName) || !(payload instanceof BatchScorePayload)) {
                throw new ValidationException("Unsupported event: " + eventName);
            }
            BatchScorePayload job = (BatchScorePayload) payload;
            BatchJobStatus status = new BatchJobStatus();
            status.setJobId(UUID.randomUUID().toString());
            status.setEventName(eventName);
            status.setState(BatchJobStatus.State.QUEUED);
            status.setCreatedAt(clock.instant());
            jobs.put(status.getJobId(), status);

            batches.scoreBatch(job.getOrganizationId(), job.getRequest())
                    .doOnSubscribe(s -> status.setState(BatchJobStatus.State.RUNNING))
                    .subscribeOn(scheduler)
                    .subscribe(result -> {
                        status.setResult(result);
                        status.setState(BatchJobStatus.State.COMPLETED);
                        status.setFinishedAt(clock.instant());
                        jobs.put(status.getJobId(), status);
                    }, e -> {
                        log.warn("Job {} failed: {}", status.getJobId(), e.toString());
                        status.setError(e.getMessage());
                        status.setState(BatchJobStatus.State.FAILED);
                        status.setFinishedAt(clock.instant());
                        jobs.put(status.getJobId(), status);
                    });
            log.info("Job {} queued ({})", status.getJobId(), eventName);
            return status.getJobId();
        });
    }

    @Override
    public Mono<BatchJobStatus> status(String jobId) {
        return Mono.justOrEmpty(jobs.getIfPresent(jobId));
    }
}
