package com.yerin.bgworker.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class WorkerMetrics {

    private final MeterRegistry registry;

    private final Counter jobEnqueued;
    private final Counter jobSucceeded;
    private final Counter jobFailed;
    private final Counter jobRetried;
    private final Counter jobExhausted;

    public WorkerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobEnqueued  = Counter.builder("bgworker_jobs_enqueued_total")
                .description("jobs enqueued").register(registry);
        this.jobSucceeded = Counter.builder("bgworker_jobs_succeeded_total")
                .description("jobs succeeded").register(registry);
        this.jobFailed    = Counter.builder("bgworker_jobs_failed_total")
                .description("jobs failed (handler thrown, timed out or undeliverable)").register(registry);
        this.jobRetried   = Counter.builder("bgworker_jobs_retried_total")
                .description("jobs scheduled for retry").register(registry);
        this.jobExhausted = Counter.builder("bgworker_jobs_exhausted_total")
                .description("jobs out of retries, failure action applied").register(registry);
    }

    public void incEnqueued(int count) { jobEnqueued.increment(count); }
    public void incSucceeded() { jobSucceeded.increment(); }
    public void incFailed()    { jobFailed.increment(); }
    public void incRetried()   { jobRetried.increment(); }
    public void incExhausted() { jobExhausted.increment(); }

    // 워커 이름 태그가 붙은 타이머
    public Timer handlerTimer(String workerName) {
        return Timer.builder("bgworker_handler_duration_seconds")
                .description("handler duration by worker")
                .tag("worker", workerName)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
