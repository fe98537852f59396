package com.yerin.bgworker.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.bgworker.config.ConfigResolver;
import com.yerin.bgworker.domain.Job;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.global.exception.WorkerException;
import com.yerin.bgworker.global.exception.code.EnqueueErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Serializes the arguments, resolves the target queue and wraps everything into {@link Job}s;
 * subclasses only write the jobs to their storage.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractEnqueuer implements Enqueuer {

    private final WorkerMetrics metrics;

    @Override
    public <A> void enqueue(AppContext context, Worker<A> worker, A args) {
        enqueueBatchDelayed(context, worker, Collections.singletonList(args), Duration.ZERO);
    }

    @Override
    public <A> void enqueueDelayed(AppContext context, Worker<A> worker, A args, Duration delay) {
        enqueueBatchDelayed(context, worker, Collections.singletonList(args), delay);
    }

    @Override
    public <A> void enqueueBatch(AppContext context, Worker<A> worker, List<A> args) {
        enqueueBatchDelayed(context, worker, args, Duration.ZERO);
    }

    @Override
    public <A> void enqueueBatchDelayed(AppContext context, Worker<A> worker, List<A> args, Duration delay) {
        String queue = queueFor(context, worker);
        if (args.isEmpty()) return;

        List<Job> jobs = new ArrayList<>(args.size());
        for (A arg : args) {
            jobs.add(Job.of(worker.name(), serialize(context, worker, arg)));
        }

        try {
            send(context, queue, jobs, delay == null ? Duration.ZERO : delay);
        } catch (DataAccessException e) {
            log.error("[Enqueuer] send failed worker={}, queue={}, count={}, err={}",
                    worker.name(), queue, jobs.size(), e.toString());
            throw new WorkerException(EnqueueErrorCode.BACKEND, e);
        }
        metrics.incEnqueued(jobs.size());
    }

    /**
     * Writes the jobs to {@code queue}. A positive {@code delay} keeps them invisible until it
     * has elapsed.
     */
    protected abstract void send(AppContext context, String queue, List<Job> jobs, Duration delay);

    public static String queueFor(AppContext context, Worker<?> worker) {
        return ConfigResolver.queue(context.getProperties().getEnqueueConfig(), worker.enqueueConfig(context))
                .orElseThrow(() -> {
                    log.error("[Enqueuer] unable to enqueue job, no queue configured worker={}", worker.name());
                    return new WorkerException(EnqueueErrorCode.NO_QUEUE
                            .withDetail("No queue configured for worker `" + worker.name() + "`."));
                });
    }

    private static JsonNode serialize(AppContext context, Worker<?> worker, Object arg) {
        try {
            return context.getObjectMapper().valueToTree(arg);
        } catch (IllegalArgumentException e) {
            throw new WorkerException(EnqueueErrorCode.SERIALIZATION
                    .withDetail("Unable to serialize args of worker `" + worker.name() + "`."), e);
        }
    }
}
