package com.yerin.bgworker.backend.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.yerin.bgworker.config.ConfigResolver;
import com.yerin.bgworker.config.RedisWorkerProperties;
import com.yerin.bgworker.config.WorkerConfig;
import com.yerin.bgworker.domain.BalanceStrategy;
import com.yerin.bgworker.domain.CompletedAction;
import com.yerin.bgworker.domain.Job;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.global.exception.WorkerTimeoutException;
import com.yerin.bgworker.infra.Backoff;
import com.yerin.bgworker.infra.CancellationToken;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.PeriodicSchedule;
import com.yerin.bgworker.worker.WorkerRegistry;
import com.yerin.bgworker.worker.WorkerWrapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fetch and dispatch side of the Redis backend. Fetch tasks block on BRPOP over their queue
 * lists; a scheduler task moves due entries of the schedule and retry sets into their lists and a
 * periodic task claims due periodic entries.
 */
@Slf4j
public class RedisJobProcessor {

    static final int MOVE_BATCH = 100;

    private final WorkerRegistry registry;
    private final RedisQueueClient client;
    private final WorkerMetrics metrics;

    @Getter
    private final CancellationToken token = new CancellationToken();

    private volatile ExecutorService timeoutExecutor = newTimeoutExecutor();

    RedisJobProcessor(WorkerRegistry registry, RedisQueueClient client, WorkerMetrics metrics) {
        this.registry = registry;
        this.client = client;
        this.metrics = metrics;
    }

    private static ExecutorService newTimeoutExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("bgworker-redis-handler-"));
    }

    /**
     * Runs every task until this processor's token is cancelled.
     */
    public void run() throws InterruptedException {
        RedisWorkerProperties props = properties();
        List<Runnable> tasks = new ArrayList<>();

        List<String> shared = props.sharedQueues(registry.queues());
        if (!shared.isEmpty()) {
            for (int i = 0; i < props.getNumWorkers(); i++) {
                int offset = i;
                tasks.add(() -> fetchLoop(shared, offset));
            }
        }
        for (String queue : props.getQueueConfig().keySet()) {
            for (int i = 0; i < props.dedicatedWorkers(queue); i++) {
                tasks.add(() -> fetchLoop(List.of(queue), 0));
            }
        }
        tasks.add(this::schedulerLoop);
        if (props.getPeriodic().isEnable() && !registry.periodicDefinitions().isEmpty()) {
            tasks.add(this::periodicLoop);
        }

        if (timeoutExecutor.isShutdown()) {
            timeoutExecutor = newTimeoutExecutor();
        }
        ExecutorService pool = Executors.newFixedThreadPool(tasks.size(), new CustomizableThreadFactory("bgworker-redis-"));
        for (Runnable task : tasks) {
            pool.submit(() -> {
                try {
                    task.run();
                } catch (RuntimeException | Error e) {
                    log.error("[RedisProcessor] task crashed, shutting down: {}", e.toString(), e);
                } finally {
                    token.cancel();
                }
            });
        }
        log.info("[RedisProcessor] started tasks={}, sharedQueues={}, dedicated={}",
                tasks.size(), shared, props.getQueueConfig().keySet());

        try {
            token.await();
        } catch (InterruptedException e) {
            token.cancel();
            throw e;
        } finally {
            pool.shutdown();
            while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("[RedisProcessor] waiting for tasks to stop");
            }
            timeoutExecutor.shutdownNow();
            log.info("[RedisProcessor] stopped");
        }
    }

    private void fetchLoop(List<String> queues, int offset) {
        RedisWorkerProperties props = properties();
        int rotation = offset;
        while (!token.isCancelled()) {
            List<String> order = props.getBalanceStrategy() == BalanceStrategy.ROUND_ROBIN
                    ? rotate(queues, rotation++)
                    : queues;
            try {
                client.popAny(order, props.getFetchTimeout()).ifPresent(this::dispatch);
            } catch (DataAccessException e) {
                log.error("[RedisProcessor] fetch failed queues={}, err={}", order, e.toString());
                if (!sleep(props.getPollInterval())) return;
            } catch (RuntimeException e) {
                log.error("[RedisProcessor] unexpected error queues={}, err={}", order, e.toString(), e);
                if (!sleep(props.getPollInterval())) return;
            }
        }
    }

    static List<String> rotate(List<String> queues, int by) {
        if (queues.size() < 2) return queues;
        int shift = Math.floorMod(by, queues.size());
        List<String> rotated = new ArrayList<>(queues.size());
        rotated.addAll(queues.subList(shift, queues.size()));
        rotated.addAll(queues.subList(0, shift));
        return rotated;
    }

    /**
     * Handles one popped job. Failures go to the retry set or, once out of retries, to the
     * failure action.
     */
    void dispatch(RedisQueueClient.Popped popped) {
        AppContext context = registry.getContext();
        WorkerConfig global = context.getProperties().getWorkerConfig();

        RedisJobRecord record;
        try {
            record = readRecord(popped.payload());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("[RedisProcessor] unreadable job key={}, err={}", popped.key(), e.toString());
            metrics.incFailed();
            metrics.incExhausted();
            client.dead(popped.payload());
            return;
        }

        Job job = record.job();
        String workerName = job.metadata().workerName();
        WorkerWrapper worker = workerName == null ? null : registry.worker(workerName).orElse(null);
        if (worker == null) {
            log.error("[RedisProcessor] no worker registered queue={}, worker={}", record.queue(), workerName);
            metrics.incFailed();
            metrics.incExhausted();
            completeFailed(popped.payload(), ConfigResolver.failureAction(global, null));
            return;
        }

        long start = System.nanoTime();
        try {
            worker.handle(context, job.args(), timeoutExecutor);
            metrics.incSucceeded();
            log.debug("[RedisProcessor] job succeeded queue={}, worker={}, jobId={}",
                    record.queue(), workerName, job.metadata().id());
        } catch (WorkerTimeoutException e) {
            log.error("[RedisProcessor] handler timed out queue={}, worker={}, jobId={}, maxDurationMs={}",
                    record.queue(), workerName, job.metadata().id(), e.getMaxDuration().toMillis());
            metrics.incFailed();
            retry(record, worker);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RedisProcessor] interrupted while handling, requeueing queue={}, jobId={}",
                    record.queue(), job.metadata().id());
            client.push(record.queue(), List.of(record));
        } catch (Exception e) {
            log.error("[RedisProcessor] handler failed queue={}, worker={}, jobId={}, attempt={}, err={}",
                    record.queue(), workerName, job.metadata().id(), record.retryCount() + 1, e.toString());
            metrics.incFailed();
            retry(record, worker);
        } finally {
            metrics.handlerTimer(workerName).record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private void retry(RedisJobRecord record, WorkerWrapper worker) {
        WorkerConfig global = registry.getContext().getProperties().getWorkerConfig();
        int attempt = record.retryCount() + 1;
        Optional<Duration> delay = Backoff.retryDelay(
                ConfigResolver.retryConfig(global), ConfigResolver.retryConfig(worker.getWorkerConfig()), attempt);
        if (delay.isPresent()) {
            metrics.incRetried();
            client.retry(record.withRetryCount(attempt), Instant.now().plus(delay.get()));
            log.info("[RedisProcessor] retry scheduled queue={}, jobId={}, attempt={}, delayMs={}",
                    record.queue(), record.job().metadata().id(), attempt, delay.get().toMillis());
            return;
        }
        metrics.incExhausted();
        completeFailed(client.toJson(record.withRetryCount(attempt)),
                ConfigResolver.failureAction(global, worker.getWorkerConfig()));
    }

    private RedisJobRecord readRecord(String payload) throws JsonProcessingException {
        RedisJobRecord record = client.parse(payload);
        if (record == null || record.queue() == null || record.job() == null || record.job().metadata() == null) {
            throw new IllegalArgumentException("job record without queue or metadata");
        }
        return record;
    }

    private void completeFailed(String payload, CompletedAction action) {
        if (action == CompletedAction.ARCHIVE) {
            client.dead(payload);
        }
        log.debug("[RedisProcessor] failed job completed action={}", action);
    }

    private void schedulerLoop() {
        Duration interval = properties().getPollInterval();
        while (!token.isCancelled()) {
            try {
                moveDue(client.scheduleKey());
                moveDue(client.retryKey());
            } catch (DataAccessException e) {
                log.error("[RedisProcessor] scheduler pass failed err={}", e.toString());
            } catch (RuntimeException e) {
                log.error("[RedisProcessor] unexpected scheduler error err={}", e.toString(), e);
            }
            if (!sleep(interval)) return;
        }
    }

    /**
     * Moves due members of a schedule or retry set into their queue lists.
     *
     * @return number of moved jobs
     */
    int moveDue(String key) {
        int moved = 0;
        for (String member : client.due(key, Instant.now(), MOVE_BATCH)) {
            if (!client.claim(key, member)) continue;
            RedisJobRecord record;
            try {
                record = readRecord(member);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.error("[RedisProcessor] unreadable scheduled job moved to dead key={}, err={}", key, e.toString());
                client.dead(member);
                continue;
            }
            client.push(record.queue(), List.of(record));
            moved++;
        }
        if (moved > 0) log.debug("[RedisProcessor] moved due jobs key={}, count={}", key, moved);
        return moved;
    }

    private void periodicLoop() {
        Duration interval = properties().getPollInterval();
        while (!token.isCancelled()) {
            try {
                enqueueDuePeriodic();
            } catch (DataAccessException e) {
                log.error("[RedisProcessor] periodic pass failed err={}", e.toString());
            } catch (RuntimeException e) {
                log.error("[RedisProcessor] unexpected periodic error err={}", e.toString(), e);
            }
            if (!sleep(interval)) return;
        }
    }

    /**
     * Claims every due periodic entry, pushes a fresh job for it and re-adds the entry scored at
     * its next fire time. Entries that cannot be read or routed are dropped.
     *
     * @return number of enqueued jobs
     */
    int enqueueDuePeriodic() {
        AppContext context = registry.getContext();
        int enqueued = 0;
        for (String member : client.due(client.periodicKey(), Instant.now(), MOVE_BATCH)) {
            if (!client.claim(client.periodicKey(), member)) continue;

            Job job;
            String schedule;
            try {
                job = context.getObjectMapper().readValue(member, Job.class);
                if (job == null || !job.isPeriodic() || job.metadata().workerName() == null) {
                    throw new IllegalArgumentException("missing periodic metadata");
                }
                schedule = PeriodicSchedule.normalize(job.metadata().periodic().schedule());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.error("[RedisProcessor] malformed periodic job dropped err={}", e.toString());
                continue;
            }

            String workerName = job.metadata().workerName();
            Optional<String> queue = registry.worker(workerName).flatMap(registry::queueOf);
            if (queue.isEmpty()) {
                log.error("[RedisProcessor] periodic job without registered worker or queue dropped worker={}", workerName);
                continue;
            }

            // 선점으로 빠진 항목을 먼저 다음 실행 시각으로 되돌림
            Instant now = Instant.now();
            client.addPeriodic(member, now.plus(PeriodicSchedule.nextRunDelay(schedule, now)));
            try {
                client.push(queue.get(), List.of(RedisJobRecord.of(queue.get(), Job.of(workerName, job.args()))));
            } catch (DataAccessException e) {
                log.error("[RedisProcessor] periodic enqueue failed, rescheduling now worker={}, queue={}, err={}",
                        workerName, queue.get(), e.toString());
                client.addPeriodic(member, Instant.now());
                continue;
            }
            metrics.incEnqueued(1);
            enqueued++;
            log.debug("[RedisProcessor] periodic job enqueued worker={}, queue={}", workerName, queue.get());
        }
        return enqueued;
    }

    // false 면 취소됨
    private boolean sleep(Duration duration) {
        try {
            return !token.await(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            return false;
        }
    }

    private RedisWorkerProperties properties() {
        return registry.getContext().getProperties().getRedis();
    }
}
