package com.yerin.bgworker.backend.pg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.bgworker.config.ConfigResolver;
import com.yerin.bgworker.config.PgWorkerProperties;
import com.yerin.bgworker.config.WorkerConfig;
import com.yerin.bgworker.domain.BalanceStrategy;
import com.yerin.bgworker.domain.CompletedAction;
import com.yerin.bgworker.domain.Job;
import com.yerin.bgworker.domain.JobMetadata;
import com.yerin.bgworker.domain.QueueMessage;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.global.exception.WorkerException;
import com.yerin.bgworker.global.exception.WorkerTimeoutException;
import com.yerin.bgworker.global.exception.code.RegistrationErrorCode;
import com.yerin.bgworker.infra.Backoff;
import com.yerin.bgworker.infra.CancellationToken;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.PeriodicDefinition;
import com.yerin.bgworker.worker.PeriodicSchedule;
import com.yerin.bgworker.worker.WorkerRegistry;
import com.yerin.bgworker.worker.WorkerWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Postgres-backed processor. Each task polls its queues through a min-heap ordered by the next
 * fetch time, reads one message at a time under a visibility timeout and dispatches it to the
 * registered worker.
 */
@Slf4j
public class PgProcessor {

    public static final String PERIODIC_QUEUE_NAME = PgQueueClient.PERIODIC_QUEUE;

    static final Duration DEFAULT_VISIBILITY_TIMEOUT = Duration.ofSeconds(30);

    private final WorkerRegistry registry;
    private final PgQueueClient client;
    private final WorkerMetrics metrics;
    private volatile ExecutorService timeoutExecutor = newTimeoutExecutor();

    PgProcessor(WorkerRegistry registry, PgQueueClient client, WorkerMetrics metrics) {
        this.registry = registry;
        this.client = client;
        this.metrics = metrics;
    }

    public static PgProcessorBuilder builder(AppContext context, PgQueueClient client, WorkerMetrics metrics) {
        return new PgProcessorBuilder(context, client, metrics);
    }

    public WorkerRegistry getRegistry() {
        return registry;
    }

    private static ExecutorService newTimeoutExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("bgworker-pg-handler-"));
    }

    /**
     * Validates the queue layout and prepares storage: queue tables, the periodic table and its
     * hash index, stale periodic cleanup and seeding of the registered periodic jobs.
     *
     * @throws WorkerException when the balance strategy does not fit the shared queues
     */
    public void beforeRun() {
        PgWorkerProperties props = properties();
        List<String> shared = props.sharedQueues(registry.queues());
        if (props.getBalanceStrategy() == BalanceStrategy.NONE && shared.size() > 1) {
            log.error("[PgProcessor] NONE balance strategy with multiple shared queues queues={}", shared);
            throw new WorkerException(RegistrationErrorCode.INVALID_BALANCE_STRATEGY);
        }

        for (String queue : registry.queues()) {
            client.create(queue);
            log.info("[PgProcessor] queue ready queue={}", queue);
        }

        if (props.getPeriodic().isEnable()) {
            initializePeriodic();
        }
    }

    private void initializePeriodic() {
        client.create(PERIODIC_QUEUE_NAME);
        client.createPeriodicHashIndex();

        switch (properties().getPeriodic().getStaleCleanup()) {
            case AUTO_CLEAN_ALL -> {
                int deleted = client.purge(PERIODIC_QUEUE_NAME);
                log.info("[PgProcessor] periodic jobs purged count={}", deleted);
            }
            case AUTO_CLEAN_STALE -> {
                int deleted = client.deletePeriodicNotIn(registry.periodicHashes());
                log.info("[PgProcessor] stale periodic jobs removed count={}", deleted);
            }
            case MANUAL -> log.debug("[PgProcessor] periodic cleanup skipped (MANUAL)");
        }

        for (PeriodicDefinition definition : registry.periodicDefinitions()) {
            Duration delay = PeriodicSchedule.nextRunDelay(definition.schedule(), Instant.now());
            try {
                client.send(PERIODIC_QUEUE_NAME, List.of(definition.toJob()), delay);
                log.info("[PgProcessor] periodic job seeded worker={}, schedule={}, hash={}, delayMs={}",
                        definition.workerName(), definition.schedule(), definition.hash(), delay.toMillis());
            } catch (DuplicateKeyException e) {
                log.debug("[PgProcessor] periodic job already present worker={}, hash={}",
                        definition.workerName(), definition.hash());
            }
        }
    }

    /**
     * Starts every poll task and blocks until {@code token} is cancelled and the tasks have
     * stopped. A task that ends for any reason cancels the token.
     */
    public void run(CancellationToken token) throws InterruptedException {
        PgWorkerProperties props = properties();
        List<Runnable> tasks = new ArrayList<>();

        List<String> shared = props.sharedQueues(registry.queues());
        if (!shared.isEmpty()) {
            int numWorkers = props.getNumWorkers();
            for (int i = 0; i < numWorkers; i++) {
                int taskNum = i + 1;
                tasks.add(() -> processQueues(token, "shared-" + taskNum + "/" + numWorkers, shared));
            }
        }

        for (String queue : props.getQueueConfig().keySet()) {
            int numWorkers = props.dedicatedWorkers(queue);
            for (int i = 0; i < numWorkers; i++) {
                int taskNum = i + 1;
                tasks.add(() -> processQueues(token, queue + "-" + taskNum + "/" + numWorkers, List.of(queue)));
            }
        }

        if (props.getPeriodic().isEnable() && !registry.periodicDefinitions().isEmpty()) {
            tasks.add(() -> processPeriodic(token));
        }

        if (tasks.isEmpty()) {
            log.warn("[PgProcessor] nothing to run, no queue or periodic job assigned");
            token.await();
            return;
        }

        if (timeoutExecutor.isShutdown()) {
            timeoutExecutor = newTimeoutExecutor();
        }
        ExecutorService pool = Executors.newFixedThreadPool(tasks.size(), new CustomizableThreadFactory("bgworker-pg-"));
        for (Runnable task : tasks) {
            pool.submit(() -> {
                try {
                    task.run();
                } catch (RuntimeException | Error e) {
                    log.error("[PgProcessor] task crashed, shutting down: {}", e.toString(), e);
                } finally {
                    token.cancel();
                }
            });
        }
        log.info("[PgProcessor] started tasks={}, sharedQueues={}, dedicated={}",
                tasks.size(), shared, props.getQueueConfig().keySet());

        try {
            token.await();
        } catch (InterruptedException e) {
            token.cancel();
            throw e;
        } finally {
            pool.shutdown();
            while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("[PgProcessor] waiting for tasks to stop");
            }
            timeoutExecutor.shutdownNow();
            log.info("[PgProcessor] stopped");
        }
    }

    private void processQueues(CancellationToken token, String taskName, List<String> queues) {
        PriorityQueue<QueueItem> heap = new PriorityQueue<>();
        Instant now = Instant.now();
        for (String queue : queues) heap.add(new QueueItem(queue, now));
        log.debug("[PgProcessor] task started task={}, queues={}", taskName, queues);

        while (true) {
            QueueItem item = heap.poll();
            if (!waitUntil(token, item.getNextFetch())) {
                log.debug("[PgProcessor] task exiting task={}", taskName);
                return;
            }
            try {
                item.setNextFetch(fetchAndDispatch(item.getName()));
            } catch (RuntimeException e) {
                log.error("[PgProcessor] unexpected error task={}, queue={}, err={}", taskName, item.getName(), e.toString(), e);
                item.setNextFetch(Instant.now().plus(fetchConfigErrorDelay()));
            }
            heap.add(item);
        }
    }

    private void processPeriodic(CancellationToken token) {
        Instant nextFetch = Instant.now();
        while (true) {
            if (!waitUntil(token, nextFetch)) {
                log.debug("[PgProcessor] periodic task exiting");
                return;
            }
            try {
                nextFetch = processPeriodicOnce();
            } catch (RuntimeException e) {
                log.error("[PgProcessor] unexpected periodic error err={}", e.toString(), e);
                nextFetch = Instant.now().plus(fetchConfigErrorDelay());
            }
        }
    }

    // false 면 취소됨
    private boolean waitUntil(CancellationToken token, Instant at) {
        Duration wait = Duration.between(Instant.now(), at);
        try {
            return !token.await(wait.isNegative() ? Duration.ZERO : wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            return false;
        }
    }

    /**
     * Reads at most one message from {@code queue} and handles it.
     *
     * @return when the queue should be read next
     */
    Instant fetchAndDispatch(String queue) {
        AppContext context = registry.getContext();
        WorkerConfig global = context.getProperties().getWorkerConfig();

        Optional<QueueMessage> read;
        try {
            read = client.read(queue, ConfigResolver.maxDuration(global, null).orElse(DEFAULT_VISIBILITY_TIMEOUT));
        } catch (DataAccessException e) {
            log.error("[PgProcessor] read failed queue={}, err={}", queue, e.toString());
            return Instant.now().plus(fetchConfigErrorDelay());
        }
        if (read.isEmpty()) {
            return Instant.now().plus(properties().getQueueFetchConfig().getEmptyDelay());
        }

        QueueMessage msg = read.get();
        Job job;
        try {
            job = readJob(context, msg.message());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("[PgProcessor] unreadable job queue={}, msgId={}, err={}", queue, msg.msgId(), e.toString());
            metrics.incFailed();
            retry(queue, msg, null);
            return Instant.now();
        }

        String workerName = job.metadata().workerName();
        WorkerWrapper worker = workerName == null ? null : registry.worker(workerName).orElse(null);
        if (worker == null) {
            log.error("[PgProcessor] no worker registered queue={}, msgId={}, worker={}", queue, msg.msgId(), workerName);
            metrics.incFailed();
            metrics.incExhausted();
            jobCompleted(queue, job.metadata(), msg, ConfigResolver.failureAction(global, null));
            return Instant.now();
        }

        Optional<Duration> workerMaxDuration = Optional.ofNullable(worker.getWorkerConfig())
                .map(WorkerConfig::getMaxDuration);
        if (workerMaxDuration.isPresent() && !workerMaxDuration.equals(ConfigResolver.maxDuration(global, null))) {
            updateVisibilityTimeout(queue, job.metadata(), msg, workerMaxDuration.get());
        }

        long start = System.nanoTime();
        try {
            worker.handle(context, job.args(), timeoutExecutor);
        } catch (WorkerTimeoutException e) {
            log.error("[PgProcessor] handler timed out queue={}, worker={}, jobId={}, maxDurationMs={}",
                    queue, workerName, job.metadata().id(), e.getMaxDuration().toMillis());
            metrics.incFailed();
            retry(queue, msg, worker);
            return Instant.now();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[PgProcessor] interrupted while handling queue={}, msgId={}", queue, msg.msgId());
            return Instant.now();
        } catch (Exception e) {
            log.error("[PgProcessor] handler failed queue={}, worker={}, jobId={}, attempt={}, err={}",
                    queue, workerName, job.metadata().id(), msg.readCount(), e.toString());
            metrics.incFailed();
            retry(queue, msg, worker);
            return Instant.now();
        } finally {
            metrics.handlerTimer(workerName).record(Duration.ofNanos(System.nanoTime() - start));
        }

        metrics.incSucceeded();
        jobCompleted(queue, job.metadata(), msg, ConfigResolver.successAction(global, worker.getWorkerConfig()));
        return Instant.now();
    }

    /**
     * Re-enqueues at most one due periodic job into its worker's queue and pushes the periodic
     * entry out to the next fire time.
     *
     * @return when the periodic queue should be read next
     */
    Instant processPeriodicOnce() {
        AppContext context = registry.getContext();
        Duration visibilityTimeout = ConfigResolver.maxDuration(context.getProperties().getWorkerConfig(), null)
                .orElse(DEFAULT_VISIBILITY_TIMEOUT);

        Optional<QueueMessage> read;
        try {
            read = client.read(PERIODIC_QUEUE_NAME, visibilityTimeout);
        } catch (DataAccessException e) {
            log.error("[PgProcessor] periodic read failed err={}", e.toString());
            return Instant.now().plus(fetchConfigErrorDelay());
        }
        if (read.isEmpty()) {
            return Instant.now().plus(properties().getQueueFetchConfig().getEmptyDelay());
        }

        QueueMessage msg = read.get();
        Job job;
        String schedule;
        try {
            job = readJob(context, msg.message());
            if (!job.isPeriodic() || job.metadata().workerName() == null) {
                throw new IllegalArgumentException("missing periodic metadata");
            }
            schedule = PeriodicSchedule.normalize(job.metadata().periodic().schedule());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("[PgProcessor] malformed periodic job, deleting msgId={}, err={}", msg.msgId(), e.toString());
            return deletePeriodic(msg);
        }

        String workerName = job.metadata().workerName();
        Optional<WorkerWrapper> worker = registry.worker(workerName);
        Optional<String> queue = worker.flatMap(registry::queueOf);
        if (queue.isEmpty()) {
            log.error("[PgProcessor] periodic job without registered worker or queue, deleting msgId={}, worker={}",
                    msg.msgId(), workerName);
            return deletePeriodic(msg);
        }

        // 재예약이 먼저, 재예약에 실패하면 이번 회차는 넣지 않음
        Duration delay = PeriodicSchedule.nextRunDelay(schedule, Instant.now());
        try {
            client.setVisibilityTimeout(PERIODIC_QUEUE_NAME, msg.msgId(), delay);
        } catch (DataAccessException e) {
            log.warn("[PgProcessor] periodic reschedule failed, skipping enqueue worker={}, msgId={}, err={}",
                    workerName, msg.msgId(), e.toString());
            return Instant.now().plus(fetchConfigErrorDelay());
        }

        try {
            client.send(queue.get(), List.of(Job.of(workerName, job.args())), Duration.ZERO);
            metrics.incEnqueued(1);
        } catch (DataAccessException e) {
            log.error("[PgProcessor] periodic enqueue failed worker={}, queue={}, err={}",
                    workerName, queue.get(), e.toString());
            updateVisibilityTimeout(PERIODIC_QUEUE_NAME, job.metadata(), msg, fetchConfigErrorDelay());
            return Instant.now().plus(fetchConfigErrorDelay());
        }
        log.debug("[PgProcessor] periodic job enqueued worker={}, queue={}, nextInMs={}",
                workerName, queue.get(), delay.toMillis());
        return Instant.now();
    }

    private static Job readJob(AppContext context, JsonNode message) throws JsonProcessingException {
        Job job = context.getObjectMapper().treeToValue(message, Job.class);
        if (job == null || job.metadata() == null) {
            throw new IllegalArgumentException("job without metadata");
        }
        return job;
    }

    private Instant deletePeriodic(QueueMessage msg) {
        try {
            client.delete(PERIODIC_QUEUE_NAME, msg.msgId());
            return Instant.now();
        } catch (DataAccessException e) {
            log.error("[PgProcessor] periodic delete failed msgId={}, err={}", msg.msgId(), e.toString());
            return Instant.now().plus(fetchConfigErrorDelay());
        }
    }

    private void retry(String queue, QueueMessage msg, WorkerWrapper worker) {
        WorkerConfig global = registry.getContext().getProperties().getWorkerConfig();
        WorkerConfig own = worker == null ? null : worker.getWorkerConfig();

        Optional<Duration> delay = Backoff.retryDelay(
                ConfigResolver.retryConfig(global), ConfigResolver.retryConfig(own), msg.readCount());
        if (delay.isPresent()) {
            metrics.incRetried();
            log.info("[PgProcessor] retry scheduled queue={}, msgId={}, attempt={}, delayMs={}",
                    queue, msg.msgId(), msg.readCount(), delay.get().toMillis());
            updateVisibilityTimeout(queue, null, msg, delay.get());
            return;
        }

        metrics.incExhausted();
        jobCompleted(queue, null, msg, ConfigResolver.failureAction(global, own));
    }

    private void updateVisibilityTimeout(String queue, JobMetadata metadata, QueueMessage msg, Duration delay) {
        try {
            client.setVisibilityTimeout(queue, msg.msgId(), delay);
        } catch (DataAccessException e) {
            log.error("[PgProcessor] visibility timeout update failed queue={}, msgId={}, jobId={}, err={}",
                    queue, msg.msgId(), metadata == null ? null : metadata.id(), e.toString());
        }
    }

    private void jobCompleted(String queue, JobMetadata metadata, QueueMessage msg, CompletedAction action) {
        String jobId = metadata == null ? null : metadata.id();
        try {
            switch (action) {
                case ARCHIVE -> client.archive(queue, msg.msgId());
                case DELETE -> client.delete(queue, msg.msgId());
            }
            log.debug("[PgProcessor] job completed queue={}, msgId={}, jobId={}, action={}",
                    queue, msg.msgId(), jobId, action);
        } catch (DataAccessException e) {
            log.error("[PgProcessor] completion failed queue={}, msgId={}, jobId={}, action={}, err={}",
                    queue, msg.msgId(), jobId, action, e.toString());
        }
    }

    private Duration fetchConfigErrorDelay() {
        return properties().getQueueFetchConfig().getErrorDelay();
    }

    private PgWorkerProperties properties() {
        return registry.getContext().getProperties().getPg();
    }
}
