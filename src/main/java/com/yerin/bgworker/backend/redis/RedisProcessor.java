package com.yerin.bgworker.backend.redis;

import com.yerin.bgworker.config.PeriodicProperties;
import com.yerin.bgworker.domain.StaleCleanupBehavior;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.infra.CancellationToken;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.PeriodicDefinition;
import com.yerin.bgworker.worker.PeriodicSchedule;
import com.yerin.bgworker.worker.WorkerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Redis-backed processor. Startup seeds the periodic set; {@link #run} delegates to a
 * {@link RedisJobProcessor} whose token is linked with the caller's.
 */
@Slf4j
public class RedisProcessor {

    private final WorkerRegistry registry;
    private final RedisQueueClient client;
    private final RedisJobProcessor processor;

    RedisProcessor(WorkerRegistry registry, RedisQueueClient client, WorkerMetrics metrics) {
        this.registry = registry;
        this.client = client;
        this.processor = new RedisJobProcessor(registry, client, metrics);
    }

    public static RedisProcessorBuilder builder(AppContext context, RedisQueueClient client, WorkerMetrics metrics) {
        return new RedisProcessorBuilder(context, client, metrics);
    }

    public WorkerRegistry getRegistry() {
        return registry;
    }

    RedisJobProcessor getProcessor() {
        return processor;
    }

    public void beforeRun() {
        PeriodicProperties periodic = registry.getContext().getProperties().getRedis().getPeriodic();
        if (!periodic.isEnable()) return;

        if (periodic.getStaleCleanup() == StaleCleanupBehavior.AUTO_CLEAN_ALL) {
            client.deletePeriodicKey();
            log.info("[RedisProcessor] deleted all previously registered periodic jobs");
        }

        Set<String> registered = new HashSet<>();
        Instant now = Instant.now();
        for (PeriodicDefinition definition : registry.periodicDefinitions()) {
            String member = client.toJson(definition.toJob());
            registered.add(member);
            boolean added = client.addPeriodicIfAbsent(member, now.plus(PeriodicSchedule.nextRunDelay(definition.schedule(), now)));
            log.info("[RedisProcessor] periodic job registered worker={}, schedule={}, added={}",
                    definition.workerName(), definition.schedule(), added);
        }

        List<String> stale = client.periodicMembers().stream()
                .filter(member -> !registered.contains(member))
                .toList();
        if (stale.isEmpty()) {
            log.info("[RedisProcessor] no stale periodic jobs found");
            return;
        }
        switch (periodic.getStaleCleanup()) {
            case AUTO_CLEAN_STALE -> {
                long removed = client.removePeriodic(stale);
                log.info("[RedisProcessor] removed stale periodic jobs count={}", removed);
            }
            case MANUAL, AUTO_CLEAN_ALL -> log.warn("[RedisProcessor] found stale periodic jobs count={}", stale.size());
        }
    }

    /**
     * Blocks until either {@code token} or the inner processor's token is cancelled and every
     * task has stopped.
     */
    public void run(CancellationToken token) throws InterruptedException {
        CancellationToken.link(token, processor.getToken());
        processor.run();
    }
}
