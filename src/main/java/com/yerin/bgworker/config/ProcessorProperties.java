package com.yerin.bgworker.config;

import com.yerin.bgworker.domain.BalanceStrategy;
import lombok.Getter;
import lombok.Setter;

import java.util.*;

/**
 * Settings shared by both queue backends.
 */
@Getter
@Setter
public abstract class ProcessorProperties {

    private boolean enable = false;

    /** Size of the shared worker pool. */
    private int numWorkers = Runtime.getRuntime().availableProcessors();

    private BalanceStrategy balanceStrategy = BalanceStrategy.ROUND_ROBIN;

    /** Queues to poll. {@code null} means every queue a registered worker uses. */
    private Set<String> queues;

    private Map<String, QueueConfig> queueConfig = new TreeMap<>();

    private PeriodicProperties periodic = new PeriodicProperties();

    /**
     * Queues polled by the shared pool: the configured (or registered) queues minus the ones
     * that have a dedicated entry in {@link #queueConfig}.
     */
    public List<String> sharedQueues(Set<String> registeredQueues) {
        Collection<String> candidates = queues != null ? new TreeSet<>(queues) : new TreeSet<>(registeredQueues);
        List<String> shared = new ArrayList<>();
        for (String queue : candidates) {
            if (!queueConfig.containsKey(queue)) shared.add(queue);
        }
        return shared;
    }

    public int dedicatedWorkers(String queue) {
        QueueConfig config = queueConfig.get(queue);
        if (config == null || config.getNumWorkers() == null) return 0;
        return config.getNumWorkers();
    }
}
