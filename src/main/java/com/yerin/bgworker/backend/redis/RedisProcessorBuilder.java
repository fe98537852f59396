package com.yerin.bgworker.backend.redis;

import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.PeriodicArgs;
import com.yerin.bgworker.worker.Worker;
import com.yerin.bgworker.worker.WorkerRegistry;

public class RedisProcessorBuilder {

    private final WorkerRegistry registry;
    private final RedisQueueClient client;
    private final WorkerMetrics metrics;

    RedisProcessorBuilder(AppContext context, RedisQueueClient client, WorkerMetrics metrics) {
        this.registry = new WorkerRegistry(context);
        this.client = client;
        this.metrics = metrics;
    }

    public <A> RedisProcessorBuilder register(Worker<A> worker) {
        registry.register(worker);
        return this;
    }

    public <A> RedisProcessorBuilder registerPeriodic(Worker<A> worker, PeriodicArgs<A> periodicArgs) {
        registry.registerPeriodic(worker, periodicArgs);
        return this;
    }

    public RedisProcessor build() {
        return new RedisProcessor(registry, client, metrics);
    }
}
