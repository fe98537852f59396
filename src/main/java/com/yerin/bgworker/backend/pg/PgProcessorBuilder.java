package com.yerin.bgworker.backend.pg;

import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.PeriodicArgs;
import com.yerin.bgworker.worker.Worker;
import com.yerin.bgworker.worker.WorkerRegistry;

public class PgProcessorBuilder {

    private final WorkerRegistry registry;
    private final PgQueueClient client;
    private final WorkerMetrics metrics;

    PgProcessorBuilder(AppContext context, PgQueueClient client, WorkerMetrics metrics) {
        this.registry = new WorkerRegistry(context);
        this.client = client;
        this.metrics = metrics;
    }

    public <A> PgProcessorBuilder register(Worker<A> worker) {
        registry.register(worker);
        return this;
    }

    public <A> PgProcessorBuilder registerPeriodic(Worker<A> worker, PeriodicArgs<A> periodicArgs) {
        registry.registerPeriodic(worker, periodicArgs);
        return this;
    }

    public PgProcessor build() {
        return new PgProcessor(registry, client, metrics);
    }
}
