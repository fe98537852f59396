package com.yerin.bgworker.backend.pg;

import com.yerin.bgworker.domain.Job;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.worker.AbstractEnqueuer;
import com.yerin.bgworker.worker.AppContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

@Slf4j
public class PgEnqueuer extends AbstractEnqueuer {

    private final PgQueueClient client;

    public PgEnqueuer(PgQueueClient client, WorkerMetrics metrics) {
        super(metrics);
        this.client = client;
    }

    @Override
    protected void send(AppContext context, String queue, List<Job> jobs, Duration delay) {
        List<Long> ids = client.send(queue, jobs, delay);
        log.debug("[PgEnqueuer] enqueued queue={}, msgIds={}, delayMs={}", queue, ids, delay.toMillis());
    }
}
