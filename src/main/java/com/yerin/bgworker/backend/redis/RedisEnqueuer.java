package com.yerin.bgworker.backend.redis;

import com.yerin.bgworker.domain.Job;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.worker.AbstractEnqueuer;
import com.yerin.bgworker.worker.AppContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Slf4j
public class RedisEnqueuer extends AbstractEnqueuer {

    private final RedisQueueClient client;

    public RedisEnqueuer(RedisQueueClient client, WorkerMetrics metrics) {
        super(metrics);
        this.client = client;
    }

    @Override
    protected void send(AppContext context, String queue, List<Job> jobs, Duration delay) {
        List<RedisJobRecord> records = jobs.stream().map(job -> RedisJobRecord.of(queue, job)).toList();
        if (delay.isZero() || delay.isNegative()) {
            client.push(queue, records);
            log.debug("[RedisEnqueuer] pushed queue={}, count={}", queue, records.size());
        } else {
            client.schedule(records, Instant.now().plus(delay));
            log.debug("[RedisEnqueuer] scheduled queue={}, count={}, delayMs={}", queue, records.size(), delay.toMillis());
        }
    }
}
