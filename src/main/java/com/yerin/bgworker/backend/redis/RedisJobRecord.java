package com.yerin.bgworker.backend.redis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.yerin.bgworker.domain.Job;

/**
 * What is stored in a Redis list or sorted set: the job plus the queue it belongs to and how many
 * times it has failed so far.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RedisJobRecord(
        String queue,
        Job job,
        int retryCount
) {
    public static RedisJobRecord of(String queue, Job job) {
        return new RedisJobRecord(queue, job, 0);
    }

    public RedisJobRecord withRetryCount(int retryCount) {
        return new RedisJobRecord(queue, job, retryCount);
    }
}
