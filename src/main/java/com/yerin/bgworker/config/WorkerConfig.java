package com.yerin.bgworker.config;

import lombok.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Options used when handling a job. Global values come from {@code bgworker.worker-config}; a
 * worker overrides any field by returning its own instance from {@code Worker#workerConfig}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkerConfig {

    /** Whether {@link #maxDuration} is enforced on the handler. */
    private Boolean timeout;

    private Duration maxDuration;

    /** Without a retry config, either global or per worker, failed jobs are not retried. */
    private RetryConfig retryConfig;

    private PgWorkerConfig pg;

    @Builder.Default
    private Map<String, Object> custom = new HashMap<>();
}
