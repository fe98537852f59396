package com.yerin.bgworker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Root of the {@code bgworker.*} configuration. This is the snapshot every resolution in
 * {@link ConfigResolver} receives explicitly.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "bgworker")
public class WorkerProperties {

    private EnqueueConfig enqueueConfig = new EnqueueConfig();

    private WorkerConfig workerConfig = new WorkerConfig();

    private PgWorkerProperties pg = new PgWorkerProperties();

    private RedisWorkerProperties redis = new RedisWorkerProperties();

    private Runner runner = new Runner();

    @Getter
    @Setter
    public static class Runner {
        /** Start the registered processors with the application context. */
        private boolean enabled = true;
    }
}
