package com.yerin.bgworker.config;

import com.yerin.bgworker.domain.CompletedAction;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Two-level lookup of worker settings: the worker's own value wins, then the global value from
 * {@link WorkerProperties}. Every method takes both levels as arguments.
 */
public final class ConfigResolver {
    private ConfigResolver() {}

    public static <C, T> Optional<T> resolve(C global, C override, Function<C, T> field) {
        T value = override == null ? null : field.apply(override);
        if (value != null) return Optional.of(value);
        return Optional.ofNullable(global == null ? null : field.apply(global));
    }

    public static Optional<String> queue(EnqueueConfig global, EnqueueConfig worker) {
        return resolve(global, worker, EnqueueConfig::getQueue);
    }

    public static boolean timeout(WorkerConfig global, WorkerConfig worker) {
        return resolve(global, worker, WorkerConfig::getTimeout).orElse(false);
    }

    public static Optional<Duration> maxDuration(WorkerConfig global, WorkerConfig worker) {
        return resolve(global, worker, WorkerConfig::getMaxDuration);
    }

    public static CompletedAction successAction(WorkerConfig global, WorkerConfig worker) {
        return resolve(pg(global), pg(worker), PgWorkerConfig::getSuccessAction)
                .orElse(CompletedAction.DELETE);
    }

    public static CompletedAction failureAction(WorkerConfig global, WorkerConfig worker) {
        return resolve(pg(global), pg(worker), PgWorkerConfig::getFailureAction)
                .orElse(CompletedAction.ARCHIVE);
    }

    public static RetryConfig retryConfig(WorkerConfig config) {
        return config == null ? null : config.getRetryConfig();
    }

    /**
     * Merges a worker config over the global one so later lookups need only one object.
     */
    public static WorkerConfig effective(WorkerConfig global, WorkerConfig worker) {
        RetryConfig globalRetry = retryConfig(global);
        RetryConfig workerRetry = retryConfig(worker);
        RetryConfig retry = (globalRetry == null && workerRetry == null) ? null : RetryConfig.builder()
                .maxRetries(resolve(globalRetry, workerRetry, RetryConfig::getMaxRetries).orElse(null))
                .delay(resolve(globalRetry, workerRetry, RetryConfig::getDelay).orElse(null))
                .delayOffset(resolve(globalRetry, workerRetry, RetryConfig::getDelayOffset).orElse(null))
                .maxDelay(resolve(globalRetry, workerRetry, RetryConfig::getMaxDelay).orElse(null))
                .backoffStrategy(resolve(globalRetry, workerRetry, RetryConfig::getBackoffStrategy).orElse(null))
                .build();

        return WorkerConfig.builder()
                .timeout(timeout(global, worker))
                .maxDuration(maxDuration(global, worker).orElse(null))
                .retryConfig(retry)
                .pg(PgWorkerConfig.builder()
                        .successAction(successAction(global, worker))
                        .failureAction(failureAction(global, worker))
                        .build())
                .build();
    }

    private static PgWorkerConfig pg(WorkerConfig config) {
        return config == null ? null : config.getPg();
    }
}
