package com.yerin.bgworker.worker;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.bgworker.config.ConfigResolver;
import com.yerin.bgworker.config.EnqueueConfig;
import com.yerin.bgworker.config.WorkerConfig;
import com.yerin.bgworker.global.exception.WorkerTimeoutException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ClassUtils;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Type-erased registry entry: the worker's resolved configuration plus a closure that reads the
 * JSON arguments into the worker's own type and invokes it.
 */
@Slf4j
@Getter
public class WorkerWrapper {

    @FunctionalInterface
    interface Dispatch {
        void dispatch(AppContext context, JsonNode args) throws Exception;
    }

    private final String name;
    private final Class<?> workerType;
    private final EnqueueConfig enqueueConfig;
    private final WorkerConfig workerConfig;
    private final Dispatch dispatch;

    WorkerWrapper(String name, Class<?> workerType, EnqueueConfig enqueueConfig,
                  WorkerConfig workerConfig, Dispatch dispatch) {
        this.name = name;
        this.workerType = workerType;
        this.enqueueConfig = enqueueConfig;
        this.workerConfig = workerConfig;
        this.dispatch = dispatch;
    }

    public static <A> WorkerWrapper of(AppContext context, Worker<A> worker) {
        JavaType argsType = context.getObjectMapper().getTypeFactory().constructType(worker.argsType());
        Dispatch dispatch = (ctx, args) -> {
            A typed = ctx.getObjectMapper().treeToValue(args, argsType);
            worker.handle(ctx, typed);
        };
        return new WorkerWrapper(worker.name(), ClassUtils.getUserClass(worker),
                worker.enqueueConfig(context), worker.workerConfig(context), dispatch);
    }

    /**
     * Invokes the worker. When the resolved {@code timeout} is on and a max duration is set, the
     * call runs on {@code timeoutExecutor} and is abandoned once the duration is exceeded; the
     * abandoned handler is interrupted but may keep its side effects.
     */
    public void handle(AppContext context, JsonNode args, ExecutorService timeoutExecutor) throws Exception {
        WorkerConfig global = context.getProperties().getWorkerConfig();
        Optional<Duration> maxDuration = ConfigResolver.maxDuration(global, workerConfig);
        if (!ConfigResolver.timeout(global, workerConfig) || maxDuration.isEmpty()) {
            dispatch.dispatch(context, args);
            return;
        }

        Future<?> future = timeoutExecutor.submit(() -> {
            dispatch.dispatch(context, args);
            return null;
        });
        try {
            future.get(maxDuration.get().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new WorkerTimeoutException(name, maxDuration.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw e;
        }
    }

    public WorkerConfig effectiveConfig(AppContext context) {
        return ConfigResolver.effective(context.getProperties().getWorkerConfig(), workerConfig);
    }
}
