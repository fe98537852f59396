package com.yerin.bgworker.worker;

import com.yerin.bgworker.config.EnqueueConfig;
import com.yerin.bgworker.config.WorkerConfig;
import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.List;

/**
 * Contract for background job handlers.
 *
 * <p>A worker is registered with a processor builder and dispatched by {@link #name()}, so the
 * name must stay stable across deploys: renaming a worker orphans the jobs already enqueued for
 * it, periodic ones included.
 *
 * <pre>{@code
 * @Component
 * public class EmailWelcomeWorker implements Worker<EmailWelcomeArgs> {
 *     @Override
 *     public Class<? extends Enqueuer> enqueuerType() {
 *         return PgEnqueuer.class;
 *     }
 *
 *     @Override
 *     public void handle(AppContext context, EmailWelcomeArgs args) {
 *         // send the mail...
 *     }
 * }
 * }</pre>
 *
 * @param <A> type of the job arguments, serialized to JSON when enqueued
 */
public interface Worker<A> {

    /**
     * Dispatch key of the worker. Defaults to the simple name of the implementing class.
     */
    default String name() {
        return ClassUtils.getUserClass(this).getSimpleName();
    }

    /**
     * Type the stored JSON arguments are read back into. Resolved from the generic parameter by
     * default; override when the implementation does not bind {@code A} to a concrete type.
     */
    default Type argsType() {
        Type type = ResolvableType.forClass(ClassUtils.getUserClass(this))
                .as(Worker.class)
                .getGeneric(0)
                .getType();
        if (type == null || type == Object.class) {
            throw new IllegalStateException("Unable to resolve args type of worker " + name());
        }
        return type;
    }

    /**
     * Worker-specific enqueue options. Unset fields fall back to {@code bgworker.enqueue-config}.
     */
    default EnqueueConfig enqueueConfig(AppContext context) {
        return new EnqueueConfig();
    }

    /**
     * Worker-specific handling options. Unset fields fall back to {@code bgworker.worker-config}.
     */
    default WorkerConfig workerConfig(AppContext context) {
        return new WorkerConfig();
    }

    /**
     * Backend used by the {@code enqueue*} helpers.
     */
    Class<? extends Enqueuer> enqueuerType();

    /**
     * Handles one job. May run concurrently on several threads.
     *
     * @throws Exception any failure; the job is retried according to the resolved retry config
     */
    void handle(AppContext context, A args) throws Exception;

    default void enqueue(AppContext context, A args) {
        context.enqueuer(enqueuerType()).enqueue(context, this, args);
    }

    default void enqueueDelayed(AppContext context, A args, Duration delay) {
        context.enqueuer(enqueuerType()).enqueueDelayed(context, this, args, delay);
    }

    default void enqueueBatch(AppContext context, List<A> args) {
        context.enqueuer(enqueuerType()).enqueueBatch(context, this, args);
    }

    default void enqueueBatchDelayed(AppContext context, List<A> args, Duration delay) {
        context.enqueuer(enqueuerType()).enqueueBatchDelayed(context, this, args, delay);
    }
}
