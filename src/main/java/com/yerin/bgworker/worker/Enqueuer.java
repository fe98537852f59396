package com.yerin.bgworker.worker;

import java.time.Duration;
import java.util.List;

/**
 * Backend-agnostic enqueue operations. Failures are thrown to the caller and never retried.
 */
public interface Enqueuer {

    <A> void enqueue(AppContext context, Worker<A> worker, A args);

    <A> void enqueueDelayed(AppContext context, Worker<A> worker, A args, Duration delay);

    <A> void enqueueBatch(AppContext context, Worker<A> worker, List<A> args);

    <A> void enqueueBatchDelayed(AppContext context, Worker<A> worker, List<A> args, Duration delay);
}
