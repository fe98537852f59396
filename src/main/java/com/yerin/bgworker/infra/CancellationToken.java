package com.yerin.bgworker.infra;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative shutdown signal shared by every processor task. Loops pass it to each wait so that
 * cancelling wakes them up immediately; nothing is interrupted mid-dispatch.
 */
@Slf4j
public class CancellationToken {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (latch.getCount() == 0) return;
        latch.countDown();
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("[CancellationToken] cancel callback failed: {}", e.toString());
            }
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the token is cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (isCancelled()) return true;
        if (timeout.isZero() || timeout.isNegative()) return false;
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void await() throws InterruptedException {
        latch.await();
    }

    /**
     * Runs {@code callback} once the token is cancelled, right away if it already is.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            // cancel() 과 경합해도 콜백은 멱등이어야 함
            callback.run();
        }
    }

    /**
     * Cancels both tokens as soon as either one is cancelled.
     */
    public static void link(CancellationToken a, CancellationToken b) {
        a.onCancel(b::cancel);
        b.onCancel(a::cancel);
    }
}
