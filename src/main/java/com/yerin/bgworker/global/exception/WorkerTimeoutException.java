package com.yerin.bgworker.global.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Thrown in place of a handler result when the handler ran longer than its max duration.
 */
@Getter
public class WorkerTimeoutException extends Exception {

    private final String workerName;
    private final Duration maxDuration;

    public WorkerTimeoutException(String workerName, Duration maxDuration) {
        super("Worker " + workerName + " timed out after " + maxDuration.toSeconds() + " seconds");
        this.workerName = workerName;
        this.maxDuration = maxDuration;
    }
}
