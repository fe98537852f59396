package com.yerin.bgworker.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EnqueueErrorCode implements ErrorCode {
    NO_QUEUE("Unable to enqueue job, no queue configured.", "ENQUEUE-001"),
    SERIALIZATION("Unable to serialize job arguments.", "ENQUEUE-002"),
    BACKEND("The queue backend rejected the job.", "ENQUEUE-003"),
    NO_ENQUEUER("No enqueuer available for the worker's backend.", "ENQUEUE-004");

    private final String message;
    private final String code;
}
