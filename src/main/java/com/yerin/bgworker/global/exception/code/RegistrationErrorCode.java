package com.yerin.bgworker.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RegistrationErrorCode implements ErrorCode {
    NO_QUEUE("No queue configured for worker.", "REGISTER-001"),
    ALREADY_REGISTERED("The provided worker was already registered.", "REGISTER-002"),
    ALREADY_REGISTERED_WITH_DIFFERENT_TYPE("The provided worker name was already registered for a different type.", "REGISTER-003"),
    ALREADY_REGISTERED_PERIODIC("The provided periodic worker job was already registered.", "REGISTER-004"),
    INVALID_SCHEDULE("The provided cron schedule is invalid.", "REGISTER-005"),
    INVALID_BALANCE_STRATEGY("NONE balance strategy is not supported when more than one shared queue is enabled.", "REGISTER-006"),
    INVALID_QUEUE_NAME("Queue names may only contain lowercase letters, digits and underscores.", "REGISTER-007");

    private final String message;
    private final String code;
}
