package com.yerin.bgworker.global.exception;

import com.yerin.bgworker.global.exception.code.ErrorCode;
import lombok.Getter;

@Getter
public class WorkerException extends RuntimeException {

    private final ErrorCode errorCode;

    public WorkerException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public WorkerException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }
}
