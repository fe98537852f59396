package com.yerin.bgworker.global.exception.code;

public interface ErrorCode {
    String getMessage();
    String getCode();

    default ErrorCode withDetail(String detailMessage) {
        return new ErrorCode() {
            @Override
            public String getMessage() {
                return detailMessage;
            }

            @Override
            public String getCode() {
                return ErrorCode.this.getCode();
            }
        };
    }
}
