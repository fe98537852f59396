package com.yerin.bgworker.domain;

public enum BackoffStrategy {
    EXPONENTIAL,
    LINEAR,
    NONE
}
