package com.yerin.bgworker.domain;

/**
 * How a worker pool rotates among the queues it polls.
 */
public enum BalanceStrategy {
    ROUND_ROBIN,
    // 첫 번째 큐가 비어 있을 때만 다음 큐를 본다. 공유 큐가 2개 이상이면 기아 발생
    NONE
}
