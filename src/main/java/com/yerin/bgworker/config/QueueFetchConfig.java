package com.yerin.bgworker.config;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Getter
@Setter
public class QueueFetchConfig {
    /** Wait before polling a queue again after it returned no message. */
    private Duration emptyDelay = Duration.ofSeconds(10);
    /** Wait before polling a queue again after a read failed. */
    private Duration errorDelay = Duration.ofSeconds(10);
}
