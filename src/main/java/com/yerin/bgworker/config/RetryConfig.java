package com.yerin.bgworker.config;

import com.yerin.bgworker.domain.BackoffStrategy;
import lombok.*;

import java.time.Duration;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetryConfig {

    private Integer maxRetries;

    /** Base delay between attempts. */
    private Duration delay;

    /** Upper bound of the random jitter added to the computed delay. */
    private Duration delayOffset;

    private Duration maxDelay;

    private BackoffStrategy backoffStrategy;
}
