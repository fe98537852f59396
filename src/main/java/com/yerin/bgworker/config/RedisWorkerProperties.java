package com.yerin.bgworker.config;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Getter
@Setter
public class RedisWorkerProperties extends ProcessorProperties {

    /** Key prefix of every list and sorted set the engine uses. */
    private String prefix = "bgworker";

    /** BRPOP block time of a fetch task. */
    private Duration fetchTimeout = Duration.ofSeconds(2);

    /** How often the scheduler task checks the schedule, retry and periodic sets. */
    private Duration pollInterval = Duration.ofSeconds(1);
}
