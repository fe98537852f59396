package com.yerin.bgworker.config;

import lombok.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Options used when enqueuing a job. The global values come from {@code bgworker.enqueue-config};
 * a worker overrides them by returning its own instance from {@code Worker#enqueueConfig}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnqueueConfig {

    /**
     * Name of the queue jobs are sent to. On the Postgres backend the name becomes part of a
     * table name, so keep it short.
     */
    private String queue;

    @Builder.Default
    private Map<String, Object> custom = new HashMap<>();
}
