package com.yerin.bgworker.config;

import lombok.*;

/**
 * Per-queue settings. A queue listed under {@code queue-config} is removed from the shared pool
 * and polled by its own {@link #numWorkers} tasks.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueConfig {
    private Integer numWorkers;
}
