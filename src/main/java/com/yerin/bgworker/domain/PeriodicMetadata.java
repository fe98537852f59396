package com.yerin.bgworker.domain;

/**
 * Cron schedule of a periodic job plus the content hash that identifies its definition.
 */
public record PeriodicMetadata(
        String schedule,
        long hash
) {}
