package com.yerin.bgworker.domain;

/**
 * What to do on startup with periodic entries that are already in storage.
 */
public enum StaleCleanupBehavior {
    MANUAL,
    AUTO_CLEAN_ALL,
    AUTO_CLEAN_STALE
}
