package com.yerin.bgworker.domain;

/**
 * Terminal disposition of a message that will not be retried anymore.
 */
public enum CompletedAction {
    ARCHIVE,
    DELETE
}
