package com.yerin.bgworker.backend.pg;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Heap entry of a poll task: a queue and the earliest time it should be read again.
 */
@Getter
@Setter
class QueueItem implements Comparable<QueueItem> {

    private final String name;
    private Instant nextFetch;

    QueueItem(String name, Instant nextFetch) {
        this.name = name;
        this.nextFetch = nextFetch;
    }

    @Override
    public int compareTo(QueueItem other) {
        int byTime = nextFetch.compareTo(other.nextFetch);
        return byTime != 0 ? byTime : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name + "@" + nextFetch;
    }
}
