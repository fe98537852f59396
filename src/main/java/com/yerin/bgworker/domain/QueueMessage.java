package com.yerin.bgworker.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A row read from a Postgres queue table. The message is kept as a raw {@link JsonNode} so the
 * msg id stays known even when the envelope cannot be mapped to a {@link Job}.
 */
public record QueueMessage(
        long msgId,
        int readCount,
        Instant enqueuedAt,
        Instant visibilityTimeout,
        JsonNode message
) {}
