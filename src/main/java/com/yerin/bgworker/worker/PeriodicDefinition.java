package com.yerin.bgworker.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgworker.domain.Job;
import com.yerin.bgworker.domain.PeriodicMetadata;

/**
 * Serialized form of a periodic registration, identified by its content hash.
 */
public record PeriodicDefinition(
        String workerName,
        String schedule,
        JsonNode args,
        long hash
) {
    public static PeriodicDefinition of(ObjectMapper mapper, String workerName, String schedule, JsonNode args) {
        String normalized = PeriodicSchedule.normalize(schedule);
        return new PeriodicDefinition(workerName, normalized, args,
                PeriodicHash.hash(mapper, workerName, normalized, args));
    }

    public Job toJob() {
        return Job.periodic(workerName, args, new PeriodicMetadata(schedule, hash));
    }
}
