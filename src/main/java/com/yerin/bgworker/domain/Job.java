package com.yerin.bgworker.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Wire envelope of a unit of work: the serialized worker arguments plus the metadata needed to
 * route them back to the worker that will handle them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
        JsonNode args,
        JobMetadata metadata
) {
    public Job {
        if (args == null) args = NullNode.getInstance();
    }

    public static Job of(String workerName, JsonNode args) {
        return new Job(args, JobMetadata.create(workerName));
    }

    public static Job periodic(String workerName, JsonNode args, PeriodicMetadata periodic) {
        return new Job(args, new JobMetadata(null, workerName, periodic));
    }

    @JsonIgnore
    public boolean isPeriodic() {
        return metadata != null && metadata.periodic() != null;
    }
}
