package com.yerin.bgworker.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobMetadata(
        String id,
        String workerName,
        PeriodicMetadata periodic
) {
    public static JobMetadata create(String workerName) {
        return new JobMetadata(UUID.randomUUID().toString(), workerName, null);
    }
}
