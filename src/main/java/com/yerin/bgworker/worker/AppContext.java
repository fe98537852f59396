package com.yerin.bgworker.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgworker.config.WorkerProperties;
import com.yerin.bgworker.global.exception.WorkerException;
import com.yerin.bgworker.global.exception.code.EnqueueErrorCode;
import lombok.Getter;

import java.util.List;

/**
 * State handed to workers and processors: the configuration snapshot, the JSON mapper and the
 * available enqueuers. Applications may extend it to carry their own state.
 */
@Getter
public class AppContext {

    private final WorkerProperties properties;
    private final ObjectMapper objectMapper;
    private final List<Enqueuer> enqueuers;

    public AppContext(WorkerProperties properties, ObjectMapper objectMapper, List<Enqueuer> enqueuers) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.enqueuers = List.copyOf(enqueuers);
    }

    public <E extends Enqueuer> E enqueuer(Class<E> type) {
        for (Enqueuer enqueuer : enqueuers) {
            if (type.isInstance(enqueuer)) return type.cast(enqueuer);
        }
        throw new WorkerException(EnqueueErrorCode.NO_ENQUEUER
                .withDetail("No enqueuer of type " + type.getSimpleName() + " is available."));
    }
}
