package com.yerin.bgworker.config;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PgWorkerProperties extends ProcessorProperties {

    /** Schema holding the {@code q_*} and {@code a_*} queue tables. */
    private String schema = "bgworker";

    private QueueFetchConfig queueFetchConfig = new QueueFetchConfig();
}
