package com.yerin.bgworker.worker;

import lombok.Builder;
import lombok.Getter;

/**
 * Arguments and cron schedule of a periodic job registration. Schedules use the six-field
 * Spring cron format ({@code second minute hour day-of-month month day-of-week}) and are
 * evaluated in UTC.
 */
@Getter
@Builder
public class PeriodicArgs<A> {
    private final A args;
    private final String schedule;
}
