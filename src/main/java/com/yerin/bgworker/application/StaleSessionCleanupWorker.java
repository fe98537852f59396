package com.yerin.bgworker.application;

import com.yerin.bgworker.backend.pg.PgEnqueuer;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.Enqueuer;
import com.yerin.bgworker.worker.Worker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Periodic example: logs the cleanup window it was scheduled with.
 */
@Slf4j
@Profile("!test")
@Component
public class StaleSessionCleanupWorker implements Worker<StaleSessionCleanupWorker.Args> {

    public record Args(int olderThanHours) {}

    @Override
    public Class<? extends Enqueuer> enqueuerType() {
        return PgEnqueuer.class;
    }

    @Override
    public void handle(AppContext context, Args args) {
        log.info("[Worker.StaleSessionCleanup] cleaning sessions older than {}h", args.olderThanHours());
    }
}
