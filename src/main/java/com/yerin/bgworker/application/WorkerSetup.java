package com.yerin.bgworker.application;

import com.yerin.bgworker.backend.pg.PgProcessor;
import com.yerin.bgworker.backend.pg.PgQueueClient;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.PeriodicArgs;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Profile("!test")
@Configuration
public class WorkerSetup {

    @Bean
    @ConditionalOnProperty(prefix = "bgworker.pg", name = "enable", havingValue = "true")
    public PgProcessor pgProcessor(AppContext context, PgQueueClient client, WorkerMetrics metrics,
                                   EmailWelcomeWorker emailWelcomeWorker,
                                   StaleSessionCleanupWorker staleSessionCleanupWorker) {
        return PgProcessor.builder(context, client, metrics)
                .register(emailWelcomeWorker)
                .registerPeriodic(staleSessionCleanupWorker, PeriodicArgs.<StaleSessionCleanupWorker.Args>builder()
                        .args(new StaleSessionCleanupWorker.Args(24))
                        .schedule("0 0 * * * *")
                        .build())
                .build();
    }
}
