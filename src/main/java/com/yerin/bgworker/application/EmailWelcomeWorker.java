package com.yerin.bgworker.application;

import com.yerin.bgworker.backend.pg.PgEnqueuer;
import com.yerin.bgworker.config.RetryConfig;
import com.yerin.bgworker.config.WorkerConfig;
import com.yerin.bgworker.domain.BackoffStrategy;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.Enqueuer;
import com.yerin.bgworker.worker.Worker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Profile("!test")
@Component
public class EmailWelcomeWorker implements Worker<EmailWelcomeArgs> {

    @Value("${bgworker.example.email-welcome.fail-always:false}")
    private boolean failAlways;

    @Override
    public Class<? extends Enqueuer> enqueuerType() {
        return PgEnqueuer.class;
    }

    @Override
    public WorkerConfig workerConfig(AppContext context) {
        return WorkerConfig.builder()
                .retryConfig(RetryConfig.builder()
                        .maxRetries(3)
                        .delay(Duration.ofSeconds(5))
                        .backoffStrategy(BackoffStrategy.EXPONENTIAL)
                        .maxDelay(Duration.ofMinutes(1))
                        .build())
                .build();
    }

    @Override
    public void handle(AppContext context, EmailWelcomeArgs args) {
        if (failAlways) throw new IllegalStateException("fail for retry test");
        if (args.userId() == 777) throw new IllegalStateException("simulated failure by userId=777");

        log.info("[Worker.EmailWelcome] userId={}, email={}", args.userId(), args.email());
    }
}
