package com.yerin.bgworker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgworker.backend.pg.PgEnqueuer;
import com.yerin.bgworker.backend.pg.PgQueueClient;
import com.yerin.bgworker.backend.redis.RedisEnqueuer;
import com.yerin.bgworker.backend.redis.RedisQueueClient;
import com.yerin.bgworker.domain.BackoffStrategy;
import com.yerin.bgworker.domain.StaleCleanupBehavior;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.worker.AppContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("bgworker 설정 바인딩/빈 구성 테스트")
public class WorkerConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(WorkerConfiguration.class)
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(WorkerMetrics.class, () -> new WorkerMetrics(new SimpleMeterRegistry()))
            .withBean(JdbcTemplate.class, () -> mock(JdbcTemplate.class))
            .withBean(StringRedisTemplate.class, () -> mock(StringRedisTemplate.class));

    @Test
    @DisplayName("백엔드가 모두 꺼져 있으면 enqueuer 없이 컨텍스트만 생성")
    void nothing_enabled() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(AppContext.class);
            assertThat(ctx).doesNotHaveBean(PgQueueClient.class);
            assertThat(ctx).doesNotHaveBean(RedisQueueClient.class);
            assertThat(ctx.getBean(AppContext.class).getEnqueuers()).isEmpty();
        });
    }

    @Test
    @DisplayName("pg 만 켜면 Pg enqueuer 만 등록되고 설정이 바인딩됨")
    void pg_enabled_and_bound() {
        runner.withPropertyValues(
                        "bgworker.pg.enable=true",
                        "bgworker.pg.num-workers=3",
                        "bgworker.pg.queue-config.reports.num-workers=2",
                        "bgworker.pg.queue-fetch-config.empty-delay=5s",
                        "bgworker.pg.periodic.stale-cleanup=auto-clean-all",
                        "bgworker.enqueue-config.queue=mail",
                        "bgworker.worker-config.max-duration=90s",
                        "bgworker.worker-config.retry-config.max-retries=4",
                        "bgworker.worker-config.retry-config.backoff-strategy=linear")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(PgEnqueuer.class);
                    assertThat(ctx).doesNotHaveBean(RedisEnqueuer.class);

                    AppContext app = ctx.getBean(AppContext.class);
                    assertThat(app.enqueuer(PgEnqueuer.class)).isSameAs(ctx.getBean(PgEnqueuer.class));

                    WorkerProperties props = app.getProperties();
                    assertThat(props.getPg().getNumWorkers()).isEqualTo(3);
                    assertThat(props.getPg().dedicatedWorkers("reports")).isEqualTo(2);
                    assertThat(props.getPg().getQueueFetchConfig().getEmptyDelay()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(props.getPg().getPeriodic().getStaleCleanup()).isEqualTo(StaleCleanupBehavior.AUTO_CLEAN_ALL);
                    assertThat(props.getEnqueueConfig().getQueue()).isEqualTo("mail");
                    assertThat(props.getWorkerConfig().getMaxDuration()).isEqualTo(Duration.ofSeconds(90));
                    assertThat(props.getWorkerConfig().getRetryConfig().getMaxRetries()).isEqualTo(4);
                    assertThat(props.getWorkerConfig().getRetryConfig().getBackoffStrategy()).isEqualTo(BackoffStrategy.LINEAR);
                });
    }

    @Test
    @DisplayName("redis 를 켜면 Redis enqueuer 와 접두사 설정 사용")
    void redis_enabled() {
        runner.withPropertyValues("bgworker.redis.enable=true", "bgworker.redis.prefix=app")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(RedisEnqueuer.class);
                    assertThat(ctx).doesNotHaveBean(PgEnqueuer.class);
                    assertThat(ctx.getBean(RedisQueueClient.class).queueKey("default")).isEqualTo("app:queue:default");
                });
    }
}
