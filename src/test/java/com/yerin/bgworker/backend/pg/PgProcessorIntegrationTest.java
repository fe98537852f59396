package com.yerin.bgworker.backend.pg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgworker.config.PgWorkerConfig;
import com.yerin.bgworker.config.RetryConfig;
import com.yerin.bgworker.config.WorkerProperties;
import com.yerin.bgworker.domain.BackoffStrategy;
import com.yerin.bgworker.domain.CompletedAction;
import com.yerin.bgworker.domain.Job;
import com.yerin.bgworker.domain.QueueMessage;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.global.exception.WorkerException;
import com.yerin.bgworker.infra.CancellationToken;
import com.yerin.bgworker.support.TestWorkers;
import com.yerin.bgworker.support.TestWorkers.Args;
import com.yerin.bgworker.support.TestWorkers.FailingWorker;
import com.yerin.bgworker.support.TestWorkers.RecordingWorker;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.PeriodicArgs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Postgres 프로세서 통합 테스트")
public class PgProcessorIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    ObjectMapper om = new ObjectMapper();
    WorkerMetrics metrics = new WorkerMetrics(new SimpleMeterRegistry());

    JdbcTemplate jdbc;
    PgQueueClient client;
    WorkerProperties props;
    AppContext context;

    CancellationToken token = new CancellationToken();
    Thread runner;

    @BeforeEach
    void setUp() {
        jdbc = new JdbcTemplate(new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword()));
        jdbc.execute("DROP SCHEMA IF EXISTS bgworker CASCADE");
        client = new PgQueueClient(jdbc, om, "bgworker");

        props = TestWorkers.properties("default");
        props.getPg().setNumWorkers(2);
        props.getPg().getQueueFetchConfig().setEmptyDelay(Duration.ofMillis(100));
        context = TestWorkers.context(props, new PgEnqueuer(client, metrics));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        token.cancel();
        if (runner != null) runner.join(10_000);
    }

    private void start(PgProcessor processor) {
        processor.beforeRun();
        runner = new Thread(() -> {
            try {
                processor.run(token);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        runner.start();
    }

    @Test
    @DisplayName("큐 클라이언트: 읽으면 가시성 타임아웃 동안 숨겨지고 read_ct 증가")
    void client_visibility_timeout() {
        client.create("default");
        client.send("default", List.of(Job.of("W", om.valueToTree(new Args("a")))), Duration.ZERO);

        QueueMessage first = client.read("default", Duration.ofSeconds(30)).orElseThrow();
        assertThat(first.readCount()).isEqualTo(1);
        assertThat(first.message().path("metadata").path("workerName").asText()).isEqualTo("W");
        assertThat(client.read("default", Duration.ofSeconds(30))).isEmpty();

        client.setVisibilityTimeout("default", first.msgId(), Duration.ZERO);
        QueueMessage second = client.read("default", Duration.ofSeconds(30)).orElseThrow();
        assertThat(second.msgId()).isEqualTo(first.msgId());
        assertThat(second.readCount()).isEqualTo(2);

        assertThat(client.archive("default", second.msgId())).isTrue();
        assertThat(client.count("default")).isZero();
        assertThat(client.countArchived("default")).isEqualTo(1);
    }

    @Test
    @DisplayName("지연 전송된 메시지는 지연 시간 전에는 읽히지 않음")
    void delayed_send_hidden() {
        client.create("default");
        client.send("default", List.of(Job.of("W", om.valueToTree(new Args("a")))), Duration.ofMinutes(5));

        Optional<QueueMessage> read = client.read("default", Duration.ofSeconds(30));

        assertThat(read).isEmpty();
        assertThat(client.count("default")).isEqualTo(1);
    }

    @Test
    @DisplayName("잘못된 큐 이름은 SQL 에 사용되기 전에 거부")
    void invalid_queue_name_rejected() {
        assertThatThrownBy(() -> client.create("drop table;"))
                .isInstanceOf(WorkerException.class);
    }

    @Test
    @DisplayName("enqueue 부터 처리, 성공 시 아카이브까지")
    void enqueue_to_archive() {
        props.getWorkerConfig().setPg(PgWorkerConfig.builder().successAction(CompletedAction.ARCHIVE).build());
        RecordingWorker worker = new RecordingWorker();
        PgProcessor processor = PgProcessor.builder(context, client, metrics).register(worker).build();
        start(processor);

        worker.enqueue(context, new Args("hello"));

        await().atMost(10, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(worker.handled).containsExactly(new Args("hello"));
            assertThat(client.countArchived("default")).isEqualTo(1);
        });
        assertThat(client.count("default")).isZero();
    }

    @Test
    @DisplayName("max-retries=2, 지수 백오프면 핸들러는 총 3번 실행되고 실행 간격이 늘어난 뒤 아카이브")
    void retries_with_growing_backoff_then_failure_action() throws InterruptedException {
        props.getWorkerConfig().setRetryConfig(RetryConfig.builder()
                .maxRetries(2)
                .delay(Duration.ofMillis(300))
                .backoffStrategy(BackoffStrategy.EXPONENTIAL)
                .build());
        List<Long> attemptsAt = new CopyOnWriteArrayList<>();
        FailingWorker worker = new FailingWorker() {
            @Override
            public String name() {
                return "FailingWorker";
            }

            @Override
            public void handle(AppContext context, Args args) {
                attemptsAt.add(System.nanoTime());
                super.handle(context, args);
            }
        };
        PgProcessor processor = PgProcessor.builder(context, client, metrics).register(worker).build();
        start(processor);

        worker.enqueue(context, new Args("x"));

        await().atMost(15, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(worker.calls).hasValue(3);
            assertThat(client.countArchived("default")).isEqualTo(1);
        });
        Thread.sleep(500);
        assertThat(worker.calls).hasValue(3);

        List<Long> at = new ArrayList<>(attemptsAt);
        Duration firstGap = Duration.ofNanos(at.get(1) - at.get(0));
        Duration secondGap = Duration.ofNanos(at.get(2) - at.get(1));
        assertThat(firstGap).isGreaterThanOrEqualTo(Duration.ofMillis(300));
        assertThat(secondGap).isGreaterThanOrEqualTo(Duration.ofMillis(600));
        assertThat(secondGap).isGreaterThan(firstGap);
    }

    @Test
    @DisplayName("message 가 NULL 인 행은 실패 처리되고 프로세서는 계속 동작")
    void null_message_row_does_not_stop_processor() {
        RecordingWorker worker = new RecordingWorker();
        PgProcessor processor = PgProcessor.builder(context, client, metrics).register(worker).build();
        processor.beforeRun();
        jdbc.update("INSERT INTO bgworker.q_default (vt, message) VALUES (clock_timestamp(), NULL)");

        QueueMessage raw = client.read("default", Duration.ZERO).orElseThrow();
        assertThat(raw.message().isNull()).isTrue();

        start(processor);
        worker.enqueue(context, new Args("after-null"));

        await().atMost(10, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(worker.handled).containsExactly(new Args("after-null"));
            assertThat(client.countArchived("default")).isEqualTo(1);
        });
        assertThat(token.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("재시작해도 같은 주기 작업은 한 번만 저장되고, 등록 해제되면 정리")
    void periodic_not_duplicated_across_restarts() {
        PeriodicArgs<Args> periodicArgs = PeriodicArgs.<Args>builder().args(new Args("p")).schedule("0 0 0 * * *").build();

        PgProcessor.builder(context, client, metrics).registerPeriodic(new RecordingWorker(), periodicArgs).build().beforeRun();
        PgProcessor.builder(context, client, metrics).registerPeriodic(new RecordingWorker(), periodicArgs).build().beforeRun();
        assertThat(client.count(PgProcessor.PERIODIC_QUEUE_NAME)).isEqualTo(1);

        PgProcessor.builder(context, client, metrics).register(new RecordingWorker()).build().beforeRun();
        assertThat(client.count(PgProcessor.PERIODIC_QUEUE_NAME)).isZero();
    }

    @Test
    @DisplayName("해시 유니크 인덱스가 중복 주기 작업 삽입을 거부")
    void unique_hash_index() {
        PgProcessor processor = PgProcessor.builder(context, client, metrics)
                .registerPeriodic(new RecordingWorker(), PeriodicArgs.<Args>builder().args(new Args("p")).schedule("0 0 0 * * *").build())
                .build();
        processor.beforeRun();
        Job job = processor.getRegistry().periodicDefinitions().iterator().next().toJob();

        assertThatThrownBy(() -> client.send(PgProcessor.PERIODIC_QUEUE_NAME, List.of(job), Duration.ZERO))
                .isInstanceOf(DuplicateKeyException.class);
        assertThat(client.deletePeriodicNotIn(Set.of(job.metadata().periodic().hash()))).isZero();
        assertThat(client.deletePeriodicNotIn(Set.of())).isEqualTo(1);
    }

    @Test
    @DisplayName("주기 작업이 도래하면 워커 큐로 새 작업이 들어가 처리됨")
    void periodic_job_fires() {
        RecordingWorker worker = new RecordingWorker();
        PgProcessor processor = PgProcessor.builder(context, client, metrics)
                .registerPeriodic(worker, PeriodicArgs.<Args>builder().args(new Args("tick")).schedule("* * * * * *").build())
                .build();
        start(processor);

        await().atMost(15, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(worker.handled).contains(new Args("tick")));
        assertThat(client.count(PgProcessor.PERIODIC_QUEUE_NAME)).isEqualTo(1);
    }
}
