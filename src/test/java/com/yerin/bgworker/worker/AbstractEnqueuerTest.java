package com.yerin.bgworker.worker;

import com.yerin.bgworker.config.WorkerProperties;
import com.yerin.bgworker.domain.Job;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.global.exception.WorkerException;
import com.yerin.bgworker.global.exception.code.EnqueueErrorCode;
import com.yerin.bgworker.support.TestWorkers;
import com.yerin.bgworker.support.TestWorkers.Args;
import com.yerin.bgworker.support.TestWorkers.RecordingWorker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Enqueuer 공통 동작 테스트")
public class AbstractEnqueuerTest {

    record Sent(String queue, List<Job> jobs, Duration delay) {}

    static class CapturingEnqueuer extends AbstractEnqueuer {
        final List<Sent> sent = new ArrayList<>();
        RuntimeException failure;

        CapturingEnqueuer(WorkerMetrics metrics) {
            super(metrics);
        }

        @Override
        protected void send(AppContext context, String queue, List<Job> jobs, Duration delay) {
            if (failure != null) throw failure;
            sent.add(new Sent(queue, jobs, delay));
        }
    }

    WorkerMetrics metrics = mock(WorkerMetrics.class);
    CapturingEnqueuer enqueuer = new CapturingEnqueuer(metrics);
    AppContext context = TestWorkers.context(TestWorkers.properties("default"), enqueuer);

    @Test
    @DisplayName("인자를 JSON 으로 직렬화하고 워커 이름과 새 id 를 붙여 전송")
    void enqueue_wraps_args_into_job() {
        enqueuer.enqueue(context, new RecordingWorker(), new Args("hello"));

        assertThat(enqueuer.sent).hasSize(1);
        Sent sent = enqueuer.sent.get(0);
        assertThat(sent.queue()).isEqualTo("default");
        assertThat(sent.delay()).isZero();

        Job job = sent.jobs().get(0);
        assertThat(job.args().get("value").asText()).isEqualTo("hello");
        assertThat(job.metadata().workerName()).isEqualTo("RecordingWorker");
        assertThat(job.metadata().id()).isNotBlank();
        assertThat(job.isPeriodic()).isFalse();
        verify(metrics).incEnqueued(1);
    }

    @Test
    @DisplayName("배치는 한 번에 전송되고 작업마다 id 가 다름")
    void batch_delayed() {
        enqueuer.enqueueBatchDelayed(context, new RecordingWorker(),
                List.of(new Args("a"), new Args("b")), Duration.ofSeconds(5));

        Sent sent = enqueuer.sent.get(0);
        assertThat(sent.jobs()).hasSize(2);
        assertThat(sent.delay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(sent.jobs().get(0).metadata().id()).isNotEqualTo(sent.jobs().get(1).metadata().id());
        verify(metrics).incEnqueued(2);
    }

    @Test
    @DisplayName("빈 배치는 아무것도 보내지 않음")
    void empty_batch_is_noop() {
        enqueuer.enqueueBatch(context, new RecordingWorker(), List.of());

        assertThat(enqueuer.sent).isEmpty();
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("큐가 없으면 빈 배치라도 NO_QUEUE")
    void no_queue_even_for_empty_batch() {
        AppContext noQueue = TestWorkers.context(new WorkerProperties(), enqueuer);

        assertThatThrownBy(() -> enqueuer.enqueueBatch(noQueue, new RecordingWorker(), List.of()))
                .isInstanceOf(WorkerException.class)
                .satisfies(e -> assertThat(((WorkerException) e).getErrorCode().getCode())
                        .isEqualTo(EnqueueErrorCode.NO_QUEUE.getCode()));
    }

    @Test
    @DisplayName("저장소 오류는 BACKEND 로 감싸서 전달")
    void backend_error_wrapped() {
        enqueuer.failure = new QueryTimeoutException("down");

        assertThatThrownBy(() -> enqueuer.enqueue(context, new RecordingWorker(), new Args("x")))
                .isInstanceOf(WorkerException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
        verify(metrics, never()).incEnqueued(anyInt());
    }

    @Test
    @DisplayName("워커의 enqueue 헬퍼는 컨텍스트에서 enqueuer 를 찾아 위임")
    void worker_helper_uses_context_enqueuer() {
        RecordingWorker worker = new RecordingWorker() {
            @Override
            public Class<? extends Enqueuer> enqueuerType() {
                return CapturingEnqueuer.class;
            }
        };

        worker.enqueue(context, new Args("via-helper"));

        assertThat(enqueuer.sent).hasSize(1);
    }

    @Test
    @DisplayName("등록되지 않은 enqueuer 타입은 NO_ENQUEUER")
    void missing_enqueuer() {
        assertThatThrownBy(() -> context.enqueuer(com.yerin.bgworker.backend.pg.PgEnqueuer.class))
                .isInstanceOf(WorkerException.class)
                .satisfies(e -> assertThat(((WorkerException) e).getErrorCode().getCode())
                        .isEqualTo(EnqueueErrorCode.NO_ENQUEUER.getCode()));
    }
}
