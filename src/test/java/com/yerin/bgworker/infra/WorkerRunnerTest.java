package com.yerin.bgworker.infra;

import com.yerin.bgworker.backend.pg.PgProcessor;
import com.yerin.bgworker.backend.redis.RedisProcessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("WorkerRunner 생명주기 테스트")
public class WorkerRunnerTest {

    PgProcessor pg = mock(PgProcessor.class);
    RedisProcessor redis = mock(RedisProcessor.class);

    private WorkerRunner runner(Map<String, Object> beans) {
        StaticListableBeanFactory factory = new StaticListableBeanFactory(beans);
        return new WorkerRunner(factory.getBeanProvider(PgProcessor.class), factory.getBeanProvider(RedisProcessor.class));
    }

    @Test
    @DisplayName("시작 시 beforeRun 후 run, 종료 시 토큰 취소 후 대기")
    void starts_and_stops() throws Exception {
        doAnswer(inv -> {
            inv.getArgument(0, CancellationToken.class).await();
            return null;
        }).when(pg).run(any());
        WorkerRunner sut = runner(Map.of("pg", pg));

        sut.startProcessors();
        verify(pg).beforeRun();
        verify(pg, timeout(2_000)).run(sut.getToken());
        assertThat(sut.getToken().isCancelled()).isFalse();

        sut.stopProcessors();
        assertThat(sut.getToken().isCancelled()).isTrue();
    }

    @Test
    @DisplayName("한 프로세서가 실패하면 공유 토큰이 취소되어 나머지도 종료")
    void failure_cancels_others() throws Exception {
        doThrow(new IllegalStateException("boom")).when(pg).run(any());
        doAnswer(inv -> {
            inv.getArgument(0, CancellationToken.class).await();
            return null;
        }).when(redis).run(any());
        WorkerRunner sut = runner(Map.of("pg", pg, "redis", redis));

        sut.startProcessors();

        assertThat(sut.getToken().await(Duration.ofSeconds(5))).isTrue();
        sut.stopProcessors();
        verify(redis).beforeRun();
    }

    @Test
    @DisplayName("beforeRun 실패는 시작 단계에서 그대로 전파")
    void before_run_failure_propagates() {
        doThrow(new IllegalStateException("bad config")).when(pg).beforeRun();
        WorkerRunner sut = runner(Map.of("pg", pg));

        assertThatThrownBy(sut::startProcessors).hasMessage("bad config");
    }
}
