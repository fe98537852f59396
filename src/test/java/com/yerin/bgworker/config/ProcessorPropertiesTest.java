package com.yerin.bgworker.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("공유/전용 큐 분할 테스트")
public class ProcessorPropertiesTest {

    @Test
    @DisplayName("queues 미설정 시 등록된 큐에서 전용 큐를 뺀 나머지가 공유 큐")
    void shared_from_registered() {
        PgWorkerProperties props = new PgWorkerProperties();
        props.getQueueConfig().put("mail", QueueConfig.builder().numWorkers(2).build());

        assertThat(props.sharedQueues(Set.of("default", "mail", "report")))
                .containsExactly("default", "report");
        assertThat(props.dedicatedWorkers("mail")).isEqualTo(2);
        assertThat(props.dedicatedWorkers("default")).isZero();
    }

    @Test
    @DisplayName("queues 설정 시 설정된 큐만 사용")
    void shared_from_configured() {
        RedisWorkerProperties props = new RedisWorkerProperties();
        props.setQueues(Set.of("b", "a"));

        assertThat(props.sharedQueues(Set.of("a", "b", "c"))).containsExactly("a", "b");
    }

    @Test
    @DisplayName("기본값 검증")
    void defaults() {
        PgWorkerProperties props = new PgWorkerProperties();

        assertThat(props.isEnable()).isFalse();
        assertThat(props.getNumWorkers()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(props.getSchema()).isEqualTo("bgworker");
        assertThat(props.getQueueFetchConfig().getEmptyDelay()).hasSeconds(10);
        assertThat(props.getPeriodic().isEnable()).isTrue();
    }
}
