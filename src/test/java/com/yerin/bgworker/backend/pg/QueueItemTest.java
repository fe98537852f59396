package com.yerin.bgworker.backend.pg;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.PriorityQueue;

import static org.assertj.core.api.Assertions.*;

@DisplayName("큐 힙 정렬 테스트")
public class QueueItemTest {

    @Test
    @DisplayName("nextFetch 가 가장 이른 큐가 먼저 나옴")
    void earliest_first() {
        Instant now = Instant.now();
        PriorityQueue<QueueItem> heap = new PriorityQueue<>();
        heap.add(new QueueItem("late", now.plusSeconds(10)));
        heap.add(new QueueItem("early", now));
        heap.add(new QueueItem("middle", now.plusSeconds(5)));

        assertThat(heap.poll().getName()).isEqualTo("early");

        QueueItem middle = heap.poll();
        assertThat(middle.getName()).isEqualTo("middle");

        // 다시 넣을 때 갱신된 시각 기준으로 정렬
        middle.setNextFetch(now.plusSeconds(20));
        heap.add(middle);
        assertThat(heap.poll().getName()).isEqualTo("late");
        assertThat(heap.poll().getName()).isEqualTo("middle");
    }
}
