package com.yerin.bgworker.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("cron 스케줄 테스트")
public class PeriodicScheduleTest {

    @Test
    @DisplayName("공백 정규화 및 잘못된 표현식 거부")
    void normalize() {
        assertThat(PeriodicSchedule.normalize("  0   0 *  * * * ")).isEqualTo("0 0 * * * *");
        assertThatThrownBy(() -> PeriodicSchedule.normalize("not a cron"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PeriodicSchedule.normalize(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("다음 실행까지 남은 시간은 UTC 기준")
    void next_run_delay() {
        Instant now = Instant.parse("2024-01-01T10:15:30Z");

        assertThat(PeriodicSchedule.nextRunDelay("0 0 * * * *", now)).isEqualTo(Duration.ofMinutes(44).plusSeconds(30));
        assertThat(PeriodicSchedule.nextRunDelay("0 0 12 * * *", now)).isEqualTo(Duration.ofHours(1).plusMinutes(44).plusSeconds(30));
    }

    @Test
    @DisplayName("정각에 평가하면 다음 주기까지 대기")
    void exactly_on_fire_time() {
        Instant now = Instant.parse("2024-01-01T10:00:00Z");

        assertThat(PeriodicSchedule.nextRunDelay("0 0 * * * *", now)).isEqualTo(Duration.ofHours(1));
    }
}
