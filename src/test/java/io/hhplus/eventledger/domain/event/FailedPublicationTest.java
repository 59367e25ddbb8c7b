package io.hhplus.eventledger.domain.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FailedPublication 테스트")
class FailedPublicationTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 0, 0);

    @Test
    @DisplayName("생성 직후에는 PENDING, 1분 뒤 재시도 가능")
    void create() {
        FailedPublication publication = FailedPublication.create("e1", "o1", "broker down", NOW);

        assertThat(publication.getStatus()).isEqualTo(FailedPublication.Status.PENDING);
        assertThat(publication.getAttemptCount()).isZero();
        assertThat(publication.canRetry(5, NOW)).isFalse();
        assertThat(publication.canRetry(5, NOW.plusMinutes(1))).isTrue();
    }

    @Test
    @DisplayName("재시도 실패 시 대기 시간이 1, 2, 4분으로 늘어난다")
    void markRetryFailed_backoff() {
        FailedPublication publication = FailedPublication.create("e1", "o1", "broker down", NOW);

        publication.startRetry(NOW);
        publication.markRetryFailed("still down", 5, NOW);
        assertThat(publication.getNextRetryAt()).isEqualTo(NOW.plusMinutes(1));

        publication.startRetry(NOW);
        publication.markRetryFailed("still down", 5, NOW);
        assertThat(publication.getNextRetryAt()).isEqualTo(NOW.plusMinutes(2));

        publication.startRetry(NOW);
        publication.markRetryFailed("still down", 5, NOW);
        assertThat(publication.getNextRetryAt()).isEqualTo(NOW.plusMinutes(4));
        assertThat(publication.getStatus()).isEqualTo(FailedPublication.Status.PENDING);
    }

    @Test
    @DisplayName("최대 시도 횟수에 도달하면 FAILED")
    void markRetryFailed_exhausted() {
        FailedPublication publication = FailedPublication.create("e1", "o1", "broker down", NOW);

        publication.startRetry(NOW);
        publication.markRetryFailed("still down", 1, NOW);

        assertThat(publication.getStatus()).isEqualTo(FailedPublication.Status.FAILED);
        assertThat(publication.getNextRetryAt()).isNull();
        assertThat(publication.canRetry(1, NOW.plusDays(1))).isFalse();
    }

    @Test
    @DisplayName("재시도를 시작해도 상태는 PENDING 그대로, 시도 횟수만 오른다")
    void startRetry_staysPending() {
        FailedPublication publication = FailedPublication.create("e1", "o1", "broker down", NOW);

        publication.startRetry(NOW);

        assertThat(publication.getStatus()).isEqualTo(FailedPublication.Status.PENDING);
        assertThat(publication.getAttemptCount()).isEqualTo(1);
        assertThat(publication.canRetry(5, NOW.plusMinutes(1))).isTrue();
    }

    @Test
    @DisplayName("PENDING이 아니면 재시도를 시작할 수 없다")
    void startRetry_notPending() {
        FailedPublication publication = FailedPublication.create("e1", "o1", "broker down", NOW);
        publication.startRetry(NOW);
        publication.markSuccess(NOW);

        assertThatThrownBy(() -> publication.startRetry(NOW))
            .isInstanceOf(IllegalStateException.class);
    }
}
