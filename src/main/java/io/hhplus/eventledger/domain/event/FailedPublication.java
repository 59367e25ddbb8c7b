package io.hhplus.eventledger.domain.event;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 발행 실패 이벤트 (재발행 대기열)
 * <p>
 * 원장에는 기록됐지만 버스 발행에 실패한 이벤트를 추적한다.
 * 원장(event_store)은 append-only이므로 발행 상태는 이 테이블에만 둔다.
 * <p>
 * 상태:
 * - PENDING: 재발행 대기 (시도 중인 건도 결과가 저장되기 전까지는 PENDING)
 * - SUCCESS: 재발행 성공
 * - FAILED: 최대 시도 횟수 초과
 * <p>
 * 시도 중 상태를 따로 저장하지 않는다. 결과 저장 전에 프로세스가 죽거나 저장이 실패하면
 * 행은 PENDING으로 남아 다음 주기에 다시 집힌다. (중복 발행은 처리 완료 원장이 걸러낸다)
 */
@Entity
@Table(name = "failed_publications",
    uniqueConstraints = @UniqueConstraint(name = "uk_failed_publications_event_id", columnNames = "event_id"),
    indexes = @Index(name = "idx_failed_publications_status_next", columnList = "status, next_retry_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FailedPublication {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, length = 64)
    private String eventId;

    @Column(name = "order_id", nullable = false, length = 128)
    private String orderId;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status = Status.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    // ===== 생성 메서드 =====

    public static FailedPublication create(String eventId, String orderId, String errorMessage, LocalDateTime now) {
        FailedPublication publication = new FailedPublication();
        publication.eventId = eventId;
        publication.orderId = orderId;
        publication.errorMessage = errorMessage;
        publication.status = Status.PENDING;
        publication.attemptCount = 0;
        publication.createdAt = now;
        publication.updatedAt = now;
        publication.nextRetryAt = now.plusMinutes(1);
        return publication;
    }

    // ===== 비즈니스 로직 =====

    public void startRetry(LocalDateTime now) {
        if (this.status != Status.PENDING) {
            throw new IllegalStateException("재발행 가능한 상태가 아닙니다: " + this.status);
        }

        this.attemptCount++;
        this.updatedAt = now;
    }

    public void markSuccess(LocalDateTime now) {
        this.status = Status.SUCCESS;
        this.updatedAt = now;
        this.nextRetryAt = null;
    }

    /**
     * 재발행 실패. 시도 횟수가 남아 있으면 PENDING으로 되돌린다.
     * 대기 시간: 1분, 2분, 4분, ...
     */
    public void markRetryFailed(String errorMessage, int maxAttempts, LocalDateTime now) {
        this.errorMessage = errorMessage;
        this.updatedAt = now;

        if (this.attemptCount >= maxAttempts) {
            this.status = Status.FAILED;
            this.nextRetryAt = null;
        } else {
            this.status = Status.PENDING;
            long delayMinutes = (long) Math.pow(2, this.attemptCount - 1);
            this.nextRetryAt = now.plusMinutes(delayMinutes);
        }
    }

    /**
     * 재발행해도 소용없는 경우 (원장에 이벤트가 없음). 바로 FAILED.
     */
    public void abandon(String errorMessage, LocalDateTime now) {
        this.errorMessage = errorMessage;
        this.status = Status.FAILED;
        this.updatedAt = now;
        this.nextRetryAt = null;
    }

    public boolean canRetry(int maxAttempts, LocalDateTime now) {
        return this.status == Status.PENDING
            && this.attemptCount < maxAttempts
            && this.nextRetryAt != null
            && !now.isBefore(this.nextRetryAt);
    }

    public enum Status {
        PENDING,
        SUCCESS,
        FAILED
    }
}
