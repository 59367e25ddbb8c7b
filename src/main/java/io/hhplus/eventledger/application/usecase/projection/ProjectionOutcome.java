package io.hhplus.eventledger.application.usecase.projection;

/**
 * 프로젝션 적용 결과
 * <p>
 * - APPLIED: 읽기 모델 반영 + 처리 완료 기록
 * - ALREADY_APPLIED: 이미 처리된 이벤트, 쓰기 없음
 * - DROPPED: 해석 불가/검증 실패, 재전달해도 결과가 같으므로 폐기
 * - RETRY: 인프라 장애, 재전달 필요
 */
public enum ProjectionOutcome {
    APPLIED,
    ALREADY_APPLIED,
    DROPPED,
    RETRY
}
