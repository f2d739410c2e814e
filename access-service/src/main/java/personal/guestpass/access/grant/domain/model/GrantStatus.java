package personal.guestpass.access.grant.domain.model;

/**
 * 게스트 권한의 영속 상태
 */
public enum GrantStatus {
    ACTIVE,         // 부여됨, 만료 대기
    WARNED,         // 만료 경고 발송됨 (참고용, 만료 시점에 영향 없음)
    RETRY_PENDING,  // 강제 퇴장 실패, 재시도 대기
    MANUAL_REVIEW   // 재시도 한도 초과, 수동 처리 필요
}
