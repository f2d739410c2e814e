package personal.guestpass.access.grant.domain.model;

/**
 * 만료 처리 결과
 *
 * @param grantId    처리한 권한 ID
 * @param result     결과 종류
 * @param retryGrant RETRY_SCHEDULED 인 경우 재시도 정보가 반영된 권한, 그 외 null
 */
public record EnforcementOutcome(
        String grantId,
        Result result,
        GuestGrant retryGrant) {

    public enum Result {
        COMPLETED,       // 퇴장(또는 이미 없음) 확인, 레코드 삭제
        RETRY_SCHEDULED, // 퇴장 실패, 레코드 유지 후 재시도
        MANUAL_REVIEW,   // 재시도 한도 초과
        DELETE_FAILED,   // 퇴장 확인됐지만 레코드 삭제 실패 (sweep 이 다시 처리)
        FAILED           // 예상하지 못한 오류 (sweep 이 다시 처리)
    }

    public static EnforcementOutcome completed(String grantId) {
        return new EnforcementOutcome(grantId, Result.COMPLETED, null);
    }

    public static EnforcementOutcome retryScheduled(GuestGrant retryGrant) {
        return new EnforcementOutcome(retryGrant.id(), Result.RETRY_SCHEDULED, retryGrant);
    }

    public static EnforcementOutcome manualReview(String grantId) {
        return new EnforcementOutcome(grantId, Result.MANUAL_REVIEW, null);
    }

    public static EnforcementOutcome deleteFailed(String grantId) {
        return new EnforcementOutcome(grantId, Result.DELETE_FAILED, null);
    }

    public static EnforcementOutcome failed(String grantId) {
        return new EnforcementOutcome(grantId, Result.FAILED, null);
    }

    public boolean needsRetry() {
        return result == Result.RETRY_SCHEDULED;
    }
}
