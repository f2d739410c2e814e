package personal.guestpass.access.grant.domain.model;

import personal.guestpass.access.grant.domain.exception.InvalidGrantWindowException;
import personal.guestpass.common.exception.BusinessException;
import personal.guestpass.common.exception.ErrorCode;

import java.time.Instant;
import java.util.UUID;

/**
 * 게스트 권한 도메인 모델 (불변)
 * 외부 커뮤니티 공간(Discord Guild)에 대한 기간 한정 접근 권한
 *
 * 만료/경고 시각은 생성 이후 변경되지 않음.
 * status, removalAttempts, nextAttemptAt 만 강제 퇴장 재시도 과정에서 갱신됨.
 */
public record GuestGrant(
        String id,
        String guildId,
        String accountId,
        String accountTag,
        Instant grantedAt,
        Instant expiresAt,
        Instant warningAt,
        GrantStatus status,
        int removalAttempts,
        Instant nextAttemptAt) {

    public GuestGrant {
        if (id == null || id.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Grant ID cannot be blank");
        }
        if (guildId == null || guildId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Guild ID cannot be blank");
        }
        if (accountId == null || accountId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Account ID cannot be blank");
        }
        if (expiresAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expiration time cannot be null");
        }
        if (warningAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Warning time cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Grant status cannot be null");
        }
    }

    /**
     * 신규 권한 생성 (정적 팩토리 메서드)
     * 저장소에서 읽어온 레코드는 이 검증을 거치지 않음 (복구가 한 건 때문에 중단되지 않도록)
     *
     * @throws InvalidGrantWindowException warningAt 이 expiresAt 보다 앞서지 않는 경우
     */
    public static GuestGrant create(String guildId, String accountId, String accountTag,
                                    Instant grantedAt, Instant expiresAt, Instant warningAt) {
        if (expiresAt == null || warningAt == null || !warningAt.isBefore(expiresAt)) {
            throw new InvalidGrantWindowException(warningAt, expiresAt);
        }
        return new GuestGrant(
                UUID.randomUUID().toString(),
                guildId,
                accountId,
                accountTag,
                grantedAt,
                expiresAt,
                warningAt,
                GrantStatus.ACTIVE,
                0,
                null);
    }

    /**
     * 강제 퇴장을 시도해야 하는 시각
     * 재시도 대기 중이면 nextAttemptAt, 그 외에는 expiresAt
     */
    public Instant enforcementDueAt() {
        if (status == GrantStatus.RETRY_PENDING && nextAttemptAt != null) {
            return nextAttemptAt;
        }
        return expiresAt;
    }

    public boolean isEnforcementDue(Instant now) {
        return !enforcementDueAt().isAfter(now);
    }

    /**
     * 아직 발송 시각이 지나지 않은 경고가 있는지 확인
     * 이미 지난 경고는 늦게 보내지 않음
     */
    public boolean hasPendingWarning(Instant now) {
        return status == GrantStatus.ACTIVE && warningAt.isAfter(now);
    }

    public boolean isAwaitingManualReview() {
        return status == GrantStatus.MANUAL_REVIEW;
    }

    public GuestGrant warned() {
        return new GuestGrant(id, guildId, accountId, accountTag, grantedAt, expiresAt, warningAt,
                GrantStatus.WARNED, removalAttempts, nextAttemptAt);
    }

    /**
     * 강제 퇴장 실패 후 재시도 예약 (ACTIVE/WARNED/RETRY_PENDING -> RETRY_PENDING)
     */
    public GuestGrant withRetry(int attempts, Instant retryAt) {
        return new GuestGrant(id, guildId, accountId, accountTag, grantedAt, expiresAt, warningAt,
                GrantStatus.RETRY_PENDING, attempts, retryAt);
    }

    /**
     * 재시도 한도 초과 (-> MANUAL_REVIEW)
     */
    public GuestGrant withManualReview(int attempts) {
        return new GuestGrant(id, guildId, accountId, accountTag, grantedAt, expiresAt, warningAt,
                GrantStatus.MANUAL_REVIEW, attempts, null);
    }
}
