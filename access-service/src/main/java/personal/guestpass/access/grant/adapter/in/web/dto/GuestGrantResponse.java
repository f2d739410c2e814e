package personal.guestpass.access.grant.adapter.in.web.dto;

import personal.guestpass.access.grant.domain.model.GrantStatus;
import personal.guestpass.access.grant.domain.model.GuestGrant;
import personal.guestpass.access.grant.domain.model.GuestTimerHandle.TimerPhase;

import java.time.Instant;

/**
 * 게스트 권한 조회/생성 응답 DTO
 *
 * @param scheduled 메모리에 예약된 타이머가 있는지 여부
 * @param phase     타이머 상태 (예약되지 않았으면 null)
 */
public record GuestGrantResponse(
        String grantId,
        String guildId,
        String accountId,
        String accountTag,
        GrantStatus status,
        Instant grantedAt,
        Instant warningAt,
        Instant expiresAt,
        int removalAttempts,
        Instant nextAttemptAt,
        boolean scheduled,
        TimerPhase phase
) {
    public static GuestGrantResponse from(GuestGrant grant, TimerPhase phase) {
        return new GuestGrantResponse(
                grant.id(),
                grant.guildId(),
                grant.accountId(),
                grant.accountTag(),
                grant.status(),
                grant.grantedAt(),
                grant.warningAt(),
                grant.expiresAt(),
                grant.removalAttempts(),
                grant.nextAttemptAt(),
                phase != null,
                phase
        );
    }
}
