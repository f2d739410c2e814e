package personal.guestpass.access.grant.application.port.in;

import java.time.Instant;

/**
 * 게스트 권한 부여 Command
 *
 * @param guildId    Guild ID
 * @param accountId  계정 ID
 * @param accountTag 계정 표시 이름
 * @param expiresAt  만료 시각 (null 이면 기본 기간 적용)
 * @param warningAt  경고 시각 (null 이면 만료 시각 - 기본 경고 리드 타임)
 */
public record GrantGuestAccessCommand(
        String guildId,
        String accountId,
        String accountTag,
        Instant expiresAt,
        Instant warningAt) {

    public static GrantGuestAccessCommand withDefaults(String guildId, String accountId, String accountTag) {
        return new GrantGuestAccessCommand(guildId, accountId, accountTag, null, null);
    }
}
