package personal.guestpass.access.grant.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.guestpass.access.grant.application.port.in.GrantGuestAccessCommand;

import java.time.Instant;

/**
 * 게스트 권한 부여 요청 DTO
 * expiresAt / warningAt 을 생략하면 기본 기간과 경고 리드 타임이 적용됨
 */
public record GrantGuestRequest(
        @NotBlank(message = "Guild ID는 필수입니다.")
        String guildId,

        @NotBlank(message = "계정 ID는 필수입니다.")
        String accountId,

        @Size(max = 100, message = "계정 표시 이름은 100자를 넘을 수 없습니다.")
        String accountTag,

        Instant expiresAt,

        Instant warningAt
) {
    public GrantGuestAccessCommand toCommand() {
        return new GrantGuestAccessCommand(guildId, accountId, accountTag, expiresAt, warningAt);
    }
}
