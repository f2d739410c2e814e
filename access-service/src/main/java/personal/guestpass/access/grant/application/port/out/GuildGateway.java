package personal.guestpass.access.grant.application.port.out;

import personal.guestpass.access.grant.domain.model.DirectMessage;
import personal.guestpass.access.grant.domain.model.Guild;
import personal.guestpass.access.grant.domain.model.GuildMember;

import java.util.Optional;

/**
 * Guild Gateway (Output Port)
 * 외부 커뮤니티 공간(Discord) API 인터페이스
 *
 * 조회 실패가 "없음"이면 Optional.empty(), 일시적 장애면
 * {@link personal.guestpass.access.grant.domain.exception.GuildGatewayUnavailableException}
 */
public interface GuildGateway {

    Optional<Guild> fetchGuild(String guildId);

    Optional<GuildMember> fetchMember(Guild guild, String accountId);

    /**
     * DM 발송 (best-effort)
     * 예외를 던지지 않음
     *
     * @return 발송 성공 여부
     */
    boolean sendDirectMessage(GuildMember member, DirectMessage message);

    /**
     * 멤버 강제 퇴장
     * 이미 나간 멤버(404)는 성공으로 간주
     *
     * @throws personal.guestpass.access.grant.domain.exception.GuildGatewayUnavailableException 일시적 장애
     * @throws personal.guestpass.access.grant.domain.exception.GuildRequestRejectedException   권한 부족 등 거부
     */
    void removeMember(GuildMember member, String reason);
}
