package personal.guestpass.access.grant.adapter.out.discord;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import personal.guestpass.access.grant.adapter.out.discord.DiscordPayloads.ChannelResponse;
import personal.guestpass.access.grant.adapter.out.discord.DiscordPayloads.CreateDmRequest;
import personal.guestpass.access.grant.adapter.out.discord.DiscordPayloads.CreateMessageRequest;
import personal.guestpass.access.grant.adapter.out.discord.DiscordPayloads.GuildResponse;
import personal.guestpass.access.grant.adapter.out.discord.DiscordPayloads.MemberResponse;
import personal.guestpass.access.grant.application.port.out.GuildGateway;
import personal.guestpass.access.grant.domain.exception.GuildGatewayUnavailableException;
import personal.guestpass.access.grant.domain.exception.GuildRequestRejectedException;
import personal.guestpass.access.grant.domain.model.DirectMessage;
import personal.guestpass.access.grant.domain.model.Guild;
import personal.guestpass.access.grant.domain.model.GuildMember;
import personal.guestpass.access.grant.domain.model.GuildRole;
import personal.guestpass.common.exception.BusinessException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Discord REST Client Adapter
 * Discord Bot API 와 HTTP 통신하는 GuildGateway 구현체 (RestClient 사용)
 *
 * 응답 분류:
 * - 404: 대상 없음 (조회는 Optional.empty(), 퇴장은 성공)
 * - 429, 5xx, 연결 실패, Timeout: GuildGatewayUnavailableException → Retry / Circuit 실패로 카운트
 * - 그 외 4xx: GuildRequestRejectedException → ignoreExceptions → Retry 하지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscordRestClientAdapter implements GuildGateway {

    static final String AUDIT_LOG_REASON_HEADER = "X-Audit-Log-Reason";

    private final RestClient discordRestClient;

    @Override
    @CircuitBreaker(name = "discord", fallbackMethod = "fetchGuildFallback")
    @Retry(name = "discord")
    public Optional<Guild> fetchGuild(String guildId) {
        log.debug("Fetching guild: guildId={}", guildId);

        return call("fetchGuild", () -> discordRestClient.get()
                .uri("/guilds/{guildId}", guildId)
                .exchange((request, response) -> {
                    HttpStatusCode status = response.getStatusCode();
                    if (status.value() == HttpStatus.NOT_FOUND.value()) {
                        return Optional.<Guild>empty();
                    }
                    ensureSuccess(status, "fetchGuild");
                    GuildResponse body = response.bodyTo(GuildResponse.class);
                    if (body == null) {
                        throw new GuildGatewayUnavailableException("fetchGuild returned empty body");
                    }
                    List<GuildRole> roles = body.roles() == null ? List.of() : body.roles().stream()
                            .map(role -> new GuildRole(role.id(), role.name()))
                            .toList();
                    return Optional.of(new Guild(body.id(), body.name(), roles));
                }));
    }

    @Override
    @CircuitBreaker(name = "discord", fallbackMethod = "fetchMemberFallback")
    @Retry(name = "discord")
    public Optional<GuildMember> fetchMember(Guild guild, String accountId) {
        log.debug("Fetching guild member: guildId={}, accountId={}", guild.id(), accountId);

        return call("fetchMember", () -> discordRestClient.get()
                .uri("/guilds/{guildId}/members/{userId}", guild.id(), accountId)
                .exchange((request, response) -> {
                    HttpStatusCode status = response.getStatusCode();
                    if (status.value() == HttpStatus.NOT_FOUND.value()) {
                        return Optional.<GuildMember>empty();
                    }
                    ensureSuccess(status, "fetchMember");
                    MemberResponse body = response.bodyTo(MemberResponse.class);
                    String username = body == null || body.user() == null ? null : body.user().username();
                    Set<String> roleIds = body == null || body.roles() == null ? Set.of() : Set.copyOf(body.roles());
                    return Optional.of(new GuildMember(guild.id(), accountId, username, roleIds));
                }));
    }

    /**
     * DM 채널 생성 후 embed 메시지 전송
     * 수신 차단(403) 등 모든 실패는 false 로 반환
     */
    @Override
    public boolean sendDirectMessage(GuildMember member, DirectMessage message) {
        try {
            ChannelResponse channel = discordRestClient.post()
                    .uri("/users/@me/channels")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new CreateDmRequest(member.accountId()))
                    .retrieve()
                    .body(ChannelResponse.class);

            if (channel == null || channel.id() == null) {
                log.warn("DM channel was not created: accountId={}", member.accountId());
                return false;
            }

            discordRestClient.post()
                    .uri("/channels/{channelId}/messages", channel.id())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(CreateMessageRequest.of(message))
                    .retrieve()
                    .toBodilessEntity();

            log.debug("Direct message sent: accountId={}, title={}", member.accountId(), message.title());
            return true;
        } catch (RestClientException e) {
            log.warn("Failed to send direct message: accountId={}, error={}", member.accountId(), e.getMessage());
            return false;
        }
    }

    @Override
    @CircuitBreaker(name = "discord", fallbackMethod = "removeMemberFallback")
    @Retry(name = "discord")
    public void removeMember(GuildMember member, String reason) {
        log.debug("Removing guild member: guildId={}, accountId={}", member.guildId(), member.accountId());

        call("removeMember", () -> discordRestClient.delete()
                .uri("/guilds/{guildId}/members/{userId}", member.guildId(), member.accountId())
                .header(AUDIT_LOG_REASON_HEADER, encodeReason(reason))
                .exchange((request, response) -> {
                    HttpStatusCode status = response.getStatusCode();
                    if (status.value() == HttpStatus.NOT_FOUND.value()) {
                        log.debug("Member already left: guildId={}, accountId={}",
                                member.guildId(), member.accountId());
                        return null;
                    }
                    ensureSuccess(status, "removeMember");
                    return null;
                }));
    }

    /**
     * Fallback 메서드
     * Circuit Breaker Open 또는 Retry 소진 시 호출
     * 분류된 예외는 그대로 전달하고, 그 외(CallNotPermittedException 등)는 일시적 장애로 변환
     */
    private Optional<Guild> fetchGuildFallback(String guildId, Exception e) {
        throw translate("fetchGuild", e);
    }

    private Optional<GuildMember> fetchMemberFallback(Guild guild, String accountId, Exception e) {
        throw translate("fetchMember", e);
    }

    private void removeMemberFallback(GuildMember member, String reason, Exception e) {
        throw translate("removeMember", e);
    }

    private RuntimeException translate(String operation, Exception e) {
        if (e instanceof BusinessException) {
            return (BusinessException) e;
        }
        log.error("Discord circuit breaker opened or call failed: operation={}, error={}",
                operation, e.getClass().getSimpleName());
        return new GuildGatewayUnavailableException(operation + " failed", e);
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientException e) {
            throw new GuildGatewayUnavailableException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private void ensureSuccess(HttpStatusCode status, String operation) {
        if (status.is2xxSuccessful()) {
            return;
        }
        if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value() || status.is5xxServerError()) {
            log.warn("Discord API unavailable: operation={}, status={}", operation, status.value());
            throw new GuildGatewayUnavailableException(operation + " status=" + status.value());
        }
        log.warn("Discord API rejected request: operation={}, status={}", operation, status.value());
        throw new GuildRequestRejectedException(status.value(), operation);
    }

    static String encodeReason(String reason) {
        return URLEncoder.encode(reason, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
