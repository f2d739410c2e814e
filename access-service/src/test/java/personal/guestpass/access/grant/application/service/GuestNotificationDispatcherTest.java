package personal.guestpass.access.grant.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.guestpass.access.grant.application.config.GuestAccessProperties;
import personal.guestpass.access.grant.application.port.out.GuildGateway;
import personal.guestpass.access.grant.domain.exception.GuildGatewayUnavailableException;
import personal.guestpass.access.grant.domain.model.DirectMessage;
import personal.guestpass.access.grant.domain.model.GuestGrant;
import personal.guestpass.access.grant.domain.model.Guild;
import personal.guestpass.access.grant.domain.model.GuildMember;
import personal.guestpass.access.grant.domain.model.GuildRole;
import personal.guestpass.access.grant.domain.service.GuestNoticeFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("GuestNotificationDispatcher 단위 테스트")
class GuestNotificationDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-07T12:00:00Z");

    @Mock
    private GuildGateway guildGateway;

    private SimpleMeterRegistry meterRegistry;
    private GuestNotificationDispatcher dispatcher;
    private GuestGrant grant;
    private Guild guild;
    private GuildMember member;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new GuestNotificationDispatcher(
                guildGateway,
                new GuestNoticeFactory("House Wolf", null),
                properties(),
                Clock.fixed(NOW, ZoneOffset.UTC),
                meterRegistry);
        grant = GuestGrant.create("guild-1", "account-1", "trader",
                NOW.minus(Duration.ofDays(6)), NOW.plus(Duration.ofHours(24)), NOW);
        guild = new Guild("guild-1", "House Wolf", List.of(new GuildRole("role-guest", "Marketplace Guest")));
        member = new GuildMember("guild-1", "account-1", "trader", Set.of("role-guest"));
    }

    @Test
    @DisplayName("멤버가 있으면 남은 시간을 담은 경고 DM 을 보낸다")
    void sendWarning_Success() {
        // given
        given(guildGateway.fetchGuild("guild-1")).willReturn(Optional.of(guild));
        given(guildGateway.fetchMember(guild, "account-1")).willReturn(Optional.of(member));
        given(guildGateway.sendDirectMessage(any(), any())).willReturn(true);

        // when
        boolean sent = dispatcher.sendWarning(grant);

        // then
        assertThat(sent).isTrue();
        ArgumentCaptor<DirectMessage> captor = ArgumentCaptor.forClass(DirectMessage.class);
        verify(guildGateway).sendDirectMessage(any(), captor.capture());
        assertThat(captor.getValue().description()).contains("24 hours");
        assertThat(meterRegistry.get("guest.notice.sent").tag("type", "warning").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("멤버가 이미 나갔으면 조용히 건너뛴다")
    void sendWarning_MemberGone() {
        // given
        given(guildGateway.fetchGuild("guild-1")).willReturn(Optional.of(guild));
        given(guildGateway.fetchMember(guild, "account-1")).willReturn(Optional.empty());

        // when
        boolean sent = dispatcher.sendWarning(grant);

        // then
        assertThat(sent).isFalse();
        verify(guildGateway, never()).sendDirectMessage(any(), any());
    }

    @Test
    @DisplayName("게스트 역할이 없는 멤버(정식 멤버로 승격)에게는 경고를 보내지 않는다")
    void sendWarning_PromotedMemberIsSkipped() {
        // given
        GuildMember promoted = new GuildMember("guild-1", "account-1", "trader", Set.of("role-member"));
        given(guildGateway.fetchGuild("guild-1")).willReturn(Optional.of(guild));
        given(guildGateway.fetchMember(guild, "account-1")).willReturn(Optional.of(promoted));

        // when
        boolean sent = dispatcher.sendWarning(grant);

        // then
        assertThat(sent).isFalse();
        verify(guildGateway, never()).sendDirectMessage(any(), any());
    }

    @Test
    @DisplayName("조회 중 장애가 발생해도 예외를 전파하지 않는다")
    void sendWarning_GatewayFailureIsContained() {
        // given
        given(guildGateway.fetchGuild("guild-1"))
                .willThrow(new GuildGatewayUnavailableException("fetchGuild status=503"));

        // when
        boolean sent = dispatcher.sendWarning(grant);

        // then
        assertThat(sent).isFalse();
        assertThat(meterRegistry.get("guest.notice.failed").tag("type", "warning").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("DM 이 차단된 경우 종료 안내는 실패로 기록만 한다")
    void sendFinalNotice_Blocked() {
        // given
        given(guildGateway.sendDirectMessage(any(), any())).willReturn(false);

        // when
        boolean sent = dispatcher.sendFinalNotice(member, grant);

        // then
        assertThat(sent).isFalse();
        assertThat(meterRegistry.get("guest.notice.failed").tag("type", "final").counter().count())
                .isEqualTo(1.0);
    }

    private static GuestAccessProperties properties() {
        return new GuestAccessProperties(
                Duration.ofDays(7),
                Duration.ofHours(24),
                "Marketplace guest access expired",
                new GuestAccessProperties.Removal(5, Duration.ofMinutes(1), Duration.ofHours(1)),
                new GuestAccessProperties.Notice("House Wolf", null),
                new GuestAccessProperties.Role("role-guest", "Marketplace Guest"));
    }
}
