package personal.guestpass.access.grant.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.guestpass.access.grant.domain.model.DirectMessage;
import personal.guestpass.access.grant.domain.model.GuestGrant;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GuestNoticeFactory 테스트")
class GuestNoticeFactoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final GuestNoticeFactory factory =
            new GuestNoticeFactory("House Wolf", "https://example.org/join");

    @Test
    @DisplayName("경고 메시지는 남은 시간과 Discord 상대 시각 태그를 포함한다")
    void warning() {
        // given
        GuestGrant grant = GuestGrant.create("guild-1", "account-1", "trader",
                NOW, NOW.plus(Duration.ofHours(24)), NOW);

        // when
        DirectMessage message = factory.warning(grant, NOW);

        // then
        assertThat(message.title()).isEqualTo("Marketplace Access Expiring Soon");
        assertThat(message.description()).contains("**24 hours**");
        assertThat(message.color()).isEqualTo(GuestNoticeFactory.WARNING_COLOR);
        assertThat(message.fields()).extracting(DirectMessage.Field::value)
                .contains("<t:" + grant.expiresAt().getEpochSecond() + ":R>");
        assertThat(message.footer()).contains("House Wolf");
    }

    @Test
    @DisplayName("종료 안내는 모집 링크가 있을 때만 가입 안내를 포함한다")
    void farewell() {
        // given
        GuestGrant grant = GuestGrant.create("guild-1", "account-1", "trader",
                NOW, NOW.plusSeconds(60), NOW);

        // when
        DirectMessage withLink = factory.farewell(grant);
        DirectMessage withoutLink = new GuestNoticeFactory("House Wolf", "").farewell(grant);

        // then
        assertThat(withLink.color()).isEqualTo(GuestNoticeFactory.FAREWELL_COLOR);
        assertThat(withLink.fields()).extracting(DirectMessage.Field::name).contains("Join House Wolf");
        assertThat(withoutLink.fields()).extracting(DirectMessage.Field::name).doesNotContain("Join House Wolf");
    }

    @Test
    @DisplayName("남은 시간은 가장 큰 단위 하나로 표현된다")
    void describe() {
        assertThat(GuestNoticeFactory.describe(Duration.ofSeconds(30))).isEqualTo("less than a minute");
        assertThat(GuestNoticeFactory.describe(Duration.ofMinutes(1))).isEqualTo("1 minute");
        assertThat(GuestNoticeFactory.describe(Duration.ofMinutes(45))).isEqualTo("45 minutes");
        assertThat(GuestNoticeFactory.describe(Duration.ofHours(1))).isEqualTo("1 hour");
        assertThat(GuestNoticeFactory.describe(Duration.ofHours(36))).isEqualTo("36 hours");
        assertThat(GuestNoticeFactory.describe(Duration.ofDays(3))).isEqualTo("3 days");
        assertThat(GuestNoticeFactory.describe(Duration.ofMinutes(-5))).isEqualTo("less than a minute");
    }
}
