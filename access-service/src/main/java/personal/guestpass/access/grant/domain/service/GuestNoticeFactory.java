package personal.guestpass.access.grant.domain.service;

import personal.guestpass.access.grant.domain.model.DirectMessage;
import personal.guestpass.access.grant.domain.model.GuestGrant;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Guest Notice Factory
 * 게스트에게 보내는 경고/종료 안내 메시지 생성
 */
public class GuestNoticeFactory {

    static final int WARNING_COLOR = 0xfbbf24; // Amber
    static final int FAREWELL_COLOR = 0xef4444; // Red

    private final String organizationName;
    private final String recruitmentUrl;

    public GuestNoticeFactory(String organizationName, String recruitmentUrl) {
        this.organizationName = organizationName;
        this.recruitmentUrl = recruitmentUrl;
    }

    /**
     * 만료 경고 메시지
     * 남은 시간은 now 기준으로 계산하고, Discord 상대 시각 태그를 함께 표시
     */
    public DirectMessage warning(GuestGrant grant, Instant now) {
        Duration remaining = Duration.between(now, grant.expiresAt());
        return new DirectMessage(
                "Marketplace Access Expiring Soon",
                String.format("Your temporary marketplace access will expire in **%s**.", describe(remaining)),
                WARNING_COLOR,
                List.of(
                        new DirectMessage.Field("Expires", relativeTimestamp(grant.expiresAt())),
                        new DirectMessage.Field("What happens?",
                                "• You'll be removed from the server\n"
                                        + "• Your access to marketplace threads will end\n"
                                        + "• Complete any pending transactions before this time")),
                "This is an automated reminder from the " + organizationName + " Marketplace.");
    }

    /**
     * 만료 후 강제 퇴장 직전에 보내는 안내 메시지
     */
    public DirectMessage farewell(GuestGrant grant) {
        List<DirectMessage.Field> fields = new ArrayList<>();
        fields.add(new DirectMessage.Field("What happened?",
                "You've been removed from the " + organizationName
                        + " Discord server as your temporary marketplace access has ended."));
        fields.add(new DirectMessage.Field("Need access again?",
                "You can rejoin anytime by contacting another seller on our marketplace!"));
        if (recruitmentUrl != null && !recruitmentUrl.isBlank()) {
            fields.add(new DirectMessage.Field("Join " + organizationName,
                    "Visit " + recruitmentUrl + " to join our organization."));
        }
        return new DirectMessage(
                "Marketplace Access Expired",
                "Your temporary marketplace access has expired.",
                FAREWELL_COLOR,
                fields,
                organizationName + " Marketplace");
    }

    /**
     * Discord 상대 시각 태그 (<t:epochSeconds:R>)
     */
    static String relativeTimestamp(Instant instant) {
        return "<t:" + instant.getEpochSecond() + ":R>";
    }

    /**
     * 남은 시간을 가장 큰 단위 하나로 표현 (예: "2 days", "23 hours", "less than a minute")
     */
    static String describe(Duration remaining) {
        if (remaining.isNegative() || remaining.toMinutes() < 1) {
            return "less than a minute";
        }
        long days = remaining.toDays();
        if (days >= 2) {
            return days + " days";
        }
        long hours = remaining.toHours();
        if (hours >= 1) {
            return hours == 1 ? "1 hour" : hours + " hours";
        }
        long minutes = remaining.toMinutes();
        return minutes == 1 ? "1 minute" : minutes + " minutes";
    }
}
