package personal.guestpass.access.grant.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.guestpass.access.grant.application.config.GuestAccessProperties;
import personal.guestpass.access.grant.application.port.out.GuildGateway;
import personal.guestpass.access.grant.domain.model.DirectMessage;
import personal.guestpass.access.grant.domain.model.GuestGrant;
import personal.guestpass.access.grant.domain.model.GuestRole;
import personal.guestpass.access.grant.domain.model.Guild;
import personal.guestpass.access.grant.domain.model.GuildMember;
import personal.guestpass.access.grant.domain.service.GuestNoticeFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Guest Notification Dispatcher
 * 만료 경고 / 종료 안내 DM 발송 (best-effort)
 *
 * 발송 실패는 로그만 남기고 전파하지 않음. 재시도하지 않음.
 * 실패가 이후 만료 처리를 막아서는 안 됨.
 */
@Slf4j
@Service
public class GuestNotificationDispatcher {

    private static final String WARNING = "warning";
    private static final String FINAL = "final";

    private final GuildGateway guildGateway;
    private final GuestNoticeFactory noticeFactory;
    private final GuestRole guestRole;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public GuestNotificationDispatcher(GuildGateway guildGateway,
                                       GuestNoticeFactory noticeFactory,
                                       GuestAccessProperties properties,
                                       Clock clock,
                                       MeterRegistry meterRegistry) {
        this.guildGateway = guildGateway;
        this.noticeFactory = noticeFactory;
        this.guestRole = properties.guestRole().toDomain();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * 만료 경고 발송
     * Guild 또는 멤버가 없거나 (이미 나간 경우) 게스트 역할이 없으면 조용히 종료
     *
     * @return 발송 성공 여부
     */
    public boolean sendWarning(GuestGrant grant) {
        try {
            Optional<Guild> guild = guildGateway.fetchGuild(grant.guildId());
            if (guild.isEmpty()) {
                log.debug("Guild not found, skipping warning: grantId={}, guildId={}", grant.id(), grant.guildId());
                return false;
            }

            Optional<GuildMember> member = guildGateway.fetchMember(guild.get(), grant.accountId());
            if (member.isEmpty()) {
                log.debug("Guest already left, skipping warning: grantId={}, accountId={}",
                        grant.id(), grant.accountId());
                return false;
            }

            if (!guestRole.isHeldBy(guild.get(), member.get())) {
                log.debug("Member no longer holds guest role, skipping warning: grantId={}, accountId={}",
                        grant.id(), grant.accountId());
                return false;
            }

            DirectMessage message = noticeFactory.warning(grant, clock.instant());
            return deliver(member.get(), message, grant, WARNING);
        } catch (Exception e) {
            log.error("Warning failed: grantId={}, accountId={}", grant.id(), grant.accountId(), e);
            countFailure(WARNING);
            return false;
        }
    }

    /**
     * 강제 퇴장 직전 종료 안내 발송
     */
    public boolean sendFinalNotice(GuildMember member, GuestGrant grant) {
        try {
            return deliver(member, noticeFactory.farewell(grant), grant, FINAL);
        } catch (Exception e) {
            log.warn("Final notice failed: grantId={}, accountId={}", grant.id(), grant.accountId(), e);
            countFailure(FINAL);
            return false;
        }
    }

    private boolean deliver(GuildMember member, DirectMessage message, GuestGrant grant, String type) {
        boolean sent = guildGateway.sendDirectMessage(member, message);
        if (sent) {
            log.info("Guest notice sent: type={}, grantId={}, accountId={}", type, grant.id(), grant.accountId());
            Counter.builder("guest.notice.sent")
                    .tag("type", type)
                    .description("Number of guest notices delivered")
                    .register(meterRegistry)
                    .increment();
        } else {
            // DM 차단 등: 정상적인 실패 케이스
            log.warn("Could not deliver guest notice: type={}, grantId={}, accountId={}",
                    type, grant.id(), grant.accountId());
            countFailure(type);
        }
        return sent;
    }

    private void countFailure(String type) {
        Counter.builder("guest.notice.failed")
                .tag("type", type)
                .description("Number of guest notices that could not be delivered")
                .register(meterRegistry)
                .increment();
    }
}
