package personal.guestpass.access.grant.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.guestpass.access.grant.application.config.GuestAccessProperties;
import personal.guestpass.access.grant.application.port.out.GuestGrantRepository;
import personal.guestpass.access.grant.application.port.out.GuildGateway;
import personal.guestpass.access.grant.domain.model.EnforcementOutcome;
import personal.guestpass.access.grant.domain.model.GuestGrant;
import personal.guestpass.access.grant.domain.model.GuestRole;
import personal.guestpass.access.grant.domain.model.Guild;
import personal.guestpass.access.grant.domain.model.GuildMember;
import personal.guestpass.access.grant.domain.model.RemovalRetryPolicy;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Guest Enforcement Service
 * 만료된 게스트를 Guild 에서 퇴장시키고 권한 레코드를 정리
 *
 * 2단계 처리:
 * 1. 퇴장 확인 (퇴장 성공, 이미 나감, Guild 없음)
 * 2. 확인된 경우에만 레코드 삭제
 * 퇴장을 확인하지 못하면 레코드를 남기고 백오프 후 재시도, 한도 초과 시 MANUAL_REVIEW.
 *
 * 같은 권한에 대해 두 번 호출되어도 예외 없이 같은 최종 상태가 됨.
 */
@Slf4j
@Service
public class GuestEnforcementService {

    private final GuildGateway guildGateway;
    private final GuestGrantRepository grantRepository;
    private final GuestTimerRegistry timerRegistry;
    private final GuestNotificationDispatcher notificationDispatcher;
    private final RemovalRetryPolicy retryPolicy;
    private final GuestRole guestRole;
    private final String removalReason;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public GuestEnforcementService(GuildGateway guildGateway,
                                   GuestGrantRepository grantRepository,
                                   GuestTimerRegistry timerRegistry,
                                   GuestNotificationDispatcher notificationDispatcher,
                                   GuestAccessProperties properties,
                                   Clock clock,
                                   MeterRegistry meterRegistry) {
        this.guildGateway = guildGateway;
        this.grantRepository = grantRepository;
        this.timerRegistry = timerRegistry;
        this.notificationDispatcher = notificationDispatcher;
        this.retryPolicy = new RemovalRetryPolicy(
                properties.removal().maxAttempts(),
                properties.removal().initialBackoff(),
                properties.removal().maxBackoff());
        this.guestRole = properties.guestRole().toDomain();
        this.removalReason = properties.removalReason();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * 게스트 만료 처리
     * 어떤 경우에도 예외를 던지지 않으며, 종료 시 레지스트리 항목은 항상 제거됨
     */
    public EnforcementOutcome expireGuest(GuestGrant grant) {
        try {
            RemovalResult removal = removeFromGuild(grant);

            if (removal == RemovalResult.FAILED) {
                return recordFailedAttempt(grant);
            }

            return retireRecord(grant, removal == RemovalResult.REMOVED);

        } catch (Exception e) {
            log.error("Failed to expire guest: grantId={}, accountId={}", grant.id(), grant.accountId(), e);
            count("failed");
            return EnforcementOutcome.failed(grant.id());
        } finally {
            timerRegistry.remove(grant.id());
        }
    }

    /**
     * Guild / 멤버 조회 후 강제 퇴장
     * 조회 결과 "없음"은 이미 나간 것으로 간주
     * 게스트 역할이 없는 멤버(정식 멤버로 승격 등)는 퇴장시키지 않고 레코드만 정리
     */
    private RemovalResult removeFromGuild(GuestGrant grant) {
        Optional<Guild> guild;
        try {
            guild = guildGateway.fetchGuild(grant.guildId());
        } catch (RuntimeException e) {
            log.warn("Failed to resolve guild: grantId={}, guildId={}, error={}",
                    grant.id(), grant.guildId(), e.getMessage());
            return RemovalResult.FAILED;
        }

        if (guild.isEmpty()) {
            log.info("Guild no longer exists, retiring grant: grantId={}, guildId={}", grant.id(), grant.guildId());
            return RemovalResult.ALREADY_GONE;
        }

        Optional<GuildMember> member;
        try {
            member = guildGateway.fetchMember(guild.get(), grant.accountId());
        } catch (RuntimeException e) {
            log.warn("Failed to resolve guest member: grantId={}, accountId={}, error={}",
                    grant.id(), grant.accountId(), e.getMessage());
            return RemovalResult.FAILED;
        }

        if (member.isEmpty()) {
            log.info("Guest already left the guild: grantId={}, accountId={}", grant.id(), grant.accountId());
            return RemovalResult.ALREADY_GONE;
        }

        if (!guestRole.isHeldBy(guild.get(), member.get())) {
            log.info("Member no longer holds guest role, retiring grant without removal: grantId={}, accountId={}, role={}",
                    grant.id(), grant.accountId(), guestRole.name());
            return RemovalResult.ALREADY_GONE;
        }

        notificationDispatcher.sendFinalNotice(member.get(), grant);

        try {
            guildGateway.removeMember(member.get(), removalReason);
            log.info("Guest removed from guild: grantId={}, accountId={}, tag={}",
                    grant.id(), grant.accountId(), grant.accountTag());
            return RemovalResult.REMOVED;
        } catch (RuntimeException e) {
            log.error("Failed to remove guest from guild: grantId={}, accountId={}, attempt={}",
                    grant.id(), grant.accountId(), grant.removalAttempts() + 1, e);
            return RemovalResult.FAILED;
        }
    }

    /**
     * 퇴장 확인 후 레코드 삭제
     * 이미 삭제된 경우(false)도 정상
     */
    private EnforcementOutcome retireRecord(GuestGrant grant, boolean memberRemoved) {
        try {
            boolean deleted = grantRepository.deleteById(grant.id());
            if (!deleted) {
                log.debug("Guest grant already deleted: grantId={}", grant.id());
            }
        } catch (RuntimeException e) {
            log.error("Failed to delete guest grant, sweep will retry: grantId={}", grant.id(), e);
            count("delete_failed");
            return EnforcementOutcome.deleteFailed(grant.id());
        }

        log.info("Guest grant expired: grantId={}, accountId={}, memberRemoved={}",
                grant.id(), grant.accountId(), memberRemoved);
        count("completed");
        return EnforcementOutcome.completed(grant.id());
    }

    /**
     * 퇴장 실패 기록
     * 재시도 한도 내: RETRY_PENDING + nextAttemptAt, 한도 초과: MANUAL_REVIEW
     */
    private EnforcementOutcome recordFailedAttempt(GuestGrant grant) {
        int attempts = grant.removalAttempts() + 1;

        if (retryPolicy.isExhausted(attempts)) {
            boolean marked = grantRepository.markForManualReview(grant.id(), attempts);
            if (!marked) {
                log.info("Guest grant removed concurrently, no review needed: grantId={}", grant.id());
                return EnforcementOutcome.completed(grant.id());
            }
            log.error("Guest removal retries exhausted, manual review required: grantId={}, accountId={}, attempts={}",
                    grant.id(), grant.accountId(), attempts);
            count("manual_review");
            return EnforcementOutcome.manualReview(grant.id());
        }

        Instant retryAt = clock.instant().plus(retryPolicy.backoffAfter(attempts));
        boolean marked = grantRepository.markForRetry(grant.id(), attempts, retryAt);
        if (!marked) {
            log.info("Guest grant removed concurrently, no retry needed: grantId={}", grant.id());
            return EnforcementOutcome.completed(grant.id());
        }

        log.warn("Guest removal will be retried: grantId={}, attempt={}, retryAt={}",
                grant.id(), attempts, retryAt);
        count("retry");
        return EnforcementOutcome.retryScheduled(grant.withRetry(attempts, retryAt));
    }

    private void count(String result) {
        Counter.builder("guest.enforcement.outcome")
                .tag("result", result)
                .description("Guest expiry enforcement outcomes")
                .register(meterRegistry)
                .increment();
    }

    private enum RemovalResult {
        REMOVED,
        ALREADY_GONE,
        FAILED
    }
}
