package personal.guestpass.access.grant.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.guestpass.access.grant.application.config.GuestAccessProperties;
import personal.guestpass.access.grant.application.port.in.GetGuestGrantsUseCase;
import personal.guestpass.access.grant.application.port.in.GrantGuestAccessCommand;
import personal.guestpass.access.grant.application.port.in.GrantGuestAccessUseCase;
import personal.guestpass.access.grant.application.port.in.RevokeGuestAccessUseCase;
import personal.guestpass.access.grant.application.port.out.GuestGrantRepository;
import personal.guestpass.access.grant.domain.exception.GuestGrantNotFoundException;
import personal.guestpass.access.grant.domain.model.GrantStatus;
import personal.guestpass.access.grant.domain.model.GuestGrant;
import personal.guestpass.access.grant.domain.model.GuestTimerHandle.TimerPhase;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Guest Access Service
 * 게스트 권한 부여 / 수동 회수 / 조회
 *
 * 만료 기간과 경고 리드 타임은 여기서 레코드의 절대 시각으로 변환되어 저장됨
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuestAccessService implements
        GrantGuestAccessUseCase,
        RevokeGuestAccessUseCase,
        GetGuestGrantsUseCase {

    private final GuestGrantRepository grantRepository;
    private final GuestExpiryScheduler expiryScheduler;
    private final GuestAccessProperties properties;
    private final Clock clock;

    @Override
    public GuestGrant grant(GrantGuestAccessCommand command) {
        Instant now = clock.instant();
        Instant expiresAt = command.expiresAt() != null
                ? command.expiresAt()
                : now.plus(properties.accessDuration());
        Instant warningAt = command.warningAt() != null
                ? command.warningAt()
                : expiresAt.minus(properties.warningLead());

        GuestGrant grant = GuestGrant.create(
                command.guildId(),
                command.accountId(),
                command.accountTag(),
                now,
                expiresAt,
                warningAt);

        // 같은 Guild/계정의 기존 권한은 교체 (기존 타이머 취소 후 삭제)
        grantRepository.findByGuildIdAndAccountId(command.guildId(), command.accountId())
                .ifPresent(existing -> {
                    log.info("Replacing existing guest grant: grantId={}, accountId={}",
                            existing.id(), existing.accountId());
                    expiryScheduler.cancel(existing.id());
                    grantRepository.deleteById(existing.id());
                });

        GuestGrant saved = grantRepository.save(grant);
        log.info("Guest grant saved: grantId={}, accountId={}, tag={}, expiresAt={}",
                saved.id(), saved.accountId(), saved.accountTag(), saved.expiresAt());

        expiryScheduler.schedule(saved);
        return saved;
    }

    @Override
    public void revoke(String grantId) {
        GuestGrant grant = grantRepository.findById(grantId)
                .orElseThrow(() -> new GuestGrantNotFoundException(grantId));

        expiryScheduler.cancel(grant.id());
        grantRepository.deleteById(grant.id());

        log.info("Guest grant revoked: grantId={}, accountId={}", grant.id(), grant.accountId());
    }

    @Override
    public GuestGrant getGrant(String grantId) {
        return grantRepository.findById(grantId)
                .orElseThrow(() -> new GuestGrantNotFoundException(grantId));
    }

    @Override
    public List<GuestGrant> getGrants(GrantStatus status) {
        if (status == null) {
            return grantRepository.findAll();
        }
        return grantRepository.findAllByStatus(status);
    }

    @Override
    public Optional<TimerPhase> findTimerPhase(String grantId) {
        return expiryScheduler.findTimerPhase(grantId);
    }
}
