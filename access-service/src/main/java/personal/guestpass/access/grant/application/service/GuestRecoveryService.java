package personal.guestpass.access.grant.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.guestpass.access.grant.application.port.in.RecoverGuestTimersUseCase;
import personal.guestpass.access.grant.application.port.in.SweepOverdueGrantsUseCase;
import personal.guestpass.access.grant.application.port.out.GuestGrantRepository;
import personal.guestpass.access.grant.domain.model.GuestGrant;

import java.time.Clock;
import java.util.List;
import java.util.function.Consumer;

/**
 * Guest Recovery Service
 * 저장소 기준으로 메모리 상의 타이머를 복원
 *
 * - recoverAll: 프로세스 시작 시 1회, 모든 권한 재예약
 * - sweepOverdue: 주기적으로 만료 시각이 지났는데 타이머가 없는 권한 재처리
 *   (삭제 실패, 예상하지 못한 오류로 남은 레코드 정리)
 *   sweep 은 타이머 스레드에서 실행되므로 만료 처리는 worker 로 넘김
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuestRecoveryService implements RecoverGuestTimersUseCase, SweepOverdueGrantsUseCase {

    private final GuestGrantRepository grantRepository;
    private final GuestExpiryScheduler expiryScheduler;
    private final GuestTimerRegistry timerRegistry;
    private final Clock clock;

    @Override
    public int recoverAll() {
        log.info("Loading guest grants from database to reschedule timers");

        List<GuestGrant> grants;
        try {
            grants = grantRepository.findAll();
        } catch (Exception e) {
            log.error("Error loading guest grants, recovery skipped", e);
            return 0;
        }

        int rescheduled = scheduleEach(grants, expiryScheduler::schedule);

        log.info("Rescheduled guest grants: rescheduled={}, total={}", rescheduled, grants.size());
        return rescheduled;
    }

    @Override
    public int sweepOverdue() {
        List<GuestGrant> due = grantRepository.findEnforcementDue(clock.instant());
        if (due.isEmpty()) {
            return 0;
        }

        List<GuestGrant> orphaned = due.stream()
                .filter(grant -> !timerRegistry.contains(grant.id()))
                .toList();

        if (orphaned.isEmpty()) {
            log.debug("Overdue guest grants are already being processed: count={}", due.size());
            return 0;
        }

        log.info("Sweeping overdue guest grants: count={}", orphaned.size());
        return scheduleEach(orphaned, expiryScheduler::scheduleOnWorker);
    }

    /**
     * 권한별로 독립 처리 (한 건의 실패가 다른 권한에 영향을 주지 않음)
     */
    private int scheduleEach(List<GuestGrant> grants, Consumer<GuestGrant> scheduler) {
        int scheduled = 0;
        for (GuestGrant grant : grants) {
            try {
                scheduler.accept(grant);
                scheduled++;
            } catch (Exception e) {
                log.error("Failed to reschedule guest grant: grantId={}", grant.id(), e);
            }
        }
        return scheduled;
    }
}
