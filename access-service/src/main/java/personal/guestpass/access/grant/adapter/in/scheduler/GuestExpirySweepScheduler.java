package personal.guestpass.access.grant.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.guestpass.access.grant.application.port.in.SweepOverdueGrantsUseCase;

/**
 * Guest Expiry Sweep Scheduler
 * 만료 시각이 지났지만 타이머가 없는 권한을 주기적으로 재처리
 * (레코드 삭제 실패, 타이머 유실 등)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GuestExpirySweepScheduler {

    private final SweepOverdueGrantsUseCase sweepOverdueGrantsUseCase;

    @Scheduled(fixedDelayString = "${guest.access.sweep-interval-ms:60000}",
            initialDelayString = "${guest.access.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            int swept = sweepOverdueGrantsUseCase.sweepOverdue();
            if (swept > 0) {
                log.info("Swept overdue guest grants: count={}", swept);
            }
        } catch (Exception e) {
            log.error("Error sweeping overdue guest grants", e);
        }
    }
}
