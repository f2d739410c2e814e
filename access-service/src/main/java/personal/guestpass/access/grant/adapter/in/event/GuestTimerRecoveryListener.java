package personal.guestpass.access.grant.adapter.in.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import personal.guestpass.access.grant.application.port.in.RecoverGuestTimersUseCase;

/**
 * 애플리케이션 기동 완료 시 저장된 권한의 타이머를 복구
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GuestTimerRecoveryListener {

    private final RecoverGuestTimersUseCase recoverGuestTimersUseCase;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int rescheduled = recoverGuestTimersUseCase.recoverAll();
        log.info("Guest timer recovery finished: rescheduled={}", rescheduled);
    }
}
