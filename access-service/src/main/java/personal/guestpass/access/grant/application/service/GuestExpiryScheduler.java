package personal.guestpass.access.grant.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import personal.guestpass.access.grant.application.port.out.GuestGrantRepository;
import personal.guestpass.access.grant.domain.model.EnforcementOutcome;
import personal.guestpass.access.grant.domain.model.GuestGrant;
import personal.guestpass.access.grant.domain.model.GuestTimerHandle;
import personal.guestpass.access.grant.domain.model.GuestTimerHandle.TimerPhase;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Guest Expiry Scheduler
 * 권한의 절대 시각(warningAt, expiresAt)으로 경고/만료 타이머를 예약
 *
 * - schedule: 같은 ID로 이미 예약되어 있으면 아무것도 하지 않음 (재시작 복구와 신규 생성이 겹치는 경우)
 * - 만료 시각이 이미 지났으면 타이머 없이 호출 스레드에서 즉시 만료 처리
 * - 경고 시각이 이미 지났으면 경고는 보내지 않음 (늦은 경고 없음)
 * - 타이머 콜백은 작업을 worker executor 로 넘기기만 하고, 네트워크 호출은 worker 에서 수행
 * - worker 작업은 실행 직전에 타이머가 아직 등록되어 있는지 확인 (그 사이 취소된 경우 건너뜀)
 */
@Slf4j
@Service
public class GuestExpiryScheduler {

    private final GuestTimerRegistry timerRegistry;
    private final GuestEnforcementService enforcementService;
    private final GuestNotificationDispatcher notificationDispatcher;
    private final GuestGrantRepository grantRepository;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor taskExecutor;
    private final Clock clock;

    public GuestExpiryScheduler(GuestTimerRegistry timerRegistry,
                                GuestEnforcementService enforcementService,
                                GuestNotificationDispatcher notificationDispatcher,
                                GuestGrantRepository grantRepository,
                                TaskScheduler taskScheduler,
                                @Qualifier("guestTaskExecutor") TaskExecutor taskExecutor,
                                Clock clock) {
        this.timerRegistry = timerRegistry;
        this.enforcementService = enforcementService;
        this.notificationDispatcher = notificationDispatcher;
        this.grantRepository = grantRepository;
        this.taskScheduler = taskScheduler;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
    }

    public void schedule(GuestGrant grant) {
        if (grant.isAwaitingManualReview()) {
            log.warn("Guest grant awaits manual review, not scheduling: grantId={}, attempts={}",
                    grant.id(), grant.removalAttempts());
            return;
        }

        Instant now = clock.instant();
        Instant dueAt = grant.enforcementDueAt();

        // 이미 만료됨 -> 즉시 처리
        if (!dueAt.isAfter(now)) {
            if (!timerRegistry.registerIfAbsent(grant.id(), GuestTimerHandle::enforcing)) {
                log.debug("Timer already exists, skipping: grantId={}", grant.id());
                return;
            }
            log.info("Guest grant already expired, enforcing now: grantId={}, accountId={}, dueAt={}",
                    grant.id(), grant.accountId(), dueAt);
            try {
                enforce(grant);
            } catch (RuntimeException e) {
                timerRegistry.remove(grant.id());
                log.error("Immediate expiry failed: grantId={}", grant.id(), e);
            }
            return;
        }

        boolean registered = timerRegistry.registerIfAbsent(grant.id(), () -> arm(grant, now, dueAt));
        if (!registered) {
            log.debug("Timer already exists, skipping: grantId={}", grant.id());
            return;
        }

        log.info("Scheduled guest expiry: grantId={}, accountId={}, in={}, dueAt={}",
                grant.id(), grant.accountId(), Duration.between(now, dueAt), dueAt);
    }

    /**
     * schedule 을 worker 에서 실행
     * 만료된 권한의 즉시 처리(네트워크 호출)가 호출 스레드를 막지 않아야 하는 경우 사용 (주기 sweep)
     *
     * @throws org.springframework.core.task.TaskRejectedException worker 가 작업을 받지 못한 경우
     */
    public void scheduleOnWorker(GuestGrant grant) {
        taskExecutor.execute(() -> runContained(grant, "schedule", () -> schedule(grant)));
    }

    /**
     * 예약된 타이머 취소 (외부 호출 없음)
     *
     * @return 취소할 타이머가 있었는지 여부
     */
    public boolean cancel(String grantId) {
        return timerRegistry.remove(grantId)
                .map(handle -> {
                    handle.cancel();
                    log.info("Cancelled guest timers: grantId={}", grantId);
                    return true;
                })
                .orElse(false);
    }

    public Optional<TimerPhase> findTimerPhase(String grantId) {
        return timerRegistry.find(grantId).map(GuestTimerHandle::phase);
    }

    /**
     * 타이머 예약 (registry lock 안에서 호출됨, non-blocking)
     */
    private GuestTimerHandle arm(GuestGrant grant, Instant now, Instant dueAt) {
        ScheduledFuture<?> warningTimer = null;
        if (grant.hasPendingWarning(now) && grant.warningAt().isBefore(dueAt)) {
            warningTimer = taskScheduler.schedule(() -> dispatchWarning(grant), grant.warningAt());
        } else {
            log.debug("Warning window already passed, skipping warning: grantId={}, warningAt={}",
                    grant.id(), grant.warningAt());
        }

        try {
            ScheduledFuture<?> expiryTimer = taskScheduler.schedule(() -> dispatchExpiry(grant), dueAt);
            return GuestTimerHandle.armed(warningTimer, expiryTimer, TimerPhase.startingFrom(grant.status()));
        } catch (RuntimeException e) {
            if (warningTimer != null) {
                warningTimer.cancel(false);
            }
            throw e;
        }
    }

    private void dispatchWarning(GuestGrant grant) {
        try {
            taskExecutor.execute(() -> runIfStillScheduled(grant, "warning", () -> warn(grant)));
        } catch (RuntimeException e) {
            log.error("Failed to dispatch warning task: grantId={}", grant.id(), e);
        }
    }

    private void dispatchExpiry(GuestGrant grant) {
        try {
            taskExecutor.execute(() -> runIfStillScheduled(grant, "expiry", () -> enforce(grant)));
        } catch (RuntimeException e) {
            // 핸들을 남겨두면 sweep 이 건너뛰므로 제거
            timerRegistry.remove(grant.id());
            log.error("Failed to dispatch expiry task, sweep will retry: grantId={}", grant.id(), e);
        }
    }

    private void warn(GuestGrant grant) {
        notificationDispatcher.sendWarning(grant);
        timerRegistry.markWarned(grant.id());
        try {
            grantRepository.markWarned(grant.id());
        } catch (RuntimeException e) {
            log.warn("Failed to persist warned status: grantId={}", grant.id(), e);
        }
    }

    private void enforce(GuestGrant grant) {
        EnforcementOutcome outcome = enforcementService.expireGuest(grant);
        if (outcome.needsRetry()) {
            schedule(outcome.retryGrant());
        }
    }

    /**
     * 타이머가 작업을 넘긴 뒤 worker 가 실행하기 전에 취소(revoke)되었으면 실행하지 않음
     */
    private void runIfStillScheduled(GuestGrant grant, String action, Runnable task) {
        if (!timerRegistry.contains(grant.id())) {
            log.info("Guest timer was cancelled before task ran, skipping: grantId={}, action={}",
                    grant.id(), action);
            return;
        }
        runContained(grant, action, task);
    }

    private void runContained(GuestGrant grant, String action, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Guest task failed: grantId={}, action={}", grant.id(), action, e);
        }
    }
}
