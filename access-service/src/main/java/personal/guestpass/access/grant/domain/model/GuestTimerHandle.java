package personal.guestpass.access.grant.domain.model;

import java.util.concurrent.ScheduledFuture;

/**
 * 게스트 권한 하나에 대해 예약된 타이머 묶음 (프로세스 로컬, 비영속)
 *
 * @param warningTimer 경고 타이머 (경고 시각이 이미 지났으면 null)
 * @param expiryTimer  만료 타이머 (즉시 만료 처리 중이면 null)
 * @param phase        메모리 상 상태 (ACTIVE -> WARNED)
 */
public record GuestTimerHandle(
        ScheduledFuture<?> warningTimer,
        ScheduledFuture<?> expiryTimer,
        TimerPhase phase) {

    public enum TimerPhase {
        ACTIVE,
        WARNED,
        RETRY_PENDING,  // 퇴장 실패 후 재시도 타이머 대기
        ENFORCING;      // 타이머 없이 즉시 만료 처리 중

        /**
         * 저장된 권한 상태로부터 타이머의 시작 상태 결정 (재시작 후에도 WARNED 유지)
         */
        public static TimerPhase startingFrom(GrantStatus status) {
            return switch (status) {
                case WARNED -> WARNED;
                case RETRY_PENDING -> RETRY_PENDING;
                case ACTIVE, MANUAL_REVIEW -> ACTIVE;
            };
        }
    }

    public static GuestTimerHandle armed(ScheduledFuture<?> warningTimer, ScheduledFuture<?> expiryTimer,
                                         TimerPhase phase) {
        return new GuestTimerHandle(warningTimer, expiryTimer, phase);
    }

    /**
     * 즉시 만료 처리 중임을 표시하는 placeholder
     * 같은 ID로 동시에 들어온 schedule 요청을 무시하기 위해 사용
     */
    public static GuestTimerHandle enforcing() {
        return new GuestTimerHandle(null, null, TimerPhase.ENFORCING);
    }

    public GuestTimerHandle warned() {
        return new GuestTimerHandle(warningTimer, expiryTimer, TimerPhase.WARNED);
    }

    /**
     * 예약된 타이머 취소 (실행 중인 작업은 인터럽트하지 않음)
     */
    public void cancel() {
        if (warningTimer != null) {
            warningTimer.cancel(false);
        }
        if (expiryTimer != null) {
            expiryTimer.cancel(false);
        }
    }
}
