package personal.guestpass.access.grant.application.port.in;

/**
 * 만료 시각이 지났지만 타이머가 없는 권한 정리 UseCase
 */
public interface SweepOverdueGrantsUseCase {

    /**
     * @return 다시 예약한 권한 수
     */
    int sweepOverdue();
}
