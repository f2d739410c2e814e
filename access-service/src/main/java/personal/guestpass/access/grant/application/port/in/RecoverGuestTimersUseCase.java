package personal.guestpass.access.grant.application.port.in;

/**
 * 재시작 시 타이머 복구 UseCase
 */
public interface RecoverGuestTimersUseCase {

    /**
     * 저장된 모든 권한에 대해 타이머를 다시 예약
     *
     * @return 처리한 권한 수
     */
    int recoverAll();
}
