package personal.guestpass.access.grant.application.port.in;

import personal.guestpass.access.grant.domain.model.GrantStatus;
import personal.guestpass.access.grant.domain.model.GuestGrant;
import personal.guestpass.access.grant.domain.model.GuestTimerHandle.TimerPhase;

import java.util.List;
import java.util.Optional;

/**
 * 게스트 권한 조회 UseCase
 */
public interface GetGuestGrantsUseCase {

    GuestGrant getGrant(String grantId);

    /**
     * @param status null 이면 전체 조회
     */
    List<GuestGrant> getGrants(GrantStatus status);

    /**
     * 메모리 상 타이머 상태 (예약된 타이머가 없으면 empty)
     */
    Optional<TimerPhase> findTimerPhase(String grantId);
}
