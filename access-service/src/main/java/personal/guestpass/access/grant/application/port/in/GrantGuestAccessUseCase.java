package personal.guestpass.access.grant.application.port.in;

import personal.guestpass.access.grant.domain.model.GuestGrant;

/**
 * 게스트 권한 부여 UseCase
 * 같은 Guild/계정의 기존 권한은 새 권한으로 교체됨
 */
public interface GrantGuestAccessUseCase {

    GuestGrant grant(GrantGuestAccessCommand command);
}
