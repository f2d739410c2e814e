package personal.guestpass.access.grant.domain.exception;

import personal.guestpass.common.exception.BusinessException;
import personal.guestpass.common.exception.ErrorCode;

/**
 * Guest Grant Not Found Exception
 * 게스트 권한을 찾을 수 없을 때 발생하는 예외
 */
public class GuestGrantNotFoundException extends BusinessException {
    public GuestGrantNotFoundException(String grantId) {
        super(ErrorCode.GUEST_GRANT_NOT_FOUND,
                String.format("Guest grant not found: grantId=%s", grantId));
    }
}
