package personal.guestpass.access.grant.domain.exception;

import personal.guestpass.common.exception.BusinessException;
import personal.guestpass.common.exception.ErrorCode;

/**
 * Guild Request Rejected Exception
 * Discord API가 요청을 거부했을 때 발생 (403 Missing Permissions 등)
 * 같은 요청을 즉시 반복해도 성공하지 않으므로 Retry 대상이 아님
 */
public class GuildRequestRejectedException extends BusinessException {
    public GuildRequestRejectedException(int status, String detail) {
        super(ErrorCode.EXTERNAL_REQUEST_REJECTED,
                String.format("Discord API rejected request: status=%d, detail=%s", status, detail));
    }
}
