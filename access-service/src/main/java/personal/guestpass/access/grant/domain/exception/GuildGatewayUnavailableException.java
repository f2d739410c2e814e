package personal.guestpass.access.grant.domain.exception;

import personal.guestpass.common.exception.BusinessException;
import personal.guestpass.common.exception.ErrorCode;

/**
 * Guild Gateway Unavailable Exception
 * Discord API 호출이 일시적으로 실패했을 때 발생 (5xx, 429, 연결 실패, Timeout)
 * Retry / 재시도 대상
 */
public class GuildGatewayUnavailableException extends BusinessException {
    public GuildGatewayUnavailableException(String detail) {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR, "Discord API unavailable: " + detail);
    }

    public GuildGatewayUnavailableException(String detail, Throwable cause) {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR, "Discord API unavailable: " + detail, cause);
    }
}
