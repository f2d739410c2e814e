package personal.guestpass.access.grant.domain.exception;

import personal.guestpass.common.exception.BusinessException;
import personal.guestpass.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Invalid Grant Window Exception
 * 경고 시각이 만료 시각보다 앞서지 않을 때 발생하는 예외
 */
public class InvalidGrantWindowException extends BusinessException {
    public InvalidGrantWindowException(Instant warningAt, Instant expiresAt) {
        super(ErrorCode.INVALID_GRANT_WINDOW,
                String.format("warningAt must be before expiresAt: warningAt=%s, expiresAt=%s", warningAt, expiresAt));
    }
}
