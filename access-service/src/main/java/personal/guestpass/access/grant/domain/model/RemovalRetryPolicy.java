package personal.guestpass.access.grant.domain.model;

import java.time.Duration;

/**
 * 강제 퇴장 재시도 정책 (지수 백오프, 상한 있음)
 *
 * @param maxAttempts    최대 시도 횟수 (도달 시 MANUAL_REVIEW)
 * @param initialBackoff 첫 재시도 대기 시간
 * @param maxBackoff     대기 시간 상한
 */
public record RemovalRetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff) {

    public RemovalRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must not be shorter than initialBackoff");
        }
    }

    public boolean isExhausted(int attempts) {
        return attempts >= maxAttempts;
    }

    /**
     * attempt 번째 실패 이후의 대기 시간: initialBackoff * 2^(attempt-1), maxBackoff 로 제한
     */
    public Duration backoffAfter(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long multiplier = 1L << exponent;
        if (initialBackoff.toMillis() > maxBackoff.toMillis() / multiplier) {
            return maxBackoff;
        }
        Duration backoff = initialBackoff.multipliedBy(multiplier);
        return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
    }
}
