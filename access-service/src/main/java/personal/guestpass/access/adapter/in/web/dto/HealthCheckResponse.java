package personal.guestpass.access.adapter.in.web.dto;

/**
 * Health Check 응답 데이터
 *
 * @param database     데이터베이스 연결 상태 ("UP" 또는 "DOWN")
 * @param activeTimers 현재 예약된 게스트 타이머 수
 */
public record HealthCheckResponse(
        String database,
        int activeTimers
) {
}
