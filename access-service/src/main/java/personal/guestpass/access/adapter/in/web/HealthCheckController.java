package personal.guestpass.access.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.guestpass.access.adapter.in.web.dto.HealthCheckResponse;
import personal.guestpass.access.grant.application.service.GuestTimerRegistry;
import personal.guestpass.common.dto.ApiResponse;
import personal.guestpass.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 데이터베이스 연결 상태와 예약된 타이머 수를 반환
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;
    private final GuestTimerRegistry timerRegistry;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String databaseStatus = healthCheckService.checkDatabase(dataSource);
        HealthCheckResponse data = new HealthCheckResponse(databaseStatus, timerRegistry.size());

        if ("UP".equals(databaseStatus)) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
