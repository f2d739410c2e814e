package personal.guestpass.access.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.guestpass.access.grant.application.service.GuestTimerRegistry;
import personal.guestpass.common.health.HealthCheckService;

import javax.sql.DataSource;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Health Check Controller 단위 테스트
 * BDD Style (Given-When-Then)
 */
@WebMvcTest(HealthCheckController.class)
@DisplayName("Access Service Health Check API 단위 테스트")
class HealthCheckControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DataSource dataSource;

    @MockBean
    private HealthCheckService healthCheckService;

    @MockBean
    private GuestTimerRegistry timerRegistry;

    @Test
    @DisplayName("헬스 체크 API는 DB 상태와 예약된 타이머 수를 반환한다")
    void healthCheckReturnsSuccess() throws Exception {
        // Given: DB 정상, 타이머 3개 예약
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("UP");
        given(timerRegistry.size()).willReturn(3);

        // When: 헬스 체크 엔드포인트를 호출하면
        mockMvc.perform(get("/api/v1/health")
                        .contentType(MediaType.APPLICATION_JSON))
                // Then: 200 OK와 함께 정상 응답을 반환한다
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.data.database").value("UP"))
                .andExpect(jsonPath("$.data.activeTimers").value(3));
    }

    @Test
    @DisplayName("DB 가 내려가 있으면 error 결과를 반환한다")
    void healthCheckReportsDatabaseDown() throws Exception {
        // Given
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("DOWN");

        // When
        mockMvc.perform(get("/api/v1/health"))
                // Then
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("error"))
                .andExpect(jsonPath("$.data.database").value("DOWN"))
                .andExpect(jsonPath("$.data.activeTimers").value(0));
    }
}
