package personal.guestpass.access;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Access Service Application
 * 게스트 권한 만료 경고 / 강제 퇴장 / 재시작 복구를 담당하는 서비스
 */
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.guestpass.access",
        "personal.guestpass.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class AccessServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(AccessServiceApplication.class, args);
    }
}
