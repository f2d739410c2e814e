package personal.guestpass.access.grant.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.guestpass.access.grant.domain.service.GuestNoticeFactory;

/**
 * Guest Access 도메인 빈 설정
 */
@Configuration
public class GuestAccessConfig {

    @Bean
    public GuestNoticeFactory guestNoticeFactory(GuestAccessProperties properties) {
        return new GuestNoticeFactory(
                properties.notice().organizationName(),
                properties.notice().recruitmentUrl());
    }
}
