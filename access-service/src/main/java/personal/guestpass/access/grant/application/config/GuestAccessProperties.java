package personal.guestpass.access.grant.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import personal.guestpass.access.grant.domain.model.GuestRole;

import java.time.Duration;

/**
 * Guest Access 설정 Properties
 * application.yml의 guest.access.* 설정을 바인딩
 *
 * accessDuration / warningLead 는 권한 생성 시점에 레코드의 expiresAt / warningAt 으로 고정됨.
 * 스케줄러는 레코드에 저장된 시각만 사용함.
 */
@ConfigurationProperties(prefix = "guest.access")
public record GuestAccessProperties(
        @DefaultValue("7d") Duration accessDuration,
        @DefaultValue("24h") Duration warningLead,
        @DefaultValue("Marketplace guest access expired") String removalReason,
        @DefaultValue Removal removal,
        @DefaultValue Notice notice,
        @DefaultValue Role guestRole
) {
    public record Removal(
            @DefaultValue("5") int maxAttempts,
            @DefaultValue("1m") Duration initialBackoff,
            @DefaultValue("1h") Duration maxBackoff
    ) {}

    public record Notice(
            @DefaultValue("House Wolf") String organizationName,
            String recruitmentUrl
    ) {}

    /**
     * 경고/퇴장 대상 판별용 게스트 역할 (id 우선, 없으면 name)
     */
    public record Role(
            String id,
            @DefaultValue("Marketplace Guest") String name
    ) {
        public GuestRole toDomain() {
            return new GuestRole(id, name);
        }
    }
}
