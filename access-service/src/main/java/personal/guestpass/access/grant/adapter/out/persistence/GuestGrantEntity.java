package personal.guestpass.access.grant.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.guestpass.access.grant.domain.model.GrantStatus;
import personal.guestpass.access.grant.domain.model.GuestGrant;

import java.time.Instant;

/**
 * Guest Grant Entity
 * 게스트 권한 영속 레코드 (타이머 복구의 기준 데이터)
 */
@Entity
@Table(name = "marketplace_guests",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_guild_account", columnNames = {"guild_id", "account_id"})
        },
        indexes = {
                @Index(name = "idx_status_expires", columnList = "status, expires_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class GuestGrantEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "guild_id", nullable = false, length = 32)
    private String guildId;

    @Column(name = "account_id", nullable = false, length = 32)
    private String accountId;

    @Column(name = "account_tag", length = 100)
    private String accountTag;

    @Column(name = "granted_at", nullable = false, updatable = false)
    private Instant grantedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "warning_at", nullable = false)
    private Instant warningAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GrantStatus status;

    @Column(name = "removal_attempts", nullable = false)
    private int removalAttempts = 0;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    /**
     * Domain 모델로부터 Entity 생성
     */
    public static GuestGrantEntity fromDomain(GuestGrant grant) {
        GuestGrantEntity entity = new GuestGrantEntity();
        entity.id = grant.id();
        entity.guildId = grant.guildId();
        entity.accountId = grant.accountId();
        entity.accountTag = grant.accountTag();
        entity.grantedAt = grant.grantedAt();
        entity.expiresAt = grant.expiresAt();
        entity.warningAt = grant.warningAt();
        entity.status = grant.status();
        entity.removalAttempts = grant.removalAttempts();
        entity.nextAttemptAt = grant.nextAttemptAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (grantedAt == null) {
            grantedAt = Instant.now();
        }
        if (status == null) {
            status = GrantStatus.ACTIVE;
        }
    }

    /**
     * Domain 모델로 변환
     */
    public GuestGrant toDomain() {
        return new GuestGrant(
                id,
                guildId,
                accountId,
                accountTag,
                grantedAt,
                expiresAt,
                warningAt,
                status,
                removalAttempts,
                nextAttemptAt
        );
    }
}
