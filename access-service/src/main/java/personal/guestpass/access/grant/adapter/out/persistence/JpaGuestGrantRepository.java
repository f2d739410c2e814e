package personal.guestpass.access.grant.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.guestpass.access.grant.domain.model.GrantStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for GuestGrant
 */
public interface JpaGuestGrantRepository extends JpaRepository<GuestGrantEntity, String> {

    List<GuestGrantEntity> findByStatusOrderByExpiresAtAsc(GrantStatus status);

    Optional<GuestGrantEntity> findByGuildIdAndAccountId(String guildId, String accountId);

    /**
     * 강제 퇴장 시각이 지난 권한 조회 (MANUAL_REVIEW 제외)
     * RETRY_PENDING 은 nextAttemptAt 기준, nextAttemptAt 이 없으면 expiresAt 기준
     */
    @Query("SELECT g FROM GuestGrantEntity g " +
            "WHERE (g.status IN :pending AND g.expiresAt <= :now) " +
            "OR (g.status = :retry AND g.nextAttemptAt <= :now) " +
            "OR (g.status = :retry AND g.nextAttemptAt IS NULL AND g.expiresAt <= :now) " +
            "ORDER BY g.expiresAt ASC")
    List<GuestGrantEntity> findEnforcementDue(@Param("now") Instant now,
                                              @Param("pending") List<GrantStatus> pending,
                                              @Param("retry") GrantStatus retry);

    /**
     * 삭제된 행 수 반환 (0 = 이미 없음)
     */
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM GuestGrantEntity g WHERE g.id = :id")
    int deleteGrant(@Param("id") String id);

    /**
     * ACTIVE 인 경우에만 WARNED 로 변경
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE GuestGrantEntity g SET g.status = :warned " +
            "WHERE g.id = :id AND g.status = :active")
    int updateWarned(@Param("id") String id,
                     @Param("active") GrantStatus active,
                     @Param("warned") GrantStatus warned);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE GuestGrantEntity g " +
            "SET g.status = :status, g.removalAttempts = :attempts, g.nextAttemptAt = :nextAttemptAt " +
            "WHERE g.id = :id")
    int updateRemovalState(@Param("id") String id,
                           @Param("status") GrantStatus status,
                           @Param("attempts") int attempts,
                           @Param("nextAttemptAt") Instant nextAttemptAt);
}
