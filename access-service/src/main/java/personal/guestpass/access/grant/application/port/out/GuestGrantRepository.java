package personal.guestpass.access.grant.application.port.out;

import personal.guestpass.access.grant.domain.model.GrantStatus;
import personal.guestpass.access.grant.domain.model.GuestGrant;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Guest Grant Repository (Output Port)
 * 게스트 권한 영속 저장소 인터페이스
 */
public interface GuestGrantRepository {

    GuestGrant save(GuestGrant grant);

    /**
     * 전체 권한 조회 (재시작 시 타이머 복구용)
     */
    List<GuestGrant> findAll();

    List<GuestGrant> findAllByStatus(GrantStatus status);

    Optional<GuestGrant> findById(String grantId);

    Optional<GuestGrant> findByGuildIdAndAccountId(String guildId, String accountId);

    /**
     * 강제 퇴장 시각이 지난 권한 조회
     * - ACTIVE / WARNED: expiresAt <= now
     * - RETRY_PENDING: nextAttemptAt <= now
     */
    List<GuestGrant> findEnforcementDue(Instant now);

    /**
     * 권한 삭제
     *
     * @return true: 삭제됨, false: 이미 없음 (정상 케이스)
     */
    boolean deleteById(String grantId);

    /**
     * 아래 상태 갱신은 조건부 UPDATE 로 수행되어, 이미 삭제된 레코드를 되살리지 않음
     *
     * @return 갱신된 레코드가 있으면 true
     */
    boolean markWarned(String grantId);

    boolean markForRetry(String grantId, int removalAttempts, Instant nextAttemptAt);

    boolean markForManualReview(String grantId, int removalAttempts);
}
