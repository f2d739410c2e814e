package personal.guestpass.access.grant.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.guestpass.access.grant.application.port.out.GuestGrantRepository;
import personal.guestpass.access.grant.domain.model.GrantStatus;
import personal.guestpass.access.grant.domain.model.GuestGrant;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Guest Grant Persistence Adapter
 * GuestGrantRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class GuestGrantPersistenceAdapter implements GuestGrantRepository {

    private static final List<GrantStatus> PENDING_STATUSES = List.of(GrantStatus.ACTIVE, GrantStatus.WARNED);

    private final JpaGuestGrantRepository jpaGuestGrantRepository;

    @Override
    @Transactional
    public GuestGrant save(GuestGrant grant) {
        GuestGrantEntity saved = jpaGuestGrantRepository.save(GuestGrantEntity.fromDomain(grant));
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public List<GuestGrant> findAll() {
        return jpaGuestGrantRepository.findAll().stream()
                .map(GuestGrantEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<GuestGrant> findAllByStatus(GrantStatus status) {
        return jpaGuestGrantRepository.findByStatusOrderByExpiresAtAsc(status).stream()
                .map(GuestGrantEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GuestGrant> findById(String grantId) {
        return jpaGuestGrantRepository.findById(grantId)
                .map(GuestGrantEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GuestGrant> findByGuildIdAndAccountId(String guildId, String accountId) {
        return jpaGuestGrantRepository.findByGuildIdAndAccountId(guildId, accountId)
                .map(GuestGrantEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<GuestGrant> findEnforcementDue(Instant now) {
        return jpaGuestGrantRepository.findEnforcementDue(now, PENDING_STATUSES, GrantStatus.RETRY_PENDING)
                .stream()
                .map(GuestGrantEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public boolean deleteById(String grantId) {
        return jpaGuestGrantRepository.deleteGrant(grantId) > 0;
    }

    @Override
    @Transactional
    public boolean markWarned(String grantId) {
        return jpaGuestGrantRepository.updateWarned(grantId, GrantStatus.ACTIVE, GrantStatus.WARNED) > 0;
    }

    @Override
    @Transactional
    public boolean markForRetry(String grantId, int removalAttempts, Instant nextAttemptAt) {
        return jpaGuestGrantRepository.updateRemovalState(
                grantId, GrantStatus.RETRY_PENDING, removalAttempts, nextAttemptAt) > 0;
    }

    @Override
    @Transactional
    public boolean markForManualReview(String grantId, int removalAttempts) {
        return jpaGuestGrantRepository.updateRemovalState(
                grantId, GrantStatus.MANUAL_REVIEW, removalAttempts, null) > 0;
    }
}
