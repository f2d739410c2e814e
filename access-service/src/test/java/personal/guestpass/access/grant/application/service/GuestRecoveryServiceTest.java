package personal.guestpass.access.grant.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import personal.guestpass.access.grant.application.port.out.GuestGrantRepository;
import personal.guestpass.access.grant.domain.model.GuestGrant;
import personal.guestpass.access.grant.domain.model.GuestTimerHandle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("GuestRecoveryService 단위 테스트")
class GuestRecoveryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private GuestGrantRepository grantRepository;
    @Mock
    private GuestExpiryScheduler expiryScheduler;

    private GuestTimerRegistry timerRegistry;
    private GuestRecoveryService recoveryService;

    @BeforeEach
    void setUp() {
        timerRegistry = new GuestTimerRegistry(new SimpleMeterRegistry());
        recoveryService = new GuestRecoveryService(
                grantRepository, expiryScheduler, timerRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private GuestGrant grant(String accountId, Duration expiresIn) {
        return GuestGrant.create("guild-1", accountId, null,
                NOW.minus(Duration.ofDays(7)), NOW.plus(expiresIn), NOW.plus(expiresIn).minus(Duration.ofHours(24)));
    }

    @Test
    @DisplayName("저장된 권한이 없으면 아무것도 예약하지 않는다")
    void recoverAll_Empty() {
        // given
        given(grantRepository.findAll()).willReturn(List.of());

        // when
        int rescheduled = recoveryService.recoverAll();

        // then
        assertThat(rescheduled).isZero();
        verifyNoInteractions(expiryScheduler);
    }

    @Test
    @DisplayName("재시작 시 저장된 모든 권한을 다시 예약한다")
    void recoverAll_ReschedulesEveryGrant() {
        // given: 만료된 권한, 경고 구간 안의 권한, 경고 전 권한
        GuestGrant expired = grant("account-1", Duration.ofHours(-1));
        GuestGrant inWarningWindow = grant("account-2", Duration.ofHours(12));
        GuestGrant fresh = grant("account-3", Duration.ofDays(3));
        given(grantRepository.findAll()).willReturn(List.of(expired, inWarningWindow, fresh));

        // when
        int rescheduled = recoveryService.recoverAll();

        // then
        assertThat(rescheduled).isEqualTo(3);
        verify(expiryScheduler).schedule(expired);
        verify(expiryScheduler).schedule(inWarningWindow);
        verify(expiryScheduler).schedule(fresh);
    }

    @Test
    @DisplayName("한 권한의 예약이 실패해도 나머지 권한은 계속 예약한다")
    void recoverAll_IsolatesFailures() {
        // given
        GuestGrant broken = grant("account-1", Duration.ofHours(2));
        GuestGrant healthy = grant("account-2", Duration.ofHours(2));
        given(grantRepository.findAll()).willReturn(List.of(broken, healthy));
        willThrow(new IllegalStateException("scheduler rejected")).given(expiryScheduler).schedule(broken);

        // when
        int rescheduled = recoveryService.recoverAll();

        // then
        assertThat(rescheduled).isEqualTo(1);
        verify(expiryScheduler).schedule(healthy);
    }

    @Test
    @DisplayName("저장소 조회에 실패하면 0 을 반환하고 예외를 전파하지 않는다")
    void recoverAll_RepositoryFailure() {
        // given
        given(grantRepository.findAll()).willThrow(new IllegalStateException("db down"));

        // when
        int rescheduled = recoveryService.recoverAll();

        // then
        assertThat(rescheduled).isZero();
        verifyNoInteractions(expiryScheduler);
    }

    @Test
    @DisplayName("sweep 은 타이머가 없는 만료 권한만 다시 처리한다")
    void sweepOverdue_SkipsGrantsInProgress() {
        // given
        GuestGrant orphaned = grant("account-1", Duration.ofMinutes(-5));
        GuestGrant inProgress = grant("account-2", Duration.ofMinutes(-1));
        timerRegistry.registerIfAbsent(inProgress.id(), GuestTimerHandle::enforcing);
        given(grantRepository.findEnforcementDue(NOW)).willReturn(List.of(orphaned, inProgress));

        // when
        int swept = recoveryService.sweepOverdue();

        // then
        assertThat(swept).isEqualTo(1);
        verify(expiryScheduler).scheduleOnWorker(orphaned);
        verify(expiryScheduler, never()).scheduleOnWorker(inProgress);
        verify(expiryScheduler, never()).schedule(orphaned);
    }

    @Test
    @DisplayName("worker 가 작업을 거부해도 나머지 만료 권한은 계속 넘긴다")
    void sweepOverdue_IsolatesRejectedDispatch() {
        // given
        GuestGrant rejected = grant("account-1", Duration.ofMinutes(-5));
        GuestGrant accepted = grant("account-2", Duration.ofMinutes(-5));
        given(grantRepository.findEnforcementDue(NOW)).willReturn(List.of(rejected, accepted));
        willThrow(new TaskRejectedException("worker queue full")).given(expiryScheduler).scheduleOnWorker(rejected);

        // when
        int swept = recoveryService.sweepOverdue();

        // then
        assertThat(swept).isEqualTo(1);
        verify(expiryScheduler).scheduleOnWorker(accepted);
    }
}
