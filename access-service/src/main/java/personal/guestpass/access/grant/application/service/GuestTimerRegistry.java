package personal.guestpass.access.grant.application.service;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;
import personal.guestpass.access.grant.domain.model.GuestTimerHandle;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Guest Timer Registry
 * 권한 ID -> 예약된 타이머 핸들 (프로세스 로컬, 비영속)
 *
 * 모든 접근은 단일 lock 으로 직렬화됨.
 * lock 안에서는 핸들 조회/등록/제거만 수행하고 네트워크 I/O 는 하지 않음.
 */
@Component
public class GuestTimerRegistry {

    private final Map<String, GuestTimerHandle> handles = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public GuestTimerRegistry(MeterRegistry meterRegistry) {
        Gauge.builder("guest.timers.active", this, GuestTimerRegistry::size)
                .description("Number of guest grants with armed timers")
                .register(meterRegistry);
    }

    /**
     * 핸들이 없을 때만 handleFactory 로 핸들을 만들어 등록 (check-and-put 원자적 수행)
     * handleFactory 는 lock 을 잡은 상태로 호출되므로 타이머 예약 같은 non-blocking 작업만 해야 함
     *
     * @return true: 새로 등록됨, false: 이미 존재하여 아무것도 하지 않음
     */
    public boolean registerIfAbsent(String grantId, Supplier<GuestTimerHandle> handleFactory) {
        lock.lock();
        try {
            if (handles.containsKey(grantId)) {
                return false;
            }
            handles.put(grantId, handleFactory.get());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String grantId) {
        lock.lock();
        try {
            return handles.containsKey(grantId);
        } finally {
            lock.unlock();
        }
    }

    public Optional<GuestTimerHandle> find(String grantId) {
        lock.lock();
        try {
            return Optional.ofNullable(handles.get(grantId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * ACTIVE -> WARNED (핸들이 이미 제거된 경우 무시)
     */
    public void markWarned(String grantId) {
        lock.lock();
        try {
            handles.computeIfPresent(grantId, (id, handle) -> handle.warned());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 핸들 제거 (타이머 취소는 호출자가 결정)
     */
    public Optional<GuestTimerHandle> remove(String grantId) {
        lock.lock();
        try {
            return Optional.ofNullable(handles.remove(grantId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return handles.size();
        } finally {
            lock.unlock();
        }
    }
}
