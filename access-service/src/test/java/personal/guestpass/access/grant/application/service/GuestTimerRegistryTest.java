package personal.guestpass.access.grant.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.guestpass.access.grant.domain.model.GuestTimerHandle;
import personal.guestpass.access.grant.domain.model.GuestTimerHandle.TimerPhase;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GuestTimerRegistry 테스트")
class GuestTimerRegistryTest {

    private SimpleMeterRegistry meterRegistry;
    private GuestTimerRegistry registry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new GuestTimerRegistry(meterRegistry);
    }

    @Test
    @DisplayName("같은 ID로 두 번 등록하면 두 번째 등록은 무시된다")
    void registerIfAbsent_Idempotent() {
        // given
        AtomicInteger created = new AtomicInteger();

        // when
        boolean first = registry.registerIfAbsent("grant-1", () -> {
            created.incrementAndGet();
            return GuestTimerHandle.enforcing();
        });
        boolean second = registry.registerIfAbsent("grant-1", () -> {
            created.incrementAndGet();
            return GuestTimerHandle.enforcing();
        });

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(created.get()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(meterRegistry.get("guest.timers.active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("동시에 같은 ID를 등록해도 핸들은 하나만 만들어진다")
    void registerIfAbsent_Concurrent() throws InterruptedException {
        // given
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger registered = new AtomicInteger();

        // when
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    if (registry.registerIfAbsent("grant-1", () -> {
                        created.incrementAndGet();
                        return GuestTimerHandle.armed(null, null, TimerPhase.ACTIVE);
                    })) {
                        registered.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // then
        assertThat(created.get()).isEqualTo(1);
        assertThat(registered.get()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.contains("grant-1")).isTrue();
    }

    @Test
    @DisplayName("경고 발송 후 상태는 WARNED 로 바뀌고, 제거된 항목은 무시된다")
    void markWarned() {
        // given
        registry.registerIfAbsent("grant-1", () -> GuestTimerHandle.armed(null, null, TimerPhase.ACTIVE));

        // when
        registry.markWarned("grant-1");
        registry.markWarned("unknown");

        // then
        assertThat(registry.find("grant-1")).get()
                .extracting(GuestTimerHandle::phase)
                .isEqualTo(TimerPhase.WARNED);
        assertThat(registry.contains("unknown")).isFalse();
    }

    @Test
    @DisplayName("제거하면 핸들을 반환하고, 두 번째 제거는 empty 를 반환한다")
    void remove() {
        // given
        registry.registerIfAbsent("grant-1", GuestTimerHandle::enforcing);

        // when & then
        assertThat(registry.remove("grant-1")).isPresent();
        assertThat(registry.remove("grant-1")).isEmpty();
        assertThat(registry.size()).isZero();
    }
}
