package personal.guestpass.access.grant.application.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * 스케줄링 설정
 *
 * - guestTimerScheduler: 경고/만료 타이머 예약 전용 (콜백은 작업을 worker 로 넘기기만 함)
 * - guestTaskExecutor: 경고 발송, 강제 퇴장 등 네트워크 작업 실행
 * - @Scheduled 주기 작업(sweep)도 guestTimerScheduler 에서 실행되며, 만료 처리는 guestTaskExecutor 로 넘김
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler guestTimerScheduler(
            Clock clock,
            @Value("${guest.scheduler.pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("guest-timer-");
        scheduler.setClock(clock);
        // 취소된 타이머가 큐에 남아있지 않도록 제거
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor guestTaskExecutor(
            @Value("${guest.scheduler.worker-pool-size:4}") int workerPoolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerPoolSize);
        executor.setMaxPoolSize(workerPoolSize);
        executor.setThreadNamePrefix("guest-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
