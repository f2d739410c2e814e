package personal.guestpass.access.grant.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RemovalRetryPolicy 테스트")
class RemovalRetryPolicyTest {

    private final RemovalRetryPolicy policy =
            new RemovalRetryPolicy(5, Duration.ofMinutes(1), Duration.ofHours(1));

    @Test
    @DisplayName("대기 시간은 시도마다 두 배로 늘어난다")
    void backoffDoubles() {
        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMinutes(1));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMinutes(2));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMinutes(4));
        assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofMinutes(8));
    }

    @Test
    @DisplayName("대기 시간은 상한을 넘지 않는다")
    void backoffIsCapped() {
        assertThat(policy.backoffAfter(7)).isEqualTo(Duration.ofHours(1));
        assertThat(policy.backoffAfter(60)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("최대 시도 횟수에 도달하면 소진된 것으로 판단한다")
    void isExhausted() {
        assertThat(policy.isExhausted(4)).isFalse();
        assertThat(policy.isExhausted(5)).isTrue();
    }

    @Test
    @DisplayName("상한이 초기 대기 시간보다 짧으면 생성에 실패한다")
    void invalidPolicy() {
        assertThatThrownBy(() -> new RemovalRetryPolicy(3, Duration.ofMinutes(10), Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
