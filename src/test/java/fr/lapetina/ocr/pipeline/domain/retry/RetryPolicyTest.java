package fr.lapetina.ocr.pipeline.domain.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    @DisplayName("should never shorten the delay between successive retries")
    void shouldProduceNonDecreasingDelays() {
        // Worst case: maximum jitter followed by minimum jitter
        double[] draws = {0.999, 0.0};
        int[] call = {0};
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofSeconds(30), 2.0, 1.0,
                () -> draws[call[0]++ % 2]);

        Duration previous = Duration.ZERO;
        for (int retry = 0; retry < 12; retry++) {
            Duration delay = policy.delayBefore(retry);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            previous = delay;
        }
    }

    @Test
    @DisplayName("should stay at the cap once reached")
    void shouldStayAtCap() {
        RetryPolicy policy = new RetryPolicy(20, Duration.ofMillis(250), Duration.ofSeconds(2), 2.0, 0.5, () -> 0.7);

        assertThat(policy.delayBefore(3)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayBefore(4)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayBefore(15)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("should start from the initial delay without jitter")
    void shouldStartFromInitialDelay() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, 0.5, () -> 0.0);

        assertThat(policy.delayBefore(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayBefore(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayBefore(2)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    @DisplayName("should allow retries until max attempts are made")
    void shouldBoundAttempts() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(100), 2.0);

        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
        assertThat(RetryPolicy.none().canRetry(1)).isFalse();
    }

    @Test
    @DisplayName("should reject inconsistent settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(2), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
