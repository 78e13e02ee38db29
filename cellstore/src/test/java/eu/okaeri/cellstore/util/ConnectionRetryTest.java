package eu.okaeri.cellstore.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRetryTest {

    private static ConnectionRetry fast() {
        return ConnectionRetry.builder()
            .initialBackoff(Duration.ofMillis(5))
            .maxBackoff(Duration.ofMillis(20))
            .timeout(Duration.ofSeconds(5))
            .build();
    }

    @Test
    void connect_succeeds_on_first_attempt() {
        assertThat(fast().connect("test", () -> "success")).isEqualTo("success");
    }

    @Test
    void connect_retries_until_success() {
        AtomicInteger attempts = new AtomicInteger(0);

        String result = fast().connect("test", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new RuntimeException("fail");
            }
            return "success";
        });

        assertThat(result).isEqualTo("success");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void connect_throws_after_timeout() {
        AtomicInteger attempts = new AtomicInteger(0);
        ConnectionRetry retry = fast().toBuilder()
            .initialBackoff(Duration.ofMillis(50))
            .maxBackoff(Duration.ofMillis(100))
            .timeout(Duration.ofMillis(120))
            .build();

        assertThatThrownBy(() -> retry.connect("jdbc:h2:mem:cells", () -> {
            attempts.incrementAndGet();
            throw new RuntimeException("connection refused");
        }))
            .isInstanceOf(ConnectionRetry.ConnectionException.class)
            .hasMessageContaining("jdbc:h2:mem:cells")
            .hasMessageContaining("attempts")
            .hasCauseInstanceOf(RuntimeException.class);

        assertThat(attempts.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void connect_with_zero_timeout_keeps_retrying() {
        AtomicInteger attempts = new AtomicInteger(0);
        ConnectionRetry retry = fast().toBuilder().timeout(Duration.ZERO).build();

        String result = retry.connect("test", () -> {
            if (attempts.incrementAndGet() < 5) {
                throw new RuntimeException("fail", new RuntimeException("inner cause"));
            }
            return "success";
        });

        assertThat(result).isEqualTo("success");
        assertThat(attempts.get()).isEqualTo(5);
    }

    @Test
    void connect_rejects_multiplier_below_one() {
        ConnectionRetry retry = fast().toBuilder().multiplier(0.5).build();
        assertThatThrownBy(() -> retry.connect("test", () -> "success"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("1.0");
    }

    @Test
    void connect_handles_interrupted_exception_during_connection() {
        assertThatThrownBy(() -> fast().connect("test", () -> {
            throw new InterruptedException("interrupted");
        }))
            .isInstanceOf(ConnectionRetry.ConnectionException.class)
            .hasMessageContaining("interrupted")
            .hasCauseInstanceOf(InterruptedException.class);

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        Thread.interrupted(); // clear flag
    }
}
