package qrelay.core.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for {@link BackoffPolicy} implementations.
 */
public class BackoffPolicyTest {

    @Test
    public void testNone() {
        BackoffPolicy policy = BackoffPolicy.none();
        assertEquals(0L, policy.delayMillis(1));
        assertEquals(0L, policy.delayMillis(10));
    }

    @Test
    public void testLinear() {
        BackoffPolicy policy = BackoffPolicy.linear(Duration.ofSeconds(5));
        assertEquals(5_000L, policy.delayMillis(1));
        assertEquals(10_000L, policy.delayMillis(2));
        assertEquals(15_000L, policy.delayMillis(3));
    }

    @Test
    public void testExponentialIsCapped() {
        BackoffPolicy policy = BackoffPolicy.exponential(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5));
        assertEquals(1_000L, policy.delayMillis(1));
        assertEquals(2_000L, policy.delayMillis(2));
        assertEquals(4_000L, policy.delayMillis(3));
        assertEquals(5_000L, policy.delayMillis(4));
        assertEquals(5_000L, policy.delayMillis(40));
    }

    @Test
    public void testMonotone() {
        BackoffPolicy[] policies = {
                BackoffPolicy.none(),
                BackoffPolicy.linear(Duration.ofMillis(250)),
                BackoffPolicy.exponential(Duration.ofMillis(100), 3.0, Duration.ofMinutes(1))
        };
        for (BackoffPolicy policy : policies) {
            long previous = -1;
            for (int count = 1; count <= 30; count++) {
                long delay = policy.delayMillis(count);
                assertTrue(delay >= previous, policy + " decreased at " + count);
                previous = delay;
            }
        }
    }

    @Test
    public void testNamed() {
        Duration step = Duration.ofSeconds(2);
        Duration max = Duration.ofSeconds(30);
        assertEquals(0L, BackoffPolicy.named("none", step, max).delayMillis(3));
        assertEquals(6_000L, BackoffPolicy.named("Linear", step, max).delayMillis(3));
        assertEquals(8_000L, BackoffPolicy.named("exponential", step, max).delayMillis(3));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.named("fibonacci", step, max));
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new LinearBackoff(-1));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(100, 0.5, 1000));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(100, 2.0, 50));
    }
}
