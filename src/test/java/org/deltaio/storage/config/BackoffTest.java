package org.deltaio.storage.config;

import org.deltaio.storage.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class BackoffTest {

    @Test
    void testFirstDelayIsInitialBackoff() {
        Backoff backoff = new Backoff(new BackoffConfig(Duration.ofMillis(100), Duration.ofSeconds(15), 2.0), new Random(7));
        assertEquals(Duration.ofMillis(100), backoff.next());
    }

    @Test
    void testDelaysStayWithinBounds() {
        BackoffConfig config = new BackoffConfig(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0);
        Backoff backoff = new Backoff(config, new Random(42));
        Duration previous = backoff.next();
        for (int i = 0; i < 50; i++) {
            Duration next = backoff.next();
            assertThat(next).isBetween(Duration.ofMillis(100), Duration.ofSeconds(1));
            assertThat(next.toNanos()).isLessThanOrEqualTo((long) (previous.toNanos() * 2.0) + 1);
            previous = next;
        }
    }

    @Test
    void testTopOfRangeGrowsExponentiallyToCap() {
        // a source that always draws the top of the range
        Random top = new Random() {
            @Override
            public double nextDouble() {
                return 1.0;
            }
        };
        Backoff backoff = new Backoff(new BackoffConfig(Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0), top);

        assertEquals(Duration.ofSeconds(1), backoff.next());
        assertEquals(Duration.ofSeconds(2), backoff.next());
        assertEquals(Duration.ofSeconds(4), backoff.next());
        assertEquals(Duration.ofSeconds(5), backoff.next());
        assertEquals(Duration.ofSeconds(5), backoff.next());
    }

    @Test
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffConfig(Duration.ofMillis(-1), Duration.ofSeconds(1), 2.0));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffConfig(Duration.ofMillis(1), Duration.ofSeconds(1), 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryConfig(-1, Duration.ofSeconds(1), BackoffConfig.defaults()));
    }
}
