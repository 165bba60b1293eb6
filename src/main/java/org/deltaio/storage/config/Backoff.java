package org.deltaio.storage.config;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff schedule.
 * <p>
 * Each delay is drawn uniformly from {@code [init, previous * base)} and capped at the
 * configured maximum, so consecutive delays grow on average while staying spread out.
 * The first call to {@link #next()} returns the initial backoff.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Use one instance per retried request.
 */
public class Backoff {

    private final double initSeconds;
    private final double maxSeconds;
    private final double base;
    private final Random random;
    private double nextSeconds;

    public Backoff(BackoffConfig config) {
        this(config, null);
    }

    /**
     * @param config the schedule parameters
     * @param random the jitter source, or {@code null} for {@link ThreadLocalRandom}
     */
    public Backoff(BackoffConfig config, Random random) {
        this.initSeconds = toSeconds(config.initBackoff());
        this.maxSeconds = toSeconds(config.maxBackoff());
        this.base = config.base();
        this.random = random;
        this.nextSeconds = initSeconds;
    }

    /**
     * Returns the delay before the next attempt and advances the schedule.
     *
     * @return the delay
     */
    public Duration next() {
        double upper = nextSeconds * base;
        double drawn = upper > initSeconds ? uniform(initSeconds, upper) : initSeconds;
        double current = nextSeconds;
        nextSeconds = Math.min(maxSeconds, drawn);
        return Duration.ofNanos((long) (current * 1_000_000_000L));
    }

    private double uniform(double from, double to) {
        Random source = random != null ? random : ThreadLocalRandom.current();
        return from + source.nextDouble() * (to - from);
    }

    private static double toSeconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }
}
