package org.terragraph.wrapper.tool;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with full jitter. Each call to {@link #next()} waits a random delay between zero and
 * {@code min(maxDelay, baseDelay * 2^attempt)} and returns the total time waited so far.
 * Not thread-safe; use one instance per retry loop.
 */
public class JitteredBackoff {

    /**
     * Blocks the current thread.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;
    private int attempt;
    private Duration waited = Duration.ZERO;

    public JitteredBackoff(Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.sleeper = sleeper;
    }

    /**
     * Sleeps for the next delay.
     *
     * @return total time waited by this instance.
     * @throws InterruptedException if interrupted while sleeping.
     */
    public Duration next() throws InterruptedException {
        long ceiling = Math.min(maxDelay.toMillis(), baseDelay.toMillis() << Math.min(attempt, 20));
        long delay = ceiling <= 0 ? 0 : ThreadLocalRandom.current().nextLong(ceiling + 1);
        attempt++;
        sleeper.sleep(Duration.ofMillis(delay));
        waited = waited.plusMillis(delay);
        return waited;
    }
}
