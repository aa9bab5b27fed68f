package com.ryuqq.opwire.core.spi;

import java.time.Duration;

/**
 * Blocking wait SPI used between retry attempts.
 *
 * <p>Injected so tests can record delays instead of actually sleeping.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration the wait duration
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Returns a sleeper backed by {@link Thread#sleep(long)}.
     *
     * @return the thread sleeper
     */
    static Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
