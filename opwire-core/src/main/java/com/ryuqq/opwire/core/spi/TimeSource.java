package com.ryuqq.opwire.core.spi;

import java.time.Instant;

/**
 * Time provider SPI.
 *
 * <p>Operations and middleware never read the system clock directly; they obtain time
 * from an injected TimeSource so that behaviour is deterministic under test.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: shared singleton across all operations</li>
 *   <li>{@link #nanoTime()} must be monotonic (used only for elapsed-time measurement)</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public interface TimeSource {

    /**
     * Returns the current wall-clock instant.
     *
     * @return current instant
     */
    Instant now();

    /**
     * Returns a monotonic nanosecond reading for elapsed-time measurement.
     *
     * @return monotonic nanos
     */
    long nanoTime();

    /**
     * Returns the system-backed time source.
     *
     * @return TimeSource backed by {@link Instant#now()} and {@link System#nanoTime()}
     */
    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }
}
