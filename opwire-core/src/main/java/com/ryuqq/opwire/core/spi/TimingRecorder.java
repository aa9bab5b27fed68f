package com.ryuqq.opwire.core.spi;

import com.ryuqq.opwire.core.error.ErrorCategory;

/**
 * Timing Recorder SPI.
 *
 * <p>Receives one measurement per invocation of an operation wrapped by the timing middleware.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe</li>
 *   <li>Non-blocking: called on the request path</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public interface TimingRecorder {

    /**
     * Records one measurement.
     *
     * @param operationName logical operation name
     * @param failureCategory category of the failure, or {@code null} for success
     *                        ({@link ErrorCategory#DEPENDENCY} is also used for thrown faults)
     * @param elapsedNanos elapsed time in nanoseconds
     */
    void record(String operationName, ErrorCategory failureCategory, long elapsedNanos);
}
