package com.ryuqq.opwire.testkit.recording;

import com.ryuqq.opwire.core.error.ErrorCategory;
import com.ryuqq.opwire.core.spi.TimingRecorder;

import java.util.ArrayList;
import java.util.List;

/**
 * Timing recorder that keeps every measurement in memory.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class RecordingTimingRecorder implements TimingRecorder {

    /**
     * One recorded measurement.
     *
     * @param operationName operation name
     * @param failureCategory failure category, {@code null} on success
     * @param elapsedNanos elapsed nanoseconds
     */
    public record Measurement(String operationName, ErrorCategory failureCategory, long elapsedNanos) {

        public boolean isSuccess() {
            return failureCategory == null;
        }
    }

    private final List<Measurement> measurements = new ArrayList<>();

    @Override
    public synchronized void record(String operationName, ErrorCategory failureCategory, long elapsedNanos) {
        measurements.add(new Measurement(operationName, failureCategory, elapsedNanos));
    }

    public synchronized List<Measurement> getMeasurements() {
        return List.copyOf(measurements);
    }

    public synchronized void clear() {
        measurements.clear();
    }
}
