package com.ryuqq.opwire.core.spi.noop;

import com.ryuqq.opwire.core.error.ErrorCategory;
import com.ryuqq.opwire.core.spi.TimingRecorder;

/**
 * Timing Recorder NoOp 구현.
 *
 * <p>측정값을 버립니다. 개발 및 테스트 환경에서 사용합니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class NoOpTimingRecorder implements TimingRecorder {

    @Override
    public void record(String operationName, ErrorCategory failureCategory, long elapsedNanos) {
        // NoOp
    }
}
