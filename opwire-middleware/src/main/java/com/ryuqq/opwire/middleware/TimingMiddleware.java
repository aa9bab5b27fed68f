package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.error.ErrorCategory;
import com.ryuqq.opwire.core.middleware.Middleware;
import com.ryuqq.opwire.core.middleware.MiddlewareKind;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.spi.TimeSource;
import com.ryuqq.opwire.core.spi.TimingRecorder;

/**
 * 타이밍 미들웨어.
 *
 * <p>호출마다 소요 시간(나노초)을 측정하여 {@link TimingRecorder}에 전달합니다.
 * 예외가 발생한 경우 {@link ErrorCategory#DEPENDENCY}로 기록한 뒤 예외를 그대로 전파합니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class TimingMiddleware<Q, R> implements Middleware<Q, R> {

    private final String operationName;
    private final TimingRecorder recorder;
    private final TimeSource timeSource;

    private TimingMiddleware(String operationName, TimingRecorder recorder, TimeSource timeSource) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (recorder == null) {
            throw new IllegalArgumentException("recorder cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.operationName = operationName;
        this.recorder = recorder;
        this.timeSource = timeSource;
    }

    public static <Q, R> TimingMiddleware<Q, R> create(String operationName, TimingRecorder recorder, TimeSource timeSource) {
        return new TimingMiddleware<>(operationName, recorder, timeSource);
    }

    @Override
    public Operation<Q, R> wrap(Operation<Q, R> inner) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        return (ctx, request) -> {
            long start = timeSource.nanoTime();
            Outcome<R> outcome;
            try {
                outcome = inner.invoke(ctx, request);
            } catch (Throwable fault) {
                recorder.record(operationName, ErrorCategory.DEPENDENCY, timeSource.nanoTime() - start);
                throw fault;
            }
            ErrorCategory category = outcome.isOk() ? null : outcome.getErrorOrNull().category();
            recorder.record(operationName, category, timeSource.nanoTime() - start);
            return outcome;
        };
    }

    @Override
    public MiddlewareKind kind() {
        return MiddlewareKind.TIMING;
    }
}
