package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.context.CancellationSignal;
import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.error.CancellationError;
import com.ryuqq.opwire.core.middleware.Middleware;
import com.ryuqq.opwire.core.middleware.MiddlewareKind;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.spi.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 데드라인(타임아웃) 미들웨어.
 *
 * <p>호출 시점 + timeout을 데드라인으로 하는 파생 취소 신호를 만들어 내부 Operation에 전달합니다.
 * 부모 컨텍스트의 데드라인이 더 이르면 부모의 데드라인이 유지됩니다.</p>
 *
 * <p><strong>협력적 취소:</strong> 스레드를 인터럽트하거나 강제로 중단하지 않습니다.
 * 내부 Operation과 그 의존성 호출({@link com.ryuqq.opwire.core.operation.Steps})이 신호를 확인하고
 * {@link CancellationError}로 반환합니다. 신호를 무시한 Operation은 끝까지 실행될 수 있으며,
 * 그 결과는 그대로 반환됩니다.</p>
 *
 * <p>이미 취소된 컨텍스트로 호출되면 내부 Operation을 호출하지 않습니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class DeadlineMiddleware<Q, R> implements Middleware<Q, R> {

    private static final Logger log = LoggerFactory.getLogger(DeadlineMiddleware.class);

    private final Duration timeout;
    private final TimeSource timeSource;

    private DeadlineMiddleware(Duration timeout, TimeSource timeSource) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.timeout = timeout;
        this.timeSource = timeSource;
    }

    public static <Q, R> DeadlineMiddleware<Q, R> create(Duration timeout, TimeSource timeSource) {
        return new DeadlineMiddleware<>(timeout, timeSource);
    }

    @Override
    public Operation<Q, R> wrap(Operation<Q, R> inner) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        return (ctx, request) -> {
            Optional<CancellationError> cancelled = ctx.cancellation();
            if (cancelled.isPresent()) {
                return Outcome.fail(cancelled.get());
            }

            Instant deadline = timeSource.now().plus(timeout);
            CancellationSignal signal = CancellationSignal.withDeadline(ctx.signal(), deadline, timeSource);
            ExecutionContext bounded = ctx.withSignal(signal);

            Outcome<R> outcome = inner.invoke(bounded, request);
            if (outcome.isOk() && signal.isCancelled()) {
                log.debug("Operation completed after its deadline {}", signal.deadline().orElse(deadline));
            }
            return outcome;
        };
    }

    @Override
    public MiddlewareKind kind() {
        return MiddlewareKind.DEADLINE;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
