package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.error.CancellationError;
import com.ryuqq.opwire.core.error.OperationError;
import com.ryuqq.opwire.core.middleware.Middleware;
import com.ryuqq.opwire.core.middleware.MiddlewareKind;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 재시도 미들웨어.
 *
 * <p>내부 Operation이 재시도 가능한 오류로 실패하면 {@link RetryPolicy}에 따라 다시 호출하고,
 * 한도에 도달하면 마지막 실패를 그대로 반환합니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>재시도 여부는 {@link RetryClassifier}가 결정 (기본: 일시적 의존성 오류만)</li>
 *   <li>각 시도 전에 취소 여부를 확인하고, 취소되었으면 {@link CancellationError} 반환</li>
 *   <li>예외(복구 불가능한 결함)는 재시도하지 않고 전파</li>
 *   <li>대기 중 인터럽트되면 인터럽트 플래그를 복구하고 {@link CancellationError} 반환</li>
 * </ul>
 *
 * <p>TRANSACTION 바깥에 두면 시도마다 새 트랜잭션이 시작됩니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class RetryMiddleware<Q, R> implements Middleware<Q, R> {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);

    private final RetryPolicy policy;
    private final RetryClassifier classifier;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    private RetryMiddleware(RetryPolicy policy, RetryClassifier classifier, BackoffCalculator backoff, Sleeper sleeper) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.policy = policy;
        this.classifier = classifier;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /**
     * 기본 분류기와 정책의 백오프 설정으로 생성.
     *
     * @param policy 재시도 정책
     * @param sleeper 재시도 간 대기 수단
     * @param <Q> 요청 타입
     * @param <R> 응답 타입
     * @return 재시도 미들웨어
     */
    public static <Q, R> RetryMiddleware<Q, R> create(RetryPolicy policy, Sleeper sleeper) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return new RetryMiddleware<>(policy, RetryClassifier.transientDependencyErrors(), policy.toBackoff(), sleeper);
    }

    public static <Q, R> RetryMiddleware<Q, R> create(
            RetryPolicy policy,
            RetryClassifier classifier,
            BackoffCalculator backoff,
            Sleeper sleeper) {
        return new RetryMiddleware<>(policy, classifier, backoff, sleeper);
    }

    @Override
    public Operation<Q, R> wrap(Operation<Q, R> inner) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        return (ctx, request) -> {
            int attempt = 1;
            while (true) {
                Optional<CancellationError> cancelled = ctx.cancellation();
                if (cancelled.isPresent()) {
                    return Outcome.fail(cancelled.get());
                }

                Outcome<R> outcome = inner.invoke(ctx, request);
                if (outcome.isOk()) {
                    return outcome;
                }

                OperationError error = outcome.getErrorOrNull();
                if (!classifier.isRetryable(error)) {
                    return outcome;
                }
                if (attempt >= policy.maxAttempts()) {
                    log.warn("Giving up after {} attempts: {}", attempt, error.message());
                    return outcome;
                }

                long delayMs = backoff.calculate(attempt);
                log.debug("Attempt {} failed ({}), retrying in {}ms", attempt, error.message(), delayMs);
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Outcome.fail(CancellationError.of("retry interrupted after attempt " + attempt));
                }
                attempt++;
            }
        };
    }

    @Override
    public MiddlewareKind kind() {
        return MiddlewareKind.RETRY;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
