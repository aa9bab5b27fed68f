package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.error.OperationError;
import com.ryuqq.opwire.core.middleware.Middleware;
import com.ryuqq.opwire.core.middleware.MiddlewareKind;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.spi.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 로깅 미들웨어.
 *
 * <p>감싼 Operation이 호출될 때마다 정확히 하나의 로그 레코드를 남깁니다.</p>
 *
 * <ul>
 *   <li>Ok → INFO (소요 시간)</li>
 *   <li>Fail → WARN (오류 분류, 메시지, 소요 시간)</li>
 *   <li>예외(복구 불가능한 결함) → ERROR 후 예외를 그대로 다시 던짐</li>
 * </ul>
 *
 * <p>정규 순서상 가장 바깥에 두면 외부 호출당 한 번, RETRY 안쪽에 두면 시도마다 한 번 기록됩니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class LoggingMiddleware<Q, R> implements Middleware<Q, R> {

    private final String operationName;
    private final Logger logger;
    private final TimeSource timeSource;

    private LoggingMiddleware(String operationName, Logger logger, TimeSource timeSource) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName cannot be null or blank");
        }
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.operationName = operationName;
        this.logger = logger;
        this.timeSource = timeSource;
    }

    /**
     * 기본 로거로 로깅 미들웨어 생성.
     *
     * @param operationName 로그에 표시할 Operation 이름
     * @param timeSource 소요 시간 측정용 시간 제공자
     * @param <Q> 요청 타입
     * @param <R> 응답 타입
     * @return 로깅 미들웨어
     */
    public static <Q, R> LoggingMiddleware<Q, R> create(String operationName, TimeSource timeSource) {
        return new LoggingMiddleware<>(operationName, LoggerFactory.getLogger(LoggingMiddleware.class), timeSource);
    }

    /**
     * 지정한 로거로 로깅 미들웨어 생성.
     *
     * @param operationName 로그에 표시할 Operation 이름
     * @param logger SLF4J 로거
     * @param timeSource 소요 시간 측정용 시간 제공자
     * @param <Q> 요청 타입
     * @param <R> 응답 타입
     * @return 로깅 미들웨어
     */
    public static <Q, R> LoggingMiddleware<Q, R> create(String operationName, Logger logger, TimeSource timeSource) {
        return new LoggingMiddleware<>(operationName, logger, timeSource);
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
                logger.error("Operation {} threw an unrecoverable fault", operationName, fault);
                throw fault;
            }

            long elapsedMs = (timeSource.nanoTime() - start) / 1_000_000L;
            if (outcome.isOk()) {
                logger.info("Operation {} completed in {}ms", operationName, elapsedMs);
            } else {
                logger.warn("Operation {} failed: {}", operationName, describe(outcome.getErrorOrNull(), elapsedMs));
            }
            return outcome;
        };
    }

    @Override
    public MiddlewareKind kind() {
        return MiddlewareKind.LOGGING;
    }

    private static String describe(OperationError error, long elapsedMs) {
        return error.category() + " - " + error.message() + " (" + elapsedMs + "ms)";
    }
}
