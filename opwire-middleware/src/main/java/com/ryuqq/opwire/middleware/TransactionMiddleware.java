package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.error.DependencyError;
import com.ryuqq.opwire.core.middleware.Middleware;
import com.ryuqq.opwire.core.middleware.MiddlewareKind;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.spi.TransactionHandle;
import com.ryuqq.opwire.core.spi.TransactionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 트랜잭션 미들웨어.
 *
 * <p>내부 Operation의 모든 의존성 쓰기를 하나의 트랜잭션으로 묶습니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>컨텍스트에 이미 핸들이 있으면 재사용 (평탄한 트랜잭션, 커밋/롤백은 바깥 소유자가 수행)</li>
 *   <li>없으면 {@link TransactionProvider#begin()}으로 시작하여 컨텍스트에 넣고 내부 호출</li>
 *   <li>Ok → commit 정확히 한 번, Fail → rollback 정확히 한 번</li>
 *   <li>예외 (checked 포함) → rollback 후 예외 그대로 재전파 (rollback 실패는 suppressed로 첨부)</li>
 *   <li>null 결과 → rollback 후 {@link IllegalStateException}</li>
 *   <li>begin/commit 실패 → {@link DependencyError} ("transaction.begin" / "transaction.commit")</li>
 * </ul>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 * @param <H> 트랜잭션 핸들 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class TransactionMiddleware<Q, R, H extends TransactionHandle> implements Middleware<Q, R> {

    private static final Logger log = LoggerFactory.getLogger(TransactionMiddleware.class);

    static final String BEGIN_STEP = "transaction.begin";
    static final String COMMIT_STEP = "transaction.commit";

    private final TransactionProvider<H> provider;

    private TransactionMiddleware(TransactionProvider<H> provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        this.provider = provider;
    }

    public static <Q, R, H extends TransactionHandle> TransactionMiddleware<Q, R, H> create(TransactionProvider<H> provider) {
        return new TransactionMiddleware<>(provider);
    }

    @Override
    public Operation<Q, R> wrap(Operation<Q, R> inner) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        return (ctx, request) -> {
            Optional<H> existing = ctx.find(provider.contextKey());
            if (existing.isPresent()) {
                log.debug("Joining existing transaction {}", provider.contextKey().getName());
                return inner.invoke(ctx, request);
            }

            H handle;
            try {
                handle = provider.begin();
            } catch (RuntimeException e) {
                return Outcome.fail(DependencyError.at(BEGIN_STEP, e));
            }

            ExecutionContext scoped = ctx.with(provider.contextKey(), handle);
            Outcome<R> outcome;
            try {
                outcome = inner.invoke(scoped, request);
            } catch (Throwable fault) {
                rollbackAfterFault(handle, fault);
                throw fault;
            }
            if (outcome == null) {
                IllegalStateException fault = new IllegalStateException("inner operation returned null outcome");
                rollbackAfterFault(handle, fault);
                throw fault;
            }

            if (outcome.isOk()) {
                try {
                    handle.commit();
                } catch (RuntimeException e) {
                    log.warn("Commit failed for {}: {}", provider.contextKey().getName(), e.toString());
                    return Outcome.fail(DependencyError.at(COMMIT_STEP, e));
                }
                return outcome;
            }

            try {
                handle.rollback();
            } catch (RuntimeException e) {
                log.error("Rollback failed for {} after {}", provider.contextKey().getName(), outcome.getErrorOrNull().category(), e);
            }
            return outcome;
        };
    }

    private static void rollbackAfterFault(TransactionHandle handle, Throwable fault) {
        try {
            handle.rollback();
        } catch (RuntimeException rollbackFailure) {
            fault.addSuppressed(rollbackFailure);
        }
    }

    @Override
    public MiddlewareKind kind() {
        return MiddlewareKind.TRANSACTION;
    }
}
