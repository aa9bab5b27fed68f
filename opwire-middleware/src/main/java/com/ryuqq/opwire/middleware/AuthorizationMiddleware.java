package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.error.AuthorizationError;
import com.ryuqq.opwire.core.guard.Authorizer;
import com.ryuqq.opwire.core.middleware.Middleware;
import com.ryuqq.opwire.core.middleware.MiddlewareKind;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;

import java.util.Optional;

/**
 * 권한 검사 미들웨어.
 *
 * <p>거부되면 내부 Operation을 호출하지 않고 {@link AuthorizationError}를 반환합니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class AuthorizationMiddleware<Q, R> implements Middleware<Q, R> {

    private final Authorizer<Q> authorizer;

    private AuthorizationMiddleware(Authorizer<Q> authorizer) {
        if (authorizer == null) {
            throw new IllegalArgumentException("authorizer cannot be null");
        }
        this.authorizer = authorizer;
    }

    public static <Q, R> AuthorizationMiddleware<Q, R> create(Authorizer<Q> authorizer) {
        return new AuthorizationMiddleware<>(authorizer);
    }

    @Override
    public Operation<Q, R> wrap(Operation<Q, R> inner) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        return (ctx, request) -> {
            Optional<AuthorizationError> denied = authorizer.authorize(ctx, request);
            if (denied.isPresent()) {
                return Outcome.fail(denied.get());
            }
            return inner.invoke(ctx, request);
        };
    }

    @Override
    public MiddlewareKind kind() {
        return MiddlewareKind.AUTHORIZATION;
    }
}
