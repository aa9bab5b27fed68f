package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.error.ValidationError;
import com.ryuqq.opwire.core.error.Violation;
import com.ryuqq.opwire.core.guard.Validator;
import com.ryuqq.opwire.core.middleware.Middleware;
import com.ryuqq.opwire.core.middleware.MiddlewareKind;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;

import java.util.List;

/**
 * 입력 검증 미들웨어.
 *
 * <p>위반이 하나라도 있으면 내부 Operation을 호출하지 않고 {@link ValidationError}를 반환합니다.
 * Operation 자체의 검증을 대체하지 않으며, 여러 Operation이 공유하는 규칙을 앞단에 두는 용도입니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class ValidationMiddleware<Q, R> implements Middleware<Q, R> {

    private final Validator<Q> validator;

    private ValidationMiddleware(Validator<Q> validator) {
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        this.validator = validator;
    }

    public static <Q, R> ValidationMiddleware<Q, R> create(Validator<Q> validator) {
        return new ValidationMiddleware<>(validator);
    }

    @Override
    public Operation<Q, R> wrap(Operation<Q, R> inner) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        return (ctx, request) -> {
            List<Violation> violations = validator.validate(request);
            if (violations != null && !violations.isEmpty()) {
                return Outcome.fail(new ValidationError(violations));
            }
            return inner.invoke(ctx, request);
        };
    }

    @Override
    public MiddlewareKind kind() {
        return MiddlewareKind.VALIDATION;
    }
}
