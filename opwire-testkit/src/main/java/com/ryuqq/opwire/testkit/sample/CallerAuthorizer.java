package com.ryuqq.opwire.testkit.sample;

import com.ryuqq.opwire.core.context.ContextKey;
import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.error.AuthorizationError;
import com.ryuqq.opwire.core.guard.Authorizer;

import java.util.Optional;

/**
 * Allows any request whose context carries a non-blank caller.
 *
 * @param <Q> request type
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class CallerAuthorizer<Q> implements Authorizer<Q> {

    public static final ContextKey<String> CALLER = ContextKey.named("caller");

    @Override
    public Optional<AuthorizationError> authorize(ExecutionContext ctx, Q request) {
        Optional<String> caller = ctx.find(CALLER);
        if (caller.isEmpty() || caller.get().isBlank()) {
            return Optional.of(AuthorizationError.of("anonymous callers are not allowed"));
        }
        return Optional.empty();
    }
}
