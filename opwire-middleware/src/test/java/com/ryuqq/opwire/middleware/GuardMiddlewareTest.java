package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.context.ContextKey;
import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.error.AuthorizationError;
import com.ryuqq.opwire.core.error.ValidationError;
import com.ryuqq.opwire.core.error.Violation;
import com.ryuqq.opwire.core.guard.Authorizer;
import com.ryuqq.opwire.core.guard.Validator;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * AuthorizationMiddleware / ValidationMiddleware 유닛 테스트.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class GuardMiddlewareTest {

    private static final ContextKey<String> PRINCIPAL = ContextKey.named("principal");

    @Mock
    private Operation<String, String> inner;

    @Test
    void authorization_거부_시_내부_호출_없이_AuthorizationError() {
        // given
        Authorizer<String> authorizer = (ctx, request) -> ctx.find(PRINCIPAL).isPresent()
            ? Optional.empty()
            : Optional.of(AuthorizationError.of("anonymous caller"));
        Operation<String, String> guarded = AuthorizationMiddleware.<String, String>create(authorizer).wrap(inner);

        // when
        Outcome<String> outcome = guarded.invoke(ExecutionContext.background(), "req");

        // then
        assertThat(outcome.getErrorOrNull()).isEqualTo(AuthorizationError.of("anonymous caller"));
        verifyNoInteractions(inner);
    }

    @Test
    void authorization_허용_시_내부_호출() {
        // given
        Authorizer<String> authorizer = (ctx, request) -> Optional.empty();
        when(inner.invoke(any(), any())).thenReturn(Outcome.ok("ok"));
        ExecutionContext ctx = ExecutionContext.background().with(PRINCIPAL, "alice");

        // when
        Outcome<String> outcome = AuthorizationMiddleware.<String, String>create(authorizer).wrap(inner).invoke(ctx, "req");

        // then
        assertThat(outcome.getResponseOrNull()).isEqualTo("ok");
        verify(inner).invoke(ctx, "req");
    }

    @Test
    void validation_위반_시_내부_호출_없이_ValidationError() {
        // given
        Validator<String> validator = request -> request.isBlank()
            ? List.of(Violation.of("name", "must not be blank"))
            : List.of();

        // when
        Outcome<String> outcome = ValidationMiddleware.<String, String>create(validator)
            .wrap(inner)
            .invoke(ExecutionContext.background(), " ");

        // then
        assertThat(outcome.getErrorOrNull()).isInstanceOf(ValidationError.class);
        assertThat(((ValidationError) outcome.getErrorOrNull()).violations())
            .containsExactly(Violation.of("name", "must not be blank"));
        verifyNoInteractions(inner);
    }

    @Test
    void validation_통과_시_내부_호출() {
        // given
        Validator<String> validator = request -> List.of();
        when(inner.invoke(any(), any())).thenReturn(Outcome.ok("created"));

        // when
        Outcome<String> outcome = ValidationMiddleware.<String, String>create(validator)
            .wrap(inner)
            .invoke(ExecutionContext.background(), "widget");

        // then
        assertThat(outcome.getResponseOrNull()).isEqualTo("created");
    }
}
