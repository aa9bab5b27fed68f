package com.ryuqq.opwire.testkit.contract;

import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.context.RequestScope;
import com.ryuqq.opwire.core.error.CancellationError;
import com.ryuqq.opwire.core.error.DependencyError;
import com.ryuqq.opwire.core.error.ErrorCategory;
import com.ryuqq.opwire.core.middleware.MiddlewareStack;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.middleware.DeadlineMiddleware;
import com.ryuqq.opwire.middleware.RetryMiddleware;
import com.ryuqq.opwire.middleware.RetryPolicy;
import com.ryuqq.opwire.testkit.sample.CreateEntityRequest;
import com.ryuqq.opwire.testkit.sample.Entity;
import com.ryuqq.opwire.testkit.sample.InMemoryEntityRepository;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

/**
 * Contract Test: cancellation and deadlines.
 *
 * <p>Cancellation is cooperative: dependency steps and retry attempts observe the signal,
 * the invocation ends with a CANCELLED outcome and its unit of work is rolled back.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractContractTest {

    @Test
    void testCancelledBeforeInvoke_NoWrites_RolledBack() {
        // Given
        RequestScope scope = openScope();
        scope.cancel("client disconnected");
        Operation<CreateEntityRequest, Entity> operation = transactional(createEntity());

        // When
        Outcome<Entity> outcome = operation.invoke(scope.context(), CreateEntityRequest.named("alpha"));

        // Then
        CancellationError error = (CancellationError) assertFailed(outcome, ErrorCategory.CANCELLED);
        assertEquals("client disconnected", error.reason());
        assertStoreEmpty();
        assertEquals(1, store.getRollbackCount());
        assertEquals(0, idGenerator.issued());
    }

    @Test
    void testDeadlinePassesBetweenWrites_SecondStepCancelled_FirstWriteRolledBack() {
        // Given: the entity write takes longer than the whole budget
        InMemoryEntityRepository slow = spy(repository);
        doAnswer(invocation -> {
            timeSource.advance(Duration.ofMillis(200));
            return invocation.callRealMethod();
        }).when(slow).save(any(), any());
        Operation<CreateEntityRequest, Entity> operation = MiddlewareStack.<CreateEntityRequest, Entity>of(
            DeadlineMiddleware.create(Duration.ofMillis(100), timeSource)
        ).apply(transactional(createEntity(slow)));

        // When
        Outcome<Entity> outcome = operation.invoke(callerContext(), CreateEntityRequest.named("alpha"));

        // Then
        CancellationError error = (CancellationError) assertFailed(outcome, ErrorCategory.CANCELLED);
        assertTrue(error.reason().contains("deadline exceeded"), "Unexpected reason: " + error.reason());
        assertStoreEmpty();
        assertEquals(1, store.getRollbackCount());
    }

    @Test
    void testDeadlinePassesDuringBackoff_RetryStopsWithCancellation() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        Operation<String, String> failing = (ctx, request) -> {
            attempts.incrementAndGet();
            return Outcome.fail(DependencyError.of("downstream", "connection reset", true));
        };
        Operation<String, String> operation = MiddlewareStack.<String, String>of(
            DeadlineMiddleware.create(Duration.ofMillis(1_500), timeSource),
            RetryMiddleware.create(new RetryPolicy(5, 1_000, 1_000, 0.0), timeSource.sleeper())
        ).apply(failing);

        // When
        Outcome<String> outcome = operation.invoke(callerContext(), "req");

        // Then
        assertFailed(outcome, ErrorCategory.CANCELLED);
        assertEquals(2, attempts.get(), "No attempt may start after the deadline");
        assertEquals(2, timeSource.sleeps().size());
    }

    @Test
    void testParentDeadlineEarlier_KeptOverMiddlewareTimeout() {
        // Given
        RequestScope scope = RequestScope.open(timeSource, Duration.ofMillis(50));
        Operation<String, String> operation = MiddlewareStack.<String, String>of(
            DeadlineMiddleware.create(Duration.ofSeconds(10), timeSource)
        ).apply((ctx, request) -> {
            timeSource.advance(Duration.ofMillis(60));
            return ctx.cancellation().<Outcome<String>>map(Outcome::fail).orElseGet(() -> Outcome.ok(request));
        });

        // When
        Outcome<String> outcome;
        try (scope) {
            ExecutionContext ctx = scope.context();
            outcome = operation.invoke(ctx, "req");
        }

        // Then
        assertFailed(outcome, ErrorCategory.CANCELLED);
    }
}
