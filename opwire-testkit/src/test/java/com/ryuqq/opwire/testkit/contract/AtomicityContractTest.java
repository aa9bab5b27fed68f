package com.ryuqq.opwire.testkit.contract;

import com.ryuqq.opwire.core.error.DependencyError;
import com.ryuqq.opwire.core.error.DependencyException;
import com.ryuqq.opwire.core.error.ErrorCategory;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.transaction.Transactions;
import com.ryuqq.opwire.core.statemachine.HandleState;
import com.ryuqq.opwire.middleware.TransactionMiddleware;
import com.ryuqq.opwire.testkit.recording.RecordingTransaction;
import com.ryuqq.opwire.testkit.sample.CreateEntityRequest;
import com.ryuqq.opwire.testkit.sample.Entity;
import com.ryuqq.opwire.testkit.sample.InMemoryEntityRepository;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

/**
 * Contract Test: transactional atomicity.
 *
 * <p>Every write of one invocation is committed together, or none is.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Ok outcome → exactly one commit, no rollback</li>
 *   <li>Fail outcome, thrown fault or null outcome → exactly one rollback, no commit</li>
 *   <li>Second write fails → first write is not visible, dependency error surfaced</li>
 *   <li>Commit failure → dependency error at {@code transaction.commit}</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
class AtomicityContractTest extends AbstractContractTest {

    @Test
    void testAtomicCommit_WhenBothWritesSucceed_EntityAndIndexPersisted() {
        // Given
        Operation<CreateEntityRequest, Entity> operation = transactional(createEntity());

        // When
        Outcome<Entity> outcome = operation.invoke(callerContext(), CreateEntityRequest.named("alpha"));

        // Then
        Entity entity = assertOk(outcome);
        assertEquals("entity-1", entity.id());
        assertTrue(store.containsKey("entity:entity-1"), "Entity should be committed");
        assertTrue(store.containsKey("name:alpha"), "Name index should be committed");
        assertEquals(1, store.getCommitCount());
        assertEquals(0, store.getRollbackCount());
    }

    @Test
    void testAtomicRollback_WhenSecondWriteFails_FirstWriteNotVisible() {
        // Given: index write fails after the entity write succeeded
        InMemoryEntityRepository failing = spy(repository);
        doThrow(DependencyException.permanentFailure("index unavailable"))
            .when(failing).indexName(any(), anyString(), anyString());
        Operation<CreateEntityRequest, Entity> operation = transactional(createEntity(failing));

        // When
        Outcome<Entity> outcome = operation.invoke(callerContext(), CreateEntityRequest.named("alpha"));

        // Then
        DependencyError error = (DependencyError) assertFailed(outcome, ErrorCategory.DEPENDENCY);
        assertEquals("entity.index-name", error.step());
        assertEquals("index unavailable", error.message());
        assertFalse(error.retryable());
        assertStoreEmpty();
        assertEquals(0, store.getCommitCount());
        assertEquals(1, store.getRollbackCount());
    }

    @Test
    void testCommitOnce_WhenOperationSucceeds_NoRollback() {
        // Given
        Operation<String, String> operation = recordingTransactional((ctx, request) -> Outcome.ok(request));

        // When
        Outcome<String> outcome = operation.invoke(callerContext(), "req");

        // Then
        assertEquals("req", assertOk(outcome));
        assertEquals(1, recordingProvider.getBeginCount());
        assertEquals(1, recordingProvider.getCommitCount());
        assertEquals(0, recordingProvider.getRollbackCount());
        assertEquals(HandleState.COMMITTED, recordingProvider.getOpened().get(0).state());
    }

    @Test
    void testRollbackOnce_WhenOperationFails_NoCommit() {
        // Given
        Operation<String, String> operation = recordingTransactional(
            (ctx, request) -> Outcome.fail(DependencyError.of("downstream", "unavailable", false)));

        // When
        Outcome<String> outcome = operation.invoke(callerContext(), "req");

        // Then
        assertFailed(outcome, ErrorCategory.DEPENDENCY);
        assertEquals(0, recordingProvider.getCommitCount());
        assertEquals(1, recordingProvider.getRollbackCount());
        assertEquals(HandleState.ROLLED_BACK, recordingProvider.getOpened().get(0).state());
    }

    @Test
    void testRollbackOnce_WhenOperationThrows_FaultPropagated() {
        // Given
        Operation<String, String> operation = recordingTransactional((ctx, request) -> {
            throw new IllegalStateException("boom");
        });

        // When
        IllegalStateException fault = assertThrows(IllegalStateException.class,
            () -> operation.invoke(callerContext(), "req"));

        // Then
        assertEquals("boom", fault.getMessage());
        assertEquals(0, recordingProvider.getCommitCount());
        assertEquals(1, recordingProvider.getRollbackCount());
    }

    @Test
    void testRollbackOnce_WhenOperationThrowsUndeclaredCheckedException_FaultPropagated() {
        // Given
        IOException checked = new IOException("disk");
        Operation<String, String> operation = recordingTransactional((ctx, request) -> {
            throw undeclared(checked);
        });

        // When
        IOException fault = assertThrows(IOException.class, () -> operation.invoke(callerContext(), "req"));

        // Then
        assertSame(checked, fault);
        assertEquals(0, recordingProvider.getCommitCount());
        assertEquals(1, recordingProvider.getRollbackCount());
        assertEquals(HandleState.ROLLED_BACK, recordingProvider.getOpened().get(0).state());
    }

    @Test
    void testRollbackOnce_WhenOperationReturnsNull_IllegalStateException() {
        // Given
        Operation<String, String> operation = recordingTransactional((ctx, request) -> null);

        // When
        IllegalStateException fault = assertThrows(IllegalStateException.class,
            () -> operation.invoke(callerContext(), "req"));

        // Then
        assertEquals("inner operation returned null outcome", fault.getMessage());
        assertEquals(0, recordingProvider.getCommitCount());
        assertEquals(1, recordingProvider.getRollbackCount());
        assertEquals(HandleState.ROLLED_BACK, recordingProvider.getOpened().get(0).state());
    }

    @Test
    void testCommitFailure_WhenProviderRejectsCommit_DependencyErrorSurfaced() {
        // Given
        recordingProvider.failNextCommit(new IllegalStateException("disk full"));
        Operation<String, String> operation = recordingTransactional((ctx, request) -> Outcome.ok(request));

        // When
        Outcome<String> outcome = operation.invoke(callerContext(), "req");

        // Then
        DependencyError error = (DependencyError) assertFailed(outcome, ErrorCategory.DEPENDENCY);
        assertEquals("transaction.commit", error.step());
        assertEquals("disk full", error.message());
        assertEquals(0, recordingProvider.getCommitCount());
    }

    @Test
    void testBeginFailure_WhenProviderCannotOpen_OperationNotInvoked() {
        // Given
        AtomicReference<String> invoked = new AtomicReference<>();
        recordingProvider.failNextBegin(new IllegalStateException("pool exhausted"));
        Operation<String, String> operation = recordingTransactional((ctx, request) -> {
            invoked.set(request);
            return Outcome.ok(request);
        });

        // When
        Outcome<String> outcome = operation.invoke(callerContext(), "req");

        // Then
        DependencyError error = (DependencyError) assertFailed(outcome, ErrorCategory.DEPENDENCY);
        assertEquals("transaction.begin", error.step());
        assertNull(invoked.get(), "Operation must not run without a transaction");
    }

    @Test
    void testHandleVisible_InsideOperation_ThroughContext() {
        // Given
        AtomicReference<RecordingTransaction> seen = new AtomicReference<>();
        Operation<String, String> operation = recordingTransactional((ctx, request) -> {
            seen.set(Transactions.require(ctx, recordingProvider));
            return Outcome.ok(request);
        });

        // When
        operation.invoke(callerContext(), "req");

        // Then
        assertSame(recordingProvider.getOpened().get(0), seen.get());
    }

    private Operation<String, String> recordingTransactional(Operation<String, String> base) {
        return TransactionMiddleware.<String, String, RecordingTransaction>create(recordingProvider).wrap(base);
    }

    /**
     * Throws a checked exception past the compiler, the way Lombok {@code @SneakyThrows} callers do.
     */
    private static RuntimeException undeclared(Throwable fault) {
        AtomicityContractTest.<RuntimeException>throwAs(fault);
        return new IllegalStateException("unreachable");
    }

    private static <E extends Throwable> void throwAs(Throwable fault) throws E {
        throw (E) fault;
    }
}
