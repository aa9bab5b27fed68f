package com.ryuqq.opwire.core.spi;

import com.ryuqq.opwire.core.statemachine.HandleState;

/**
 * An open unit-of-work against a stateful backing store.
 *
 * <p><strong>Ownership:</strong> exclusively owned by the transaction middleware invocation
 * that opened it. Operations borrow the handle through the execution context and must never
 * call {@link #commit()} or {@link #rollback()} themselves.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Exactly one terminal action (commit or rollback) is applied per handle</li>
 *   <li>A handle is never reused after its terminal action</li>
 *   <li>A handle is never shared across concurrently executing invocations</li>
 * </ul>
 *
 * <p>Implementations should extend
 * {@link com.ryuqq.opwire.core.transaction.AbstractTransactionHandle}, which enforces the
 * single-terminal-action rule.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public interface TransactionHandle {

    /**
     * Commits the unit of work.
     *
     * @throws IllegalStateException if a terminal action was already applied
     * @throws RuntimeException if the backing store fails to commit
     */
    void commit();

    /**
     * Rolls back the unit of work.
     *
     * @throws IllegalStateException if a terminal action was already applied
     * @throws RuntimeException if the backing store fails to roll back
     */
    void rollback();

    /**
     * Returns the current lifecycle state.
     *
     * @return OPEN, COMMITTED or ROLLED_BACK
     */
    HandleState state();
}
