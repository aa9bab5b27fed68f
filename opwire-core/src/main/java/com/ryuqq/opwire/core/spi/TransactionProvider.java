package com.ryuqq.opwire.core.spi;

import com.ryuqq.opwire.core.context.ContextKey;

/**
 * Resource provider SPI capable of opening units of work against one backing store.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Open a fresh {@link TransactionHandle} on demand ({@link #begin()})</li>
 *   <li>Identify its backing store through a {@link ContextKey}; the transaction middleware
 *       attaches open handles to the execution context under this key</li>
 * </ul>
 *
 * <p><strong>Flat transactions:</strong> two providers for the same backing store must return
 * the same key. When a handle is already attached under the key, the middleware reuses it
 * instead of opening a nested one.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: {@link #begin()} is called concurrently by independent requests</li>
 *   <li>{@link #contextKey()} returns the same instance on every call</li>
 * </ul>
 *
 * @param <H> the handle type operations use to reach the backing store
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public interface TransactionProvider<H extends TransactionHandle> {

    /**
     * Returns the key identifying this provider's backing store.
     *
     * @return the context key (stable across calls)
     */
    ContextKey<H> contextKey();

    /**
     * Opens a new unit of work.
     *
     * @return a new handle in OPEN state
     * @throws RuntimeException if the backing store cannot open a unit of work
     */
    H begin();
}
