/**
 * In-memory transactional key/value store.
 *
 * <p>Reference {@link com.ryuqq.opwire.core.spi.TransactionProvider} used by the testkit and
 * the sample operation. Production applications supply their own provider over a real database.</p>
 *
 * @since 1.0.0
 * @author Opwire Team
 */
package com.ryuqq.opwire.adapter.inmemory.store;
