/**
 * Service Provider Interfaces for resource providers.
 *
 * <p>This package defines the interfaces the core needs from stateful resource providers.
 * Implementations are wired once at startup and shared by every operation that declares them.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.opwire.core.spi.TransactionProvider} - opens units of work</li>
 *   <li>{@link com.ryuqq.opwire.core.spi.TransactionHandle} - one open unit of work</li>
 *   <li>{@link com.ryuqq.opwire.core.spi.IdGenerator} - identifier generation</li>
 *   <li>{@link com.ryuqq.opwire.core.spi.TimeSource} - wall clock and monotonic time</li>
 *   <li>{@link com.ryuqq.opwire.core.spi.Sleeper} - waits between retry attempts</li>
 *   <li>{@link com.ryuqq.opwire.core.spi.TimingRecorder} - per-invocation timing sink</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All provider implementations are shared singletons and must be safe for concurrent use.
 * Transaction handles are the exception: each is owned by exactly one invocation.</p>
 *
 * @since 1.0.0
 * @author Opwire Team
 */
package com.ryuqq.opwire.core.spi;
