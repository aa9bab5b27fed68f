/**
 * Execution context propagation.
 *
 * <p>An {@link com.ryuqq.opwire.core.context.ExecutionContext} is an immutable, key-scoped,
 * chainable carrier passed explicitly as the first argument to every Operation call.
 * It carries a {@link com.ryuqq.opwire.core.context.CancellationSignal} and a set of attached
 * resource handles looked up by {@link com.ryuqq.opwire.core.context.ContextKey}.</p>
 *
 * <p>A {@link com.ryuqq.opwire.core.context.RequestScope} owns the root context of one external
 * request and is the only party allowed to cancel it.</p>
 *
 * @since 1.0.0
 * @author Opwire Team
 */
package com.ryuqq.opwire.core.context;
