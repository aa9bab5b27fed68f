/**
 * Operation execution outcome package.
 *
 * <p>This package defines the sealed result type every Operation returns:
 * exactly one of a response or an error is meaningful.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.opwire.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.opwire.core.outcome.Ok} - Success with a fully populated response</li>
 *   <li>{@link com.ryuqq.opwire.core.outcome.Fail} - Failure carrying an
 *       {@link com.ryuqq.opwire.core.error.OperationError}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Outcome&lt;Entity&gt; outcome = Steps.call(ctx, "load-entity", () -&gt; repository.load(ctx, id))
 *     .flatMap(entity -&gt; rename(ctx, entity, request.name()));
 * </pre>
 *
 * @since 1.0.0
 * @author Opwire Team
 */
package com.ryuqq.opwire.core.outcome;
