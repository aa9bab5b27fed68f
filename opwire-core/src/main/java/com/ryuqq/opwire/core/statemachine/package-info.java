/**
 * Lifecycle state machines.
 *
 * <ul>
 *   <li>{@link com.ryuqq.opwire.core.statemachine.RequestState} - CREATED → COMPLETED | CANCELLED</li>
 *   <li>{@link com.ryuqq.opwire.core.statemachine.HandleState} - OPEN → COMMITTED | ROLLED_BACK</li>
 *   <li>{@link com.ryuqq.opwire.core.statemachine.StateTransition} - transition validation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Opwire Team
 */
package com.ryuqq.opwire.core.statemachine;
