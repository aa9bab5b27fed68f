/**
 * Wiring graph: explicit, acyclic, stage-ordered component assembly.
 *
 * <p>Stages in construction order: {@code RESOURCE → OPERATION → WRAPPED_OPERATION → BINDING}.
 * A {@link com.ryuqq.opwire.application.wiring.WiringPlan} is validated once and can be
 * assembled any number of times; each {@link com.ryuqq.opwire.application.wiring.Assembly}
 * owns its own instances.</p>
 *
 * @since 1.0.0
 * @author Opwire Team
 */
package com.ryuqq.opwire.application.wiring;
