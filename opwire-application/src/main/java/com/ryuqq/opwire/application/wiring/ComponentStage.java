package com.ryuqq.opwire.application.wiring;

/**
 * Assembly stage of a component, in topological order.
 *
 * <p>A component may depend only on components of the same or an earlier stage.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public enum ComponentStage {

    /** Shared stateful resources: stores, clients, id generators, clocks. */
    RESOURCE,

    /** Bare operations built from resources. */
    OPERATION,

    /** Operations wrapped in their middleware stack. */
    WRAPPED_OPERATION,

    /** Front-end bindings that expose wrapped operations. */
    BINDING;

    /**
     * Whether a component of this stage may depend on a component of {@code other}.
     *
     * @param other stage of the dependency
     * @return true if {@code other} is this stage or an earlier one
     */
    public boolean mayDependOn(ComponentStage other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return other.ordinal() <= this.ordinal();
    }
}
