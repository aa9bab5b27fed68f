package com.ryuqq.opwire.application.wiring;

/**
 * Raised when a wiring plan is invalid or a component cannot be constructed.
 *
 * <p>Only thrown at startup, from {@link WiringPlan.Builder#build()} and {@link WiringPlan#assemble()}.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public class AssemblyException extends RuntimeException {

    private final ComponentName component;
    private final ComponentStage stage;

    public AssemblyException(String message) {
        this(message, null, null, null);
    }

    public AssemblyException(String message, ComponentName component, ComponentStage stage) {
        this(message, component, stage, null);
    }

    public AssemblyException(String message, ComponentName component, ComponentStage stage, Throwable cause) {
        super(message, cause);
        this.component = component;
        this.stage = stage;
    }

    /**
     * @return the offending component, or null if the failure is not tied to one
     */
    public ComponentName getComponent() {
        return component;
    }

    /**
     * @return the stage of the offending component, or null if unknown
     */
    public ComponentStage getStage() {
        return stage;
    }
}
