package com.ryuqq.opwire.application.wiring;

/**
 * Typed reference to a declared component.
 *
 * <p>References are handed out by {@link WiringPlan.Builder} when a component is declared
 * (or by {@link WiringPlan.Builder#ref(String)} for a component declared later) and are
 * the only way to express a dependency or to read an instance from an {@link Assembly}.
 * Two references are equal when they name the same component.</p>
 *
 * @param <T> component type
 * @param name component name
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record ComponentRef<T>(ComponentName name) {

    public ComponentRef {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }

    static <T> ComponentRef<T> of(String name) {
        return new ComponentRef<>(ComponentName.of(name));
    }

    @Override
    public String toString() {
        return "ComponentRef{" + name + '}';
    }
}
