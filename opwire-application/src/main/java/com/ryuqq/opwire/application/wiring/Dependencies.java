package com.ryuqq.opwire.application.wiring;

import java.util.Map;
import java.util.Set;

/**
 * View over the already constructed dependencies of one component.
 *
 * <p>Resolves only the references the component declared. Looking up anything else is
 * an assembly error, so a factory cannot reach into the graph behind the plan's back.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class Dependencies {

    private final ComponentName owner;
    private final Set<ComponentName> declared;
    private final Map<ComponentName, Object> instances;

    Dependencies(ComponentName owner, Set<ComponentName> declared, Map<ComponentName, Object> instances) {
        this.owner = owner;
        this.declared = declared;
        this.instances = instances;
    }

    /**
     * Returns the instance behind a declared dependency.
     *
     * @param ref dependency reference
     * @param <T> component type
     * @return the shared instance
     * @throws AssemblyException if {@code ref} was not declared as a dependency of this component
     */
    public <T> T get(ComponentRef<T> ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (!declared.contains(ref.name())) {
            throw new AssemblyException(
                "Component '" + owner + "' requested undeclared dependency '" + ref.name() + "'", owner, null);
        }
        return (T) instances.get(ref.name());
    }

    public ComponentName owner() {
        return owner;
    }
}
