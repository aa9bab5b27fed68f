package com.ryuqq.opwire.application.wiring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Immutable result of {@link WiringPlan#assemble()}: component name to instance.
 *
 * <p>Safe to share across threads once returned. {@link #close()} closes every
 * {@link AutoCloseable} component in reverse construction order.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class Assembly implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Assembly.class);

    private final Map<ComponentName, Object> instances;
    private final Map<ComponentName, WiringPlan.Declaration<?>> declarations;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    Assembly(Map<ComponentName, Object> instances, Map<ComponentName, WiringPlan.Declaration<?>> declarations) {
        this.instances = Collections.unmodifiableMap(instances);
        this.declarations = declarations;
    }

    /**
     * Returns the instance of a component.
     *
     * @param ref component reference
     * @param <T> component type
     * @return the instance
     * @throws IllegalArgumentException if the component is not part of this assembly
     */
    public <T> T get(ComponentRef<T> ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        Object instance = instances.get(ref.name());
        if (instance == null) {
            throw new IllegalArgumentException("Unknown component '" + ref.name() + "'");
        }
        return (T) instance;
    }

    public List<ComponentName> dependenciesOf(ComponentName name) {
        return declaration(name).dependencies();
    }

    public ComponentStage stageOf(ComponentName name) {
        return declaration(name).stage();
    }

    /**
     * @return component names in construction order
     */
    public List<ComponentName> names() {
        return List.copyOf(instances.keySet());
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes every {@link AutoCloseable} component in reverse construction order.
     *
     * <p>Idempotent. All components are attempted; failures are collected into one
     * {@link AssemblyException}.</p>
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        AssemblyException failure = new AssemblyException("Failed to close assembly");
        closeInReverse(new ArrayList<>(instances.values()), failure);
        if (failure.getSuppressed().length > 0) {
            throw failure;
        }
    }

    private WiringPlan.Declaration<?> declaration(ComponentName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        WiringPlan.Declaration<?> declaration = declarations.get(name);
        if (declaration == null) {
            throw new IllegalArgumentException("Unknown component '" + name + "'");
        }
        return declaration;
    }

    // The same instance may back several names; close it once.
    static void closeInReverse(List<Object> constructed, Throwable failures) {
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = constructed.size() - 1; i >= 0; i--) {
            Object instance = constructed.get(i);
            if (!(instance instanceof AutoCloseable closeable) || !seen.add(instance)) {
                continue;
            }
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", instance.getClass().getSimpleName(), e.toString());
                failures.addSuppressed(e);
            }
        }
    }
}
