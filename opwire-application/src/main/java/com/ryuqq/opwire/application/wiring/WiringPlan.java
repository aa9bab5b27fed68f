package com.ryuqq.opwire.application.wiring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, validated declaration of an application's component graph.
 *
 * <p>A plan is built once with {@link #builder()}. {@link Builder#build()} rejects
 * duplicate names, unknown references, stage violations and cycles before anything is
 * constructed. {@link #assemble()} then constructs every component exactly once in
 * topological order, so all dependents of a resource share the same instance.</p>
 *
 * <pre>{@code
 * WiringPlan.Builder plan = WiringPlan.builder();
 * ComponentRef<InMemoryKeyValueStore> store =
 *     plan.resource("store", deps -> new InMemoryKeyValueStore());
 * ComponentRef<Operation<CreateEntityRequest, Entity>> create =
 *     plan.operation("create-entity", List.of(store), deps -> new CreateEntity(...));
 * Assembly assembly = plan.build().assemble();
 * }</pre>
 *
 * <p>Assembling the same plan twice yields two independent assemblies with distinct
 * instances.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class WiringPlan {

    private static final Logger log = LoggerFactory.getLogger(WiringPlan.class);

    private final List<Declaration<?>> order;

    private WiringPlan(List<Declaration<?>> order) {
        this.order = order;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Constructs every component in topological order.
     *
     * <p>If a factory fails, the components constructed so far that implement
     * {@link AutoCloseable} are closed in reverse construction order and an
     * {@link AssemblyException} naming the failed component and its stage is thrown.</p>
     *
     * @return a new assembly
     * @throws AssemblyException if any factory fails or returns null
     */
    public Assembly assemble() {
        Map<ComponentName, Object> instances = new LinkedHashMap<>();
        for (Declaration<?> declaration : order) {
            Object instance;
            try {
                instance = declaration.factory().create(
                    new Dependencies(declaration.name(), declaration.dependencyNames(), instances));
            } catch (Exception e) {
                AssemblyException failure = new AssemblyException(
                    "Failed to construct component '" + declaration.name() + "' at stage " + declaration.stage()
                        + ": " + e.getMessage(),
                    declaration.name(), declaration.stage(), e);
                Assembly.closeInReverse(new ArrayList<>(instances.values()), failure);
                throw failure;
            } catch (Error e) {
                log.error("Fatal error constructing component '{}' at stage {}", declaration.name(), declaration.stage());
                Assembly.closeInReverse(new ArrayList<>(instances.values()), e);
                throw e;
            }
            if (instance == null) {
                AssemblyException failure = new AssemblyException(
                    "Factory for component '" + declaration.name() + "' returned null",
                    declaration.name(), declaration.stage());
                Assembly.closeInReverse(new ArrayList<>(instances.values()), failure);
                throw failure;
            }
            instances.put(declaration.name(), instance);
            log.debug("Constructed {} component '{}'", declaration.stage(), declaration.name());
        }
        log.info("Assembled {} components", instances.size());
        return new Assembly(instances, describe());
    }

    /**
     * @return component names in construction order
     */
    public List<ComponentName> constructionOrder() {
        return order.stream().map(Declaration::name).collect(Collectors.toUnmodifiableList());
    }

    private Map<ComponentName, Declaration<?>> describe() {
        Map<ComponentName, Declaration<?>> byName = new LinkedHashMap<>();
        for (Declaration<?> declaration : order) {
            byName.put(declaration.name(), declaration);
        }
        return Collections.unmodifiableMap(byName);
    }

    /**
     * A declared component.
     */
    record Declaration<T>(
        ComponentName name,
        ComponentStage stage,
        List<ComponentName> dependencies,
        ComponentFactory<T> factory
    ) {

        Set<ComponentName> dependencyNames() {
            return Set.copyOf(dependencies);
        }
    }

    /**
     * Mutable collector of declarations. Not thread-safe.
     */
    public static final class Builder {

        private final Map<ComponentName, Declaration<?>> declarations = new LinkedHashMap<>();

        private Builder() {
        }

        public <T> ComponentRef<T> resource(String name, ComponentFactory<T> factory) {
            return declare(ComponentStage.RESOURCE, name, List.of(), factory);
        }

        public <T> ComponentRef<T> resource(String name, List<? extends ComponentRef<?>> dependsOn, ComponentFactory<T> factory) {
            return declare(ComponentStage.RESOURCE, name, dependsOn, factory);
        }

        public <T> ComponentRef<T> operation(String name, List<? extends ComponentRef<?>> dependsOn, ComponentFactory<T> factory) {
            return declare(ComponentStage.OPERATION, name, dependsOn, factory);
        }

        public <T> ComponentRef<T> wrapped(String name, List<? extends ComponentRef<?>> dependsOn, ComponentFactory<T> factory) {
            return declare(ComponentStage.WRAPPED_OPERATION, name, dependsOn, factory);
        }

        public <T> ComponentRef<T> binding(String name, List<? extends ComponentRef<?>> dependsOn, ComponentFactory<T> factory) {
            return declare(ComponentStage.BINDING, name, dependsOn, factory);
        }

        /**
         * Declares a component at an explicit stage.
         *
         * @param stage assembly stage
         * @param name unique component name
         * @param dependsOn references to the components the factory may read
         * @param factory component factory
         * @param <T> component type
         * @return reference to the declared component
         * @throws AssemblyException if the name is already declared
         */
        public <T> ComponentRef<T> declare(
                ComponentStage stage,
                String name,
                List<? extends ComponentRef<?>> dependsOn,
                ComponentFactory<T> factory) {
            if (stage == null) {
                throw new IllegalArgumentException("stage cannot be null");
            }
            if (dependsOn == null) {
                throw new IllegalArgumentException("dependsOn cannot be null");
            }
            if (factory == null) {
                throw new IllegalArgumentException("factory cannot be null");
            }
            ComponentRef<T> ref = ComponentRef.of(name);
            if (declarations.containsKey(ref.name())) {
                throw new AssemblyException("Duplicate component name '" + name + "'", ref.name(), stage);
            }
            List<ComponentName> dependencies = new ArrayList<>();
            for (ComponentRef<?> dependency : dependsOn) {
                if (dependency == null) {
                    throw new IllegalArgumentException("dependsOn cannot contain null");
                }
                dependencies.add(dependency.name());
            }
            declarations.put(ref.name(), new Declaration<>(ref.name(), stage, List.copyOf(dependencies), factory));
            return ref;
        }

        /**
         * Reference to a component that is declared elsewhere in this builder, possibly later.
         *
         * <p>Unresolved references are reported by {@link #build()}.</p>
         *
         * @param name component name
         * @param <T> component type
         * @return reference
         */
        public <T> ComponentRef<T> ref(String name) {
            return ComponentRef.of(name);
        }

        /**
         * Validates the declarations and freezes them into a plan.
         *
         * @return immutable plan
         * @throws AssemblyException on unknown references, stage violations or cycles
         */
        public WiringPlan build() {
            for (Declaration<?> declaration : declarations.values()) {
                for (ComponentName dependency : declaration.dependencies()) {
                    Declaration<?> target = declarations.get(dependency);
                    if (target == null) {
                        throw new AssemblyException(
                            "Component '" + declaration.name() + "' depends on unknown component '" + dependency + "'",
                            declaration.name(), declaration.stage());
                    }
                    if (!declaration.stage().mayDependOn(target.stage())) {
                        throw new AssemblyException(
                            "Component '" + declaration.name() + "' (" + declaration.stage() + ") cannot depend on '"
                                + dependency + "' (" + target.stage() + ")",
                            declaration.name(), declaration.stage());
                    }
                }
            }
            return new WiringPlan(List.copyOf(topologicalOrder()));
        }

        // Depth-first post-order; declaration order breaks ties so construction order is stable.
        private List<Declaration<?>> topologicalOrder() {
            List<Declaration<?>> sorted = new ArrayList<>(declarations.size());
            Set<ComponentName> done = new HashSet<>();
            Set<ComponentName> onPath = new LinkedHashSet<>();
            for (ComponentName root : declarations.keySet()) {
                visit(root, done, onPath, sorted);
            }
            return sorted;
        }

        private void visit(ComponentName name, Set<ComponentName> done, Set<ComponentName> onPath, List<Declaration<?>> sorted) {
            if (done.contains(name)) {
                return;
            }
            Deque<ComponentName> path = new ArrayDeque<>(onPath);
            if (!onPath.add(name)) {
                path.addLast(name);
                throw new AssemblyException("Dependency cycle detected: " + cycleFrom(path, name),
                    name, declarations.get(name).stage());
            }
            Declaration<?> declaration = declarations.get(name);
            for (ComponentName dependency : declaration.dependencies()) {
                visit(dependency, done, onPath, sorted);
            }
            onPath.remove(name);
            done.add(name);
            sorted.add(declaration);
        }

        private static String cycleFrom(Deque<ComponentName> path, ComponentName start) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (ComponentName name : path) {
                if (name.equals(start)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(name.getValue());
                }
            }
            return String.join(" -> ", cycle);
        }
    }

    @Override
    public String toString() {
        return "WiringPlan" + constructionOrder();
    }
}
