package com.ryuqq.opwire.application.wiring;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WiringPlan / Assembly 테스트.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
class WiringPlanTest {

    @Test
    void assemble_SharedResource_SameInstanceForAllDependents() {
        // Given
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<Counter> counter = plan.resource("counter", deps -> new Counter());
        ComponentRef<Holder> first = plan.operation("first", List.of(counter), deps -> new Holder(deps.get(counter)));
        ComponentRef<Holder> second = plan.operation("second", List.of(counter), deps -> new Holder(deps.get(counter)));

        // When
        Assembly assembly = plan.build().assemble();

        // Then
        assertThat(assembly.get(first).counter).isSameAs(assembly.get(second).counter);
        assertThat(assembly.get(first).counter).isSameAs(assembly.get(counter));
    }

    @Test
    void assemble_EachFactoryCalledExactlyOnce() {
        // Given
        AtomicInteger constructions = new AtomicInteger();
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<Counter> counter = plan.resource("counter", deps -> {
            constructions.incrementAndGet();
            return new Counter();
        });
        plan.operation("a", List.of(counter), deps -> new Holder(deps.get(counter)));
        plan.operation("b", List.of(counter), deps -> new Holder(deps.get(counter)));

        // When
        plan.build().assemble();

        // Then
        assertThat(constructions).hasValue(1);
    }

    @Test
    void assemble_Twice_YieldsDistinctEquivalentInstances() {
        // Given
        WiringPlan.Builder builder = WiringPlan.builder();
        ComponentRef<Counter> counter = builder.resource("counter", deps -> new Counter());
        ComponentRef<Holder> holder = builder.operation("holder", List.of(counter), deps -> new Holder(deps.get(counter)));
        WiringPlan plan = builder.build();

        // When
        Assembly one = plan.assemble();
        Assembly two = plan.assemble();
        one.get(holder).counter.increment();

        // Then
        assertThat(one.get(holder)).isNotSameAs(two.get(holder));
        assertThat(one.get(counter).value).isEqualTo(1);
        assertThat(two.get(counter).value).isZero();
        assertThat(one.names()).isEqualTo(two.names());
    }

    @Test
    void assemble_ConstructsInTopologicalOrder() {
        // Given: binding declared before the operation it depends on
        List<String> constructed = new ArrayList<>();
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<String> operation = plan.ref("op");
        plan.binding("binding", List.of(operation), deps -> track(constructed, "binding"));
        ComponentRef<String> resource = plan.resource("store", deps -> track(constructed, "store"));
        plan.operation("op", List.of(resource), deps -> track(constructed, "op"));

        // When
        Assembly assembly = plan.build().assemble();

        // Then
        assertThat(constructed).containsExactly("store", "op", "binding");
        assertThat(assembly.names()).extracting(ComponentName::getValue).containsExactly("store", "op", "binding");
        assertThat(assembly.stageOf(ComponentName.of("binding"))).isEqualTo(ComponentStage.BINDING);
        assertThat(assembly.dependenciesOf(ComponentName.of("op"))).containsExactly(ComponentName.of("store"));
    }

    @Test
    void build_Cycle_RejectedBeforeConstruction() {
        // Given
        AtomicInteger constructions = new AtomicInteger();
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<Object> b = plan.ref("b");
        ComponentRef<Object> a = plan.operation("a", List.of(b), deps -> constructions.incrementAndGet());
        plan.operation("b", List.of(a), deps -> constructions.incrementAndGet());

        // When & Then
        assertThatThrownBy(plan::build)
            .isInstanceOf(AssemblyException.class)
            .hasMessageContaining("Dependency cycle detected: a -> b -> a");
        assertThat(constructions).hasValue(0);
    }

    @Test
    void build_SelfDependency_Rejected() {
        // Given
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<Object> self = plan.ref("self");
        plan.resource("self", List.of(self), deps -> new Object());

        // When & Then
        assertThatThrownBy(plan::build)
            .isInstanceOf(AssemblyException.class)
            .hasMessageContaining("cycle");
    }

    @Test
    void build_UnknownReference_Rejected() {
        // Given
        WiringPlan.Builder plan = WiringPlan.builder();
        plan.operation("op", List.of(plan.ref("missing")), deps -> new Object());

        // When & Then
        assertThatThrownBy(plan::build)
            .isInstanceOf(AssemblyException.class)
            .hasMessageContaining("unknown component 'missing'");
    }

    @Test
    void build_StageViolation_Rejected() {
        // Given: a resource may not depend on an operation
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<Object> operation = plan.operation("op", List.of(), deps -> new Object());
        plan.resource("store", List.of(operation), deps -> new Object());

        // When & Then
        assertThatThrownBy(plan::build)
            .isInstanceOf(AssemblyException.class)
            .satisfies(e -> assertThat(((AssemblyException) e).getStage()).isEqualTo(ComponentStage.RESOURCE))
            .hasMessageContaining("cannot depend on 'op'");
    }

    @Test
    void declare_DuplicateName_Rejected() {
        // Given
        WiringPlan.Builder plan = WiringPlan.builder();
        plan.resource("store", deps -> new Object());

        // When & Then
        assertThatThrownBy(() -> plan.resource("store", deps -> new Object()))
            .isInstanceOf(AssemblyException.class)
            .hasMessageContaining("Duplicate component name 'store'");
    }

    @Test
    void assemble_FactoryFailure_ClosesConstructedInReverseAndNamesComponent() {
        // Given
        List<String> closed = new ArrayList<>();
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<Closeable> first = plan.resource("first", deps -> new Closeable("first", closed));
        ComponentRef<Closeable> second = plan.resource("second", deps -> new Closeable("second", closed));
        plan.operation("broken", List.of(first, second), deps -> {
            throw new IllegalStateException("boom");
        });
        WiringPlan built = plan.build();

        // When & Then
        assertThatThrownBy(built::assemble)
            .isInstanceOf(AssemblyException.class)
            .hasMessageContaining("'broken'")
            .hasMessageContaining("OPERATION")
            .hasRootCauseMessage("boom");
        assertThat(closed).containsExactly("second", "first");
    }

    @Test
    void assemble_FactoryThrowsError_ClosesConstructedAndRethrowsUnchanged() {
        // Given
        List<String> closed = new ArrayList<>();
        OutOfMemoryError fatal = new OutOfMemoryError("heap");
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<Closeable> first = plan.resource("first", deps -> new Closeable("first", closed));
        ComponentRef<Closeable> second = plan.resource("second", deps -> new Closeable("second", closed));
        plan.operation("fatal", List.of(first, second), deps -> {
            throw fatal;
        });
        WiringPlan built = plan.build();

        // When & Then
        assertThatThrownBy(built::assemble).isSameAs(fatal);
        assertThat(closed).containsExactly("second", "first");
    }

    @Test
    void dependencies_UndeclaredLookup_Fails() {
        // Given
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<Counter> counter = plan.resource("counter", deps -> new Counter());
        plan.operation("sneaky", List.of(), deps -> new Holder(deps.get(counter)));
        WiringPlan built = plan.build();

        // When & Then
        assertThatThrownBy(built::assemble)
            .isInstanceOf(AssemblyException.class)
            .hasMessageContaining("sneaky");
    }

    @Test
    void close_ClosesInReverseOrderOnce() {
        // Given
        List<String> closed = new ArrayList<>();
        WiringPlan.Builder plan = WiringPlan.builder();
        ComponentRef<Closeable> store = plan.resource("store", deps -> new Closeable("store", closed));
        plan.binding("binding", List.of(store), deps -> new Closeable("binding", closed));
        Assembly assembly = plan.build().assemble();

        // When
        assembly.close();
        assembly.close();

        // Then
        assertThat(closed).containsExactly("binding", "store");
        assertThat(assembly.isClosed()).isTrue();
    }

    @Test
    void componentName_InvalidCharacters_Rejected() {
        assertThatThrownBy(() -> ComponentName.of("bad name"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("invalid characters");
    }

    private static String track(List<String> constructed, String name) {
        constructed.add(name);
        return name;
    }

    static final class Counter {
        int value;

        void increment() {
            value++;
        }
    }

    static final class Holder {
        final Counter counter;

        Holder(Counter counter) {
            this.counter = counter;
        }
    }

    static final class Closeable implements AutoCloseable {
        private final String name;
        private final List<String> closed;

        Closeable(String name, List<String> closed) {
            this.name = name;
            this.closed = closed;
        }

        @Override
        public void close() {
            closed.add(name);
        }
    }
}
