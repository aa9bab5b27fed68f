package com.ryuqq.opwire.testkit.sample;

import com.ryuqq.opwire.adapter.inmemory.id.SequenceIdGenerator;
import com.ryuqq.opwire.adapter.inmemory.store.InMemoryKeyValueStore;
import com.ryuqq.opwire.adapter.inmemory.store.InMemoryTransaction;
import com.ryuqq.opwire.adapter.inmemory.time.ManualTimeSource;
import com.ryuqq.opwire.adapter.runner.InlineInvoker;
import com.ryuqq.opwire.application.wiring.ComponentRef;
import com.ryuqq.opwire.application.wiring.WiringPlan;
import com.ryuqq.opwire.core.middleware.MiddlewareStack;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.middleware.AuthorizationMiddleware;
import com.ryuqq.opwire.middleware.DeadlineMiddleware;
import com.ryuqq.opwire.middleware.LoggingMiddleware;
import com.ryuqq.opwire.middleware.RetryMiddleware;
import com.ryuqq.opwire.middleware.RetryPolicy;
import com.ryuqq.opwire.middleware.TimingMiddleware;
import com.ryuqq.opwire.middleware.TransactionMiddleware;
import com.ryuqq.opwire.middleware.ValidationMiddleware;
import com.ryuqq.opwire.testkit.recording.RecordingTimingRecorder;

import java.time.Duration;
import java.util.List;

/**
 * Wiring plan of the sample application: one store, one operation, the full middleware
 * stack and an inline binding.
 *
 * <pre>
 * time, ids, request-ids, entity-store, timing   (RESOURCE)
 *   entity-repository                            (RESOURCE)
 *     create-entity                              (OPERATION)
 *       create-entity.wrapped                    (WRAPPED_OPERATION)
 *         create-entity.inline                   (BINDING)
 * </pre>
 *
 * <p>Every resource is deterministic: time is a {@link ManualTimeSource}, ids come from a
 * {@link SequenceIdGenerator} and retry delays advance the manual clock instead of sleeping.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class SampleWiring {

    public static final String OPERATION_NAME = "create-entity";

    private final WiringPlan plan;
    private final ComponentRef<ManualTimeSource> time;
    private final ComponentRef<SequenceIdGenerator> ids;
    private final ComponentRef<SequenceIdGenerator> requestIds;
    private final ComponentRef<InMemoryKeyValueStore<Entity>> store;
    private final ComponentRef<RecordingTimingRecorder> timing;
    private final ComponentRef<EntityRepository> repository;
    private final ComponentRef<Operation<CreateEntityRequest, Entity>> operation;
    private final ComponentRef<Operation<CreateEntityRequest, Entity>> wrapped;
    private final ComponentRef<InlineInvoker<CreateEntityRequest, Entity>> inline;

    private SampleWiring(RetryPolicy retryPolicy, Duration deadline, String caller) {
        WiringPlan.Builder builder = WiringPlan.builder();

        time = builder.resource("time", deps -> new ManualTimeSource());
        ids = builder.resource("ids", deps -> new SequenceIdGenerator("entity"));
        requestIds = builder.resource("request-ids", deps -> new SequenceIdGenerator("req"));
        store = builder.resource("entity-store", deps -> new InMemoryKeyValueStore<>("entities"));
        timing = builder.resource("timing", deps -> new RecordingTimingRecorder());
        repository = builder.resource("entity-repository", List.of(store),
            deps -> new InMemoryEntityRepository(deps.get(store)));

        operation = builder.operation(OPERATION_NAME, List.of(repository, ids, time),
            deps -> new CreateEntity(deps.get(repository), deps.get(ids), deps.get(time)));

        wrapped = builder.wrapped(OPERATION_NAME + ".wrapped", List.of(operation, store, timing, time), deps -> {
            ManualTimeSource clock = deps.get(time);
            MiddlewareStack<CreateEntityRequest, Entity> stack = MiddlewareStack.<CreateEntityRequest, Entity>of(
                LoggingMiddleware.create(OPERATION_NAME, clock),
                TimingMiddleware.create(OPERATION_NAME, deps.get(timing), clock),
                DeadlineMiddleware.create(deadline, clock),
                AuthorizationMiddleware.create(new CallerAuthorizer<>()),
                ValidationMiddleware.create(new CreateEntityValidator()),
                RetryMiddleware.create(retryPolicy, clock.sleeper()),
                TransactionMiddleware.<CreateEntityRequest, Entity, InMemoryTransaction<Entity>>create(deps.get(store))
            );
            return stack.apply(deps.get(operation));
        });

        inline = builder.binding(OPERATION_NAME + ".inline", List.of(wrapped, requestIds, time),
            deps -> new InlineInvoker<>(deps.get(wrapped), deps.get(requestIds), deps.get(time),
                ctx -> ctx.with(CallerAuthorizer.CALLER, caller)));

        plan = builder.build();
    }

    public static SampleWiring create() {
        return create(new RetryPolicy(3, 100, 2000, 0.0), Duration.ofSeconds(5), "sample-client");
    }

    public static SampleWiring create(RetryPolicy retryPolicy, Duration deadline, String caller) {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("caller cannot be null or blank");
        }
        return new SampleWiring(retryPolicy, deadline, caller);
    }

    public WiringPlan plan() {
        return plan;
    }

    public ComponentRef<ManualTimeSource> time() {
        return time;
    }

    public ComponentRef<SequenceIdGenerator> ids() {
        return ids;
    }

    public ComponentRef<SequenceIdGenerator> requestIds() {
        return requestIds;
    }

    public ComponentRef<InMemoryKeyValueStore<Entity>> store() {
        return store;
    }

    public ComponentRef<RecordingTimingRecorder> timing() {
        return timing;
    }

    public ComponentRef<EntityRepository> repository() {
        return repository;
    }

    public ComponentRef<Operation<CreateEntityRequest, Entity>> operation() {
        return operation;
    }

    public ComponentRef<Operation<CreateEntityRequest, Entity>> wrapped() {
        return wrapped;
    }

    public ComponentRef<InlineInvoker<CreateEntityRequest, Entity>> inline() {
        return inline;
    }
}
