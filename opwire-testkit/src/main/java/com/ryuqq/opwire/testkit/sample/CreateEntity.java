package com.ryuqq.opwire.testkit.sample;

import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.error.BusinessRuleError;
import com.ryuqq.opwire.core.error.ValidationError;
import com.ryuqq.opwire.core.error.Violation;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.operation.Steps;
import com.ryuqq.opwire.core.outcome.Done;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.spi.IdGenerator;
import com.ryuqq.opwire.core.spi.TimeSource;

import java.util.List;

/**
 * Sample operation: create a uniquely named entity.
 *
 * <ol>
 *   <li>Validate the request; invalid requests never reach a dependency</li>
 *   <li>Reject a name that is already taken ({@code DUPLICATE_NAME})</li>
 *   <li>Write the entity, then the name index</li>
 * </ol>
 *
 * <p>The two writes are only atomic when the operation is wrapped in the transaction
 * middleware for the repository's store.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class CreateEntity implements Operation<CreateEntityRequest, Entity> {

    public static final String DUPLICATE_NAME = "DUPLICATE_NAME";

    private final EntityRepository repository;
    private final IdGenerator idGenerator;
    private final TimeSource timeSource;
    private final CreateEntityValidator validator = new CreateEntityValidator();

    public CreateEntity(EntityRepository repository, IdGenerator idGenerator, TimeSource timeSource) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.timeSource = timeSource;
    }

    @Override
    public Outcome<Entity> invoke(ExecutionContext ctx, CreateEntityRequest request) {
        List<Violation> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            return Outcome.fail(new ValidationError(violations));
        }
        String name = request.name();

        Outcome<Boolean> taken = Steps.call(ctx, "entity.name-taken", () -> repository.nameTaken(ctx, name));
        if (taken.isFail()) {
            return Outcome.fail(taken.getErrorOrNull());
        }
        if (taken.getResponseOrNull()) {
            return Outcome.fail(BusinessRuleError.of(DUPLICATE_NAME, "name '" + name + "' is already taken"));
        }

        Entity entity = new Entity(idGenerator.nextId(), name, timeSource.now());

        Outcome<Done> saved = Steps.run(ctx, "entity.save", () -> repository.save(ctx, entity));
        if (saved.isFail()) {
            return Outcome.fail(saved.getErrorOrNull());
        }
        Outcome<Done> indexed = Steps.run(ctx, "entity.index-name", () -> repository.indexName(ctx, name, entity.id()));
        if (indexed.isFail()) {
            return Outcome.fail(indexed.getErrorOrNull());
        }
        return Outcome.ok(entity);
    }
}
