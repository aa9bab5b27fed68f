package com.ryuqq.opwire.testkit.sample;

import com.ryuqq.opwire.core.context.ExecutionContext;

import java.util.Optional;

/**
 * Persistence port of the sample operation.
 *
 * <p>Implementations join the transaction found in the context when there is one.
 * Failures are reported by throwing; callers wrap each call with
 * {@link com.ryuqq.opwire.core.operation.Steps}.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public interface EntityRepository {

    boolean nameTaken(ExecutionContext ctx, String name) throws Exception;

    void save(ExecutionContext ctx, Entity entity) throws Exception;

    void indexName(ExecutionContext ctx, String name, String entityId) throws Exception;

    Optional<Entity> findById(ExecutionContext ctx, String id) throws Exception;
}
