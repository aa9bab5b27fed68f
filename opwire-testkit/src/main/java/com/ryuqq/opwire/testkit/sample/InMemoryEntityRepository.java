package com.ryuqq.opwire.testkit.sample;

import com.ryuqq.opwire.adapter.inmemory.store.InMemoryKeyValueStore;
import com.ryuqq.opwire.adapter.inmemory.store.InMemoryTransaction;
import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.transaction.Transactions;

import java.util.Optional;

/**
 * {@link EntityRepository} over an {@link InMemoryKeyValueStore}.
 *
 * <p>Entities live under {@code entity:<id>}, the name index under {@code name:<name>}.
 * Inside a transaction all reads and writes go through the context's handle; outside one,
 * each write is committed on its own.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public class InMemoryEntityRepository implements EntityRepository {

    static final String ENTITY_PREFIX = "entity:";
    static final String NAME_PREFIX = "name:";

    private final InMemoryKeyValueStore<Entity> store;

    public InMemoryEntityRepository(InMemoryKeyValueStore<Entity> store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public boolean nameTaken(ExecutionContext ctx, String name) {
        return read(ctx, NAME_PREFIX + name).isPresent();
    }

    @Override
    public void save(ExecutionContext ctx, Entity entity) {
        write(ctx, ENTITY_PREFIX + entity.id(), entity);
    }

    @Override
    public void indexName(ExecutionContext ctx, String name, String entityId) {
        Entity entity = read(ctx, ENTITY_PREFIX + entityId)
            .orElseThrow(() -> new IllegalStateException("Entity " + entityId + " must be saved before indexing"));
        write(ctx, NAME_PREFIX + name, entity);
    }

    @Override
    public Optional<Entity> findById(ExecutionContext ctx, String id) {
        return read(ctx, ENTITY_PREFIX + id);
    }

    public InMemoryKeyValueStore<Entity> getStore() {
        return store;
    }

    private Optional<Entity> read(ExecutionContext ctx, String key) {
        Optional<InMemoryTransaction<Entity>> tx = Transactions.current(ctx, store);
        return tx.isPresent() ? tx.get().get(key) : store.get(key);
    }

    private void write(ExecutionContext ctx, String key, Entity value) {
        Optional<InMemoryTransaction<Entity>> tx = Transactions.current(ctx, store);
        if (tx.isPresent()) {
            tx.get().put(key, value);
            return;
        }
        InMemoryTransaction<Entity> autoCommit = store.begin();
        autoCommit.put(key, value);
        autoCommit.commit();
    }
}
