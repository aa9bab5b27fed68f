package com.ryuqq.opwire.adapter.inmemory.store;

import com.ryuqq.opwire.core.transaction.AbstractTransactionHandle;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One unit of work against an {@link InMemoryKeyValueStore}.
 *
 * <p>Reads see this transaction's own pending writes first, then committed data.
 * Writes after commit or rollback throw {@link IllegalStateException}.</p>
 *
 * @param <V> value type
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class InMemoryTransaction<V> extends AbstractTransactionHandle {

    private final InMemoryKeyValueStore<V> store;
    private final Map<String, Optional<V>> pending = new LinkedHashMap<>();

    InMemoryTransaction(InMemoryKeyValueStore<V> store) {
        this.store = store;
    }

    public synchronized void put(String key, V value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        ensureOpen();
        pending.put(key, Optional.of(value));
    }

    public synchronized void remove(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        ensureOpen();
        pending.put(key, Optional.empty());
    }

    public synchronized Optional<V> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Optional<V> own = pending.get(key);
        if (own != null) {
            return own;
        }
        return store.get(key);
    }

    public boolean containsKey(String key) {
        return get(key).isPresent();
    }

    public synchronized int pendingWrites() {
        return pending.size();
    }

    @Override
    protected synchronized void doCommit() {
        store.apply(Map.copyOf(pending));
        pending.clear();
    }

    @Override
    protected synchronized void doRollback() {
        int discarded = pending.size();
        pending.clear();
        store.discarded(discarded);
    }
}
