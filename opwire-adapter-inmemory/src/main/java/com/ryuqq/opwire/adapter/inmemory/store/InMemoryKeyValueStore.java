package com.ryuqq.opwire.adapter.inmemory.store;

import com.ryuqq.opwire.core.context.ContextKey;
import com.ryuqq.opwire.core.spi.TransactionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Transactional in-memory key/value store for testing and reference purposes.
 *
 * <p>Committed data is held in an immutable snapshot that is replaced on every commit
 * (copy-on-write), so readers never observe a partially applied transaction.</p>
 *
 * <p><strong>Transaction Semantics:</strong></p>
 * <ul>
 *   <li>Writes are buffered in the {@link InMemoryTransaction} until commit</li>
 *   <li>Commit applies all buffered writes atomically (serialised across transactions)</li>
 *   <li>Rollback discards the buffer; committed data is untouched</li>
 *   <li>Last committer wins; there is no conflict detection</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Each commit copies the whole map; not suitable for large data sets</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryKeyValueStore&lt;Entity&gt; store = new InMemoryKeyValueStore&lt;&gt;("entities");
 * InMemoryTransaction&lt;Entity&gt; tx = store.begin();
 * tx.put("entity-1", entity);
 * tx.commit();
 * store.get("entity-1"); // Optional[entity]
 * </pre>
 *
 * @param <V> value type
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public class InMemoryKeyValueStore<V> implements TransactionProvider<InMemoryTransaction<V>>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private final String name;
    private final ContextKey<InMemoryTransaction<V>> contextKey;
    private final Object commitLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong commits = new AtomicLong();
    private final AtomicLong rollbacks = new AtomicLong();

    /**
     * Committed data. Replaced, never mutated.
     */
    private volatile Map<String, V> committed = Collections.emptyMap();

    /**
     * Creates an empty store.
     *
     * @param name store name, used for its context key and in log messages
     */
    public InMemoryKeyValueStore(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.contextKey = ContextKey.named("kv-store:" + name);
    }

    @Override
    public ContextKey<InMemoryTransaction<V>> contextKey() {
        return contextKey;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the store has been closed
     */
    @Override
    public InMemoryTransaction<V> begin() {
        if (closed.get()) {
            throw new IllegalStateException("Store '" + name + "' is closed");
        }
        return new InMemoryTransaction<>(this);
    }

    /**
     * Reads committed data only.
     *
     * @param key key
     * @return committed value, or empty if absent
     */
    public Optional<V> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(committed.get(key));
    }

    public boolean containsKey(String key) {
        return get(key).isPresent();
    }

    /**
     * @return immutable view of the committed data at the time of the call
     */
    public Map<String, V> snapshot() {
        return committed;
    }

    public int size() {
        return committed.size();
    }

    public long getCommitCount() {
        return commits.get();
    }

    public long getRollbackCount() {
        return rollbacks.get();
    }

    public String getName() {
        return name;
    }

    /**
     * Rejects new transactions. Committed data stays readable.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Closed store '{}' with {} entries", name, committed.size());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Applies buffered writes. An empty Optional marks a removal.
     */
    void apply(Map<String, Optional<V>> writes) {
        synchronized (commitLock) {
            Map<String, V> next = new HashMap<>(committed);
            writes.forEach((key, value) -> {
                if (value.isPresent()) {
                    next.put(key, value.get());
                } else {
                    next.remove(key);
                }
            });
            committed = Collections.unmodifiableMap(next);
        }
        commits.incrementAndGet();
        log.debug("Committed {} writes to store '{}'", writes.size(), name);
    }

    void discarded(int pendingWrites) {
        rollbacks.incrementAndGet();
        log.debug("Rolled back {} pending writes on store '{}'", pendingWrites, name);
    }
}
