package com.ryuqq.opwire.adapter.inmemory.id;

import com.ryuqq.opwire.core.spi.IdGenerator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic identifiers: {@code prefix-1}, {@code prefix-2}, ...
 *
 * <p>Thread-safe. Intended for tests that assert on generated ids.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class SequenceIdGenerator implements IdGenerator {

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();

    public SequenceIdGenerator(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public String nextId() {
        return prefix + "-" + sequence.incrementAndGet();
    }

    /**
     * @return number of ids handed out so far
     */
    public long issued() {
        return sequence.get();
    }
}
