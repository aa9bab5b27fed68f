package com.ryuqq.opwire.adapter.inmemory.id;

import com.ryuqq.opwire.core.spi.IdGenerator;

import java.util.UUID;

/**
 * Random UUID identifiers.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class UuidIdGenerator implements IdGenerator {

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
