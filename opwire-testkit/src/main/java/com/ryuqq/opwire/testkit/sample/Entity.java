package com.ryuqq.opwire.testkit.sample;

import java.time.Instant;

/**
 * Sample domain entity.
 *
 * @param id generated identifier
 * @param name unique display name
 * @param createdAt creation time, taken from the injected time source
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record Entity(String id, String name, Instant createdAt) {

    public Entity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }
}
