package com.ryuqq.opwire.testkit.sample;

/**
 * Request of {@link CreateEntity}. The name is validated by the operation, not here.
 *
 * @param name requested entity name, may be null or blank
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record CreateEntityRequest(String name) {

    public static CreateEntityRequest named(String name) {
        return new CreateEntityRequest(name);
    }
}
