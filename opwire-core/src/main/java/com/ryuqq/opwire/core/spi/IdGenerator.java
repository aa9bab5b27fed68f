package com.ryuqq.opwire.core.spi;

/**
 * Identifier provider SPI.
 *
 * <p>Operations obtain new identifiers from an injected IdGenerator instead of calling
 * {@code UUID.randomUUID()} inline.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent callers must never receive the same identifier</li>
 *   <li>Returned values are non-null and non-blank</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Generates a new identifier.
     *
     * @return a new unique identifier
     */
    String nextId();
}
