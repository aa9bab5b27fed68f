package com.ryuqq.opwire.adapter.inmemory.id;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the in-memory id generators.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
class IdGeneratorTest {

    @Test
    void sequence_IsDeterministic() {
        // Given
        SequenceIdGenerator ids = new SequenceIdGenerator("entity");

        // Then
        assertThat(ids.nextId()).isEqualTo("entity-1");
        assertThat(ids.nextId()).isEqualTo("entity-2");
        assertThat(ids.issued()).isEqualTo(2);
    }

    @Test
    void sequence_BlankPrefix_ThrowsException() {
        assertThatThrownBy(() -> new SequenceIdGenerator(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("prefix cannot be null or blank");
    }

    @Test
    void uuid_GeneratesDistinctIds() {
        // Given
        UuidIdGenerator ids = new UuidIdGenerator();
        Set<String> seen = new HashSet<>();

        // When
        for (int i = 0; i < 100; i++) {
            seen.add(ids.nextId());
        }

        // Then
        assertThat(seen).hasSize(100);
    }
}
