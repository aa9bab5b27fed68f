package com.ryuqq.opwire.core.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DependencyError 및 오류 분류 테스트.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
class DependencyErrorTest {

    @Test
    void at_TransientDependencyException_IsRetryable() {
        // Given
        DependencyException cause = DependencyException.transientFailure("connection reset");

        // When
        DependencyError error = DependencyError.at("store.put", cause);

        // Then
        assertTrue(error.retryable());
        assertEquals("store.put", error.step());
        assertEquals("connection reset", error.message());
        assertSame(cause, error.cause());
        assertEquals(ErrorCategory.DEPENDENCY, error.category());
    }

    @Test
    void at_PermanentDependencyException_IsNotRetryable() {
        // When
        DependencyError error = DependencyError.at("store.put", DependencyException.permanentFailure("schema mismatch"));

        // Then
        assertFalse(error.retryable());
    }

    @Test
    void at_ExceptionWithoutMarker_IsNotRetryable() {
        // When
        DependencyError error = DependencyError.at("file.read", new IOException("disk full"));

        // Then
        assertFalse(error.retryable());
        assertEquals("disk full", error.message());
    }

    @Test
    void at_ExceptionWithoutMessage_UsesClassName() {
        // When
        DependencyError error = DependencyError.at("file.read", new IllegalStateException());

        // Then
        assertEquals("IllegalStateException", error.message());
    }

    @Test
    void withStep_PrefixesOuterStep() {
        // Given
        DependencyError inner = DependencyError.of("index.put", "timeout", true);

        // When
        DependencyError outer = inner.withStep("create-entity");

        // Then
        assertEquals("create-entity/index.put", outer.step());
        assertEquals("timeout", outer.message());
        assertTrue(outer.retryable());
    }

    @Test
    void constructor_BlankStep_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DependencyError.of(" ", "message", false)
        );
        assertTrue(exception.getMessage().contains("step cannot be null or blank"));
    }

    @Test
    void category_ClientFaultClassification() {
        // Then
        assertTrue(ErrorCategory.VALIDATION.isClientFault());
        assertTrue(ErrorCategory.BUSINESS_RULE.isClientFault());
        assertTrue(ErrorCategory.AUTHORIZATION.isClientFault());
        assertFalse(ErrorCategory.DEPENDENCY.isClientFault());
        assertFalse(ErrorCategory.CANCELLED.isClientFault());
    }

    @Test
    void validationError_MessageJoinsViolations() {
        // Given
        ValidationError error = new ValidationError(java.util.List.of(
            Violation.of("name", "must not be blank"),
            Violation.of("size", "must be positive")
        ));

        // Then
        assertEquals("name: must not be blank; size: must be positive", error.message());
        assertEquals(2, error.violations().size());
    }
}
