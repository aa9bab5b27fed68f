package com.ryuqq.opwire.core.outcome;

import com.ryuqq.opwire.core.error.BusinessRuleError;
import com.ryuqq.opwire.core.error.ErrorCategory;
import com.ryuqq.opwire.core.error.ValidationError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome sealed interface 테스트.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_ValidResponse_CreatesOk() {
        // When
        Outcome<String> outcome = Outcome.ok("created");

        // Then
        assertTrue(outcome.isOk());
        assertFalse(outcome.isFail());
        assertEquals("created", outcome.getResponseOrNull());
        assertNull(outcome.getErrorOrNull());
    }

    @Test
    void ok_NullResponse_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Outcome.ok(null)
        );
        assertTrue(exception.getMessage().contains("response cannot be null"));
    }

    @Test
    void fail_ValidError_CreatesFail() {
        // Given
        ValidationError error = ValidationError.of("name", "must not be blank");

        // When
        Outcome<String> outcome = Outcome.fail(error);

        // Then
        assertTrue(outcome.isFail());
        assertNull(outcome.getResponseOrNull());
        assertSame(error, outcome.getErrorOrNull());
        assertEquals(ErrorCategory.VALIDATION, outcome.getErrorOrNull().category());
    }

    @Test
    void fail_NullError_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Outcome.fail(null));
    }

    @Test
    void map_OnOk_TransformsResponse() {
        // When
        Outcome<Integer> mapped = Outcome.ok("abc").map(String::length);

        // Then
        assertEquals(3, mapped.getResponseOrNull());
    }

    @Test
    void map_OnFail_KeepsErrorAndSkipsMapper() {
        // Given
        BusinessRuleError error = BusinessRuleError.of("DUPLICATE_NAME", "name already taken");
        Outcome<String> failed = Outcome.fail(error);

        // When
        Outcome<Integer> mapped = failed.map(value -> {
            throw new AssertionError("mapper must not run");
        });

        // Then
        assertTrue(mapped.isFail());
        assertSame(error, mapped.getErrorOrNull());
    }

    @Test
    void flatMap_ChainsUntilFirstFailure() {
        // Given
        BusinessRuleError error = BusinessRuleError.of("LIMIT", "limit reached");

        // When
        Outcome<String> result = Outcome.ok(1)
            .flatMap(n -> Outcome.<Integer>ok(n + 1))
            .flatMap(n -> Outcome.<Integer>fail(error))
            .flatMap(n -> Outcome.ok("unreachable " + n));

        // Then
        assertTrue(result.isFail());
        assertSame(error, result.getErrorOrNull());
    }

    @Test
    void recast_PreservesError() {
        // Given
        Fail<String> fail = new Fail<>(ValidationError.of("id", "required"));

        // When
        Fail<Long> recast = fail.recast();

        // Then
        assertEquals(fail.error(), recast.error());
    }
}
