package com.ryuqq.opwire.core.error;

/**
 * 권한 없음.
 *
 * @param reason 거부 사유
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record AuthorizationError(String reason) implements OperationError {

    public AuthorizationError {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    public static AuthorizationError of(String reason) {
        return new AuthorizationError(reason);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.AUTHORIZATION;
    }

    @Override
    public String message() {
        return reason;
    }
}
