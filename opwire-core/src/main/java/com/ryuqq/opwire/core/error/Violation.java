package com.ryuqq.opwire.core.error;

/**
 * 단일 입력 검증 위반.
 *
 * @param field 위반이 발생한 필드 이름
 * @param message 위반 내용
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record Violation(String field, String message) {

    public Violation {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Violation of(String field, String message) {
        return new Violation(field, message);
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
