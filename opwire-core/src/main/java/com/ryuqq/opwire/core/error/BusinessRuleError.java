package com.ryuqq.opwire.core.error;

/**
 * 비즈니스 규칙 위반.
 *
 * <p>도메인 상태를 읽은 뒤 전제 조건이 충족되지 않음을 확인한 경우입니다
 * (예: 이름 중복, 잔액 부족). 재시도해도 결과가 바뀌지 않으므로 재시도하지 않습니다.</p>
 *
 * @param code 오류 코드 (예: ENTITY-409)
 * @param message 오류 메시지
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record BusinessRuleError(String code, String message) implements OperationError {

    public BusinessRuleError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static BusinessRuleError of(String code, String message) {
        return new BusinessRuleError(code, message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.BUSINESS_RULE;
    }
}
