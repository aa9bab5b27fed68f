package com.ryuqq.opwire.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 입력 검증 실패.
 *
 * <p>의존성 호출 전에 감지되므로 부수 효과가 없으며, 재시도 대상이 아닙니다.</p>
 *
 * @param violations 위반 목록 (1개 이상)
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record ValidationError(List<Violation> violations) implements OperationError {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException violations가 null이거나 비어 있는 경우
     */
    public ValidationError {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations cannot be null or empty");
        }
        violations = List.copyOf(violations);
    }

    /**
     * 단일 위반으로 ValidationError 생성.
     *
     * @param field 필드 이름
     * @param message 위반 내용
     * @return ValidationError 인스턴스
     */
    public static ValidationError of(String field, String message) {
        return new ValidationError(List.of(Violation.of(field, message)));
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.VALIDATION;
    }

    @Override
    public String message() {
        return violations.stream()
            .map(Violation::toString)
            .collect(Collectors.joining("; "));
    }
}
