package com.ryuqq.opwire.core.error;

/**
 * Operation 실패 시 반환되는 오류 값.
 *
 * <p>오류는 예외가 아니라 값으로 전달됩니다. 예외는 복구 불가능한 결함(fault)에만 사용합니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link ValidationError}: 입력 검증 실패</li>
 *   <li>{@link BusinessRuleError}: 비즈니스 규칙 위반</li>
 *   <li>{@link AuthorizationError}: 권한 없음</li>
 *   <li>{@link DependencyError}: 의존성 실패 (원인 보존)</li>
 *   <li>{@link CancellationError}: 취소 또는 데드라인 초과</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public sealed interface OperationError
    permits ValidationError, BusinessRuleError, AuthorizationError, DependencyError, CancellationError {

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    ErrorCategory category();

    /**
     * 오류 메시지 조회.
     *
     * @return 사람이 읽을 수 있는 메시지
     */
    String message();
}
