package com.ryuqq.opwire.core.error;

/**
 * 요청 처리 중 발생하는 오류의 분류.
 *
 * <p><strong>분류 기준:</strong></p>
 * <ul>
 *   <li>VALIDATION: 잘못된 입력. 의존성 호출 전에 감지되며 재시도하지 않음</li>
 *   <li>BUSINESS_RULE: 도메인 상태에 대한 전제 조건 불만족 (예: 유일성 위반). 재시도하지 않음</li>
 *   <li>AUTHORIZATION: 호출자에게 권한 없음. 재시도하지 않음</li>
 *   <li>DEPENDENCY: 주입된 의존성(저장소, 외부 서비스) 실패. 일시적 실패로 분류된 경우에만 재시도 가능</li>
 *   <li>CANCELLED: 취소 또는 데드라인 초과</li>
 * </ul>
 *
 * <p>조립(wiring) 실패는 요청 처리 중 오류가 아니므로 여기에 포함되지 않습니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    VALIDATION,

    BUSINESS_RULE,

    AUTHORIZATION,

    DEPENDENCY,

    CANCELLED;

    /**
     * 호출자 측 잘못으로 인한 오류인지 확인.
     *
     * @return VALIDATION, BUSINESS_RULE, AUTHORIZATION인 경우 true
     */
    public boolean isClientFault() {
        return this == VALIDATION || this == BUSINESS_RULE || this == AUTHORIZATION;
    }
}
