package com.ryuqq.opwire.core.statemachine;

/**
 * 외부 요청(RequestScope)의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>CREATED → COMPLETED (정상 종료)</li>
 *   <li>CREATED → CANCELLED (명시적 취소)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p>리소스 부착(attach)은 상태 전이가 아닙니다. 부착은 새 컨텍스트 값을 만들 뿐
 * 요청 상태를 바꾸지 않습니다.</p>
 *
 * <pre>
 * CREATED
 *    │
 *    ├─► COMPLETED
 *    │
 *    └─► CANCELLED
 * </pre>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public enum RequestState {

    /**
     * 생성됨 (처리 중).
     */
    CREATED,

    /**
     * 정상 종료.
     */
    COMPLETED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
