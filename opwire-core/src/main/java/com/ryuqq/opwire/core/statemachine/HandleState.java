package com.ryuqq.opwire.core.statemachine;

/**
 * 트랜잭션 핸들의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>OPEN → COMMITTED</li>
 *   <li>OPEN → ROLLED_BACK</li>
 *   <li>종료 동작(commit 또는 rollback)은 핸들당 정확히 한 번</li>
 * </ul>
 *
 * <pre>
 * OPEN
 *    │
 *    ├─► COMMITTED
 *    │
 *    └─► ROLLED_BACK
 *
 * 금지된 전이:
 * - COMMITTED → ROLLED_BACK ❌
 * - ROLLED_BACK → COMMITTED ❌
 * - 종료 상태 → OPEN ❌
 * </pre>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public enum HandleState {

    /**
     * 열림 (작업 단위 진행 중).
     */
    OPEN,

    /**
     * 커밋됨.
     */
    COMMITTED,

    /**
     * 롤백됨.
     */
    ROLLED_BACK;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMMITTED 또는 ROLLED_BACK인 경우 true
     */
    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK;
    }
}
