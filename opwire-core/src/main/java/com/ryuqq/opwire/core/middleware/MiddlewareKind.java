package com.ryuqq.opwire.core.middleware;

/**
 * 미들웨어 종류와 정규 순서.
 *
 * <p>선언 순서가 바깥쪽(outermost)에서 안쪽(innermost) 방향의 정규 순서입니다.</p>
 *
 * <ol>
 *   <li>LOGGING: 안쪽 계층의 실패까지 모두 관찰해야 하므로 가장 바깥</li>
 *   <li>TIMING</li>
 *   <li>DEADLINE: 모든 재시도를 포함한 전체 호출을 하나의 데드라인으로 제한</li>
 *   <li>AUTHORIZATION: 리소스를 쓰기 전에 거부</li>
 *   <li>VALIDATION</li>
 *   <li>RETRY: 안쪽 전체(새 트랜잭션 포함)를 시도마다 다시 실행</li>
 *   <li>TRANSACTION: 원자적이어야 하는 가장 작은 단위이므로 가장 안쪽</li>
 * </ol>
 *
 * <p>순서를 어겨도 오류는 아니지만 의미가 조용히 바뀝니다
 * (예: TRANSACTION이 RETRY 바깥에 있으면 모든 재시도가 하나의 트랜잭션을 공유).</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public enum MiddlewareKind {

    LOGGING,

    TIMING,

    DEADLINE,

    AUTHORIZATION,

    VALIDATION,

    RETRY,

    TRANSACTION,

    /**
     * 사용자 정의 미들웨어. 정규 순서 검사에서 제외됩니다.
     */
    CUSTOM;

    /**
     * 정규 순서 검사 대상인지 확인.
     *
     * @return CUSTOM이 아니면 true
     */
    public boolean isOrdered() {
        return this != CUSTOM;
    }
}
