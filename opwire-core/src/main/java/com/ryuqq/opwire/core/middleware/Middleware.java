package com.ryuqq.opwire.core.middleware;

import com.ryuqq.opwire.core.operation.Operation;

/**
 * Operation을 감싸 횡단 관심사를 추가하는 변환.
 *
 * <p>{@code wrap(operation) → operation'}. 감싼 결과는 같은 요청/응답 타입을 가지며
 * 외부 계약(허용 요청, 생성 응답, 성공의 의미)은 변하지 않습니다. 내부 Operation이
 * <em>언제</em>, <em>몇 번</em>, <em>어떤 리소스 아래에서</em> 실행되는지만 달라질 수 있습니다.</p>
 *
 * <p>합성은 결합법칙을 만족하지만 교환법칙은 만족하지 않습니다. 순서는
 * {@link MiddlewareStack}으로 명시적으로 구성합니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Middleware<Q, R> {

    /**
     * Operation 감싸기.
     *
     * @param inner 내부 Operation
     * @return 동작이 추가된 Operation
     */
    Operation<Q, R> wrap(Operation<Q, R> inner);

    /**
     * 미들웨어 종류. 정규 순서 검사에 사용됩니다.
     *
     * @return 종류 (기본값 CUSTOM)
     */
    default MiddlewareKind kind() {
        return MiddlewareKind.CUSTOM;
    }
}
