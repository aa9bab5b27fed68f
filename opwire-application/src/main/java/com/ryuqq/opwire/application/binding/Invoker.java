package com.ryuqq.opwire.application.binding;

/**
 * 프런트엔드 바인딩 계약.
 *
 * <p>프로토콜 어댑터(HTTP 핸들러, 메시지 컨슈머, 스케줄러)는 유스케이스마다
 * 하나의 Invoker를 받아 요청을 전달합니다. Invoker는 요청마다
 * {@link com.ryuqq.opwire.core.context.RequestScope}를 열고, 감싼 Operation을 실행한 뒤
 * 스코프를 닫습니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public interface Invoker<Q, R> {

    /**
     * 요청을 실행하고 결과를 반환.
     *
     * <p>timeBudgetMs는 요청 스코프의 데드라인이 됩니다. 데드라인이 지나면
     * 이후의 의존성 호출은 취소 오류로 끝납니다 (협력적 취소).</p>
     *
     * @param request 요청
     * @param timeBudgetMs 시간 예산 (밀리초)
     * @return 실행 결과
     * @throws IllegalArgumentException request가 null이거나 timeBudgetMs가 허용 범위를 벗어난 경우
     */
    Reply<R> invoke(Q request, long timeBudgetMs);
}
