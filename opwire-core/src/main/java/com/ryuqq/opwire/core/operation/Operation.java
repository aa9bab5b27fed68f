package com.ryuqq.opwire.core.operation;

import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.outcome.Outcome;

/**
 * 모든 작업 단위가 구현하는 균일한 타입 함수.
 *
 * <p>{@code (실행 컨텍스트, 요청) → (응답, 오류)}. 결과는 {@link Outcome}으로 반환되며
 * 응답과 오류 중 정확히 하나만 의미를 가집니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>부수 효과(외부 시스템 읽기/쓰기)는 생성 시 주입된 의존성을 통해서만 수행</li>
 *   <li>시간, 난수, 식별자 등 비결정적 값은 주입된 의존성에서만 획득 (전역 상태 읽기 금지)</li>
 *   <li>요청 형태 및 전제 조건 검증은 의존성 호출 전에 수행 (실패 시 부수 효과 없음)</li>
 *   <li>검증/비즈니스 규칙 실패는 의존성 실패와 구별되는 오류로 보고</li>
 *   <li>생성 후 변경되지 않으며, 의존성이 thread-safe하면 동시 호출에 안전</li>
 * </ul>
 *
 * <p><strong>결정성:</strong> 같은 컨텍스트 내용, 같은 요청, 같은 의존성 동작이 주어지면
 * 항상 같은 결과를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Operation&lt;CreateEntityRequest, Entity&gt; createEntity = new CreateEntity(ids, time, repository);
 * Outcome&lt;Entity&gt; outcome = createEntity.invoke(ctx, new CreateEntityRequest("alpha"));
 * </pre>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation<Q, R> {

    /**
     * Operation 실행.
     *
     * @param ctx 실행 컨텍스트 (취소 신호와 부착된 리소스 포함)
     * @param request 요청
     * @return 성공 시 {@link com.ryuqq.opwire.core.outcome.Ok}, 실패 시 {@link com.ryuqq.opwire.core.outcome.Fail}
     */
    Outcome<R> invoke(ExecutionContext ctx, Q request);
}
