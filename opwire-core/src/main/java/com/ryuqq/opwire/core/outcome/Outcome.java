package com.ryuqq.opwire.core.outcome;

import com.ryuqq.opwire.core.error.OperationError;

import java.util.function.Function;

/**
 * Operation 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과 중 정확히 하나를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공. 항상 완전한 응답(response)을 담습니다.</li>
 *   <li>{@link Fail}: 실패. 오류(error)만 담으며 사용 가능한 응답은 없습니다.</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 케이스 외의 구현은 허용되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;Entity&gt; outcome = createEntity.invoke(ctx, request);
 * if (outcome.isOk()) {
 *     Entity entity = outcome.getResponseOrNull();
 * } else {
 *     OperationError error = outcome.getErrorOrNull();
 * }
 *
 * // 단계 연결 (실패는 그대로 전파)
 * Outcome&lt;String&gt; id = outcome.map(Entity::id);
 * </pre>
 *
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public sealed interface Outcome<R> permits Ok, Fail {

    /**
     * 성공 결과 생성.
     *
     * @param response 응답 (null 불가)
     * @param <R> 응답 타입
     * @return Ok 인스턴스
     * @throws IllegalArgumentException response가 null인 경우
     */
    static <R> Outcome<R> ok(R response) {
        return new Ok<>(response);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 오류 (null 불가)
     * @param <R> 응답 타입
     * @return Fail 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <R> Outcome<R> fail(OperationError error) {
        return new Fail<>(error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 응답 조회.
     *
     * @return 성공 시 응답, 실패 시 null
     */
    R getResponseOrNull();

    /**
     * 오류 조회.
     *
     * @return 실패 시 오류, 성공 시 null
     */
    OperationError getErrorOrNull();

    /**
     * 성공 응답 변환. 실패는 그대로 전파됩니다.
     *
     * @param mapper 응답 변환 함수 (null 반환 불가)
     * @param <U> 변환된 응답 타입
     * @return 변환된 Outcome
     */
    <U> Outcome<U> map(Function<? super R, ? extends U> mapper);

    /**
     * 다음 단계 연결. 실패 시 다음 단계는 호출되지 않습니다.
     *
     * @param next 다음 단계
     * @param <U> 다음 단계의 응답 타입
     * @return 다음 단계의 Outcome 또는 현재 실패
     */
    <U> Outcome<U> flatMap(Function<? super R, Outcome<U>> next);
}
