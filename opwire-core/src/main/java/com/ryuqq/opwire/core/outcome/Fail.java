package com.ryuqq.opwire.core.outcome;

import com.ryuqq.opwire.core.error.OperationError;

import java.util.function.Function;

/**
 * 실패 결과.
 *
 * <p>오류만 담으며 사용 가능한 응답은 없습니다. 오류의 분류는
 * {@link OperationError#category()}로 확인합니다.</p>
 *
 * @param error 오류 (null 불가)
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record Fail<R>(OperationError error) implements Outcome<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Fail {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    public R getResponseOrNull() {
        return null;
    }

    @Override
    public OperationError getErrorOrNull() {
        return error;
    }

    @Override
    public <U> Outcome<U> map(Function<? super R, ? extends U> mapper) {
        return recast();
    }

    @Override
    public <U> Outcome<U> flatMap(Function<? super R, Outcome<U>> next) {
        return recast();
    }

    /**
     * 동일한 오류를 다른 응답 타입의 실패로 변환.
     *
     * @param <U> 새 응답 타입
     * @return 같은 오류를 담은 Fail
     */
    public <U> Fail<U> recast() {
        return new Fail<>(error);
    }
}
