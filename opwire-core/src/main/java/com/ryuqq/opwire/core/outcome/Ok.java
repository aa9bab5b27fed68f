package com.ryuqq.opwire.core.outcome;

import com.ryuqq.opwire.core.error.OperationError;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * <p>Operation이 성공적으로 완료되었음을 나타내며, 항상 완전한 응답을 담습니다.</p>
 *
 * @param response 응답 (null 불가)
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record Ok<R>(R response) implements Outcome<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException response가 null인 경우
     */
    public Ok {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }

    @Override
    public R getResponseOrNull() {
        return response;
    }

    @Override
    public OperationError getErrorOrNull() {
        return null;
    }

    @Override
    public <U> Outcome<U> map(Function<? super R, ? extends U> mapper) {
        return new Ok<>(mapper.apply(response));
    }

    @Override
    public <U> Outcome<U> flatMap(Function<? super R, Outcome<U>> next) {
        Outcome<U> result = next.apply(response);
        if (result == null) {
            throw new IllegalStateException("next step returned null outcome");
        }
        return result;
    }
}
