package com.ryuqq.opwire.core.error;

/**
 * 일시적 실패 표식.
 *
 * <p>리소스 어댑터가 던지는 예외가 이 인터페이스를 구현하면, 해당 예외로부터 만들어진
 * {@link DependencyError}는 재시도 가능({@code retryable = true})으로 분류됩니다.
 * 예외 메시지 문자열로 재시도 여부를 추측하지 않습니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public interface TransientFailure {

    /**
     * 일시적 실패 여부.
     *
     * @return 재시도하면 성공할 가능성이 있으면 true
     */
    default boolean isTransient() {
        return true;
    }
}
