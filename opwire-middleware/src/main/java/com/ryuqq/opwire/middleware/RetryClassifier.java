package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.error.DependencyError;
import com.ryuqq.opwire.core.error.OperationError;

/**
 * 실패를 재시도 가능한지 분류하는 전략.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryClassifier {

    boolean isRetryable(OperationError error);

    /**
     * 일시적 의존성 오류만 재시도하는 기본 분류기.
     *
     * <p>{@link DependencyError#retryable()}이 true인 경우에만 재시도합니다.
     * 검증, 비즈니스 규칙, 권한, 취소 오류는 재시도하지 않습니다.</p>
     *
     * @return 기본 분류기
     */
    static RetryClassifier transientDependencyErrors() {
        return error -> error instanceof DependencyError dependencyError && dependencyError.retryable();
    }
}
