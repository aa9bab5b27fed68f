package com.ryuqq.opwire.core.error;

/**
 * 리소스 어댑터가 던지는 의존성 실패 예외.
 *
 * <p>재시도 가능 여부를 명시적으로 지정합니다.</p>
 *
 * <pre>
 * throw DependencyException.transientFailure("connection reset", e);
 * throw DependencyException.permanentFailure("constraint violated");
 * </pre>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public class DependencyException extends RuntimeException implements TransientFailure {

    private final boolean retryable;

    public DependencyException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static DependencyException transientFailure(String message, Throwable cause) {
        return new DependencyException(message, cause, true);
    }

    public static DependencyException transientFailure(String message) {
        return new DependencyException(message, null, true);
    }

    public static DependencyException permanentFailure(String message, Throwable cause) {
        return new DependencyException(message, cause, false);
    }

    public static DependencyException permanentFailure(String message) {
        return new DependencyException(message, null, false);
    }

    @Override
    public boolean isTransient() {
        return retryable;
    }
}
