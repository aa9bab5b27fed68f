package com.ryuqq.opwire.core.error;

/**
 * 의존성 실패.
 *
 * <p>주입된 의존성(저장소, 외부 서비스 등)의 실패를 나타냅니다. 실패한 단계 이름(step)과
 * 원인(cause)을 보존하여 원래 상황을 확인할 수 있게 합니다.</p>
 *
 * <p><strong>재시도 분류:</strong> {@code retryable}은 리소스 어댑터가 명시적으로 지정합니다.
 * {@link #at(String, Throwable)}는 원인 예외가 {@link TransientFailure}를 구현하고
 * {@link TransientFailure#isTransient()}가 true인 경우에만 재시도 가능으로 분류합니다.</p>
 *
 * @param step 실패한 단계 이름 (중첩 시 "outer/inner" 형태)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 * @param retryable 재시도 가능 여부
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record DependencyError(
    String step,
    String message,
    Throwable cause,
    boolean retryable
) implements OperationError {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException step 또는 message가 null이거나 빈 문자열인 경우
     */
    public DependencyError {
        if (step == null || step.isBlank()) {
            throw new IllegalArgumentException("step cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * 예외로부터 DependencyError 생성.
     *
     * @param step 실패한 단계 이름
     * @param cause 원인 예외
     * @return DependencyError 인스턴스
     * @throws IllegalArgumentException step이 비어 있거나 cause가 null인 경우
     */
    public static DependencyError at(String step, Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        boolean retryable = cause instanceof TransientFailure transientFailure && transientFailure.isTransient();
        String message = cause.getMessage() != null && !cause.getMessage().isBlank()
            ? cause.getMessage()
            : cause.getClass().getSimpleName();
        return new DependencyError(step, message, cause, retryable);
    }

    /**
     * 원인 예외 없이 DependencyError 생성.
     *
     * @param step 실패한 단계 이름
     * @param message 오류 메시지
     * @param retryable 재시도 가능 여부
     * @return DependencyError 인스턴스
     */
    public static DependencyError of(String step, String message, boolean retryable) {
        return new DependencyError(step, message, null, retryable);
    }

    /**
     * 바깥 단계 이름을 앞에 붙인 새 DependencyError 생성.
     *
     * @param outerStep 바깥 단계 이름
     * @return "outerStep/step" 형태의 단계 이름을 가진 DependencyError
     */
    public DependencyError withStep(String outerStep) {
        if (outerStep == null || outerStep.isBlank()) {
            throw new IllegalArgumentException("outerStep cannot be null or blank");
        }
        return new DependencyError(outerStep + "/" + step, message, cause, retryable);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.DEPENDENCY;
    }
}
