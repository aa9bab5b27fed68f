package com.ryuqq.opwire.core.error;

/**
 * 취소 또는 데드라인 초과.
 *
 * <p>실행 컨텍스트의 취소 신호가 설정된 상태에서 작업을 계속하지 않고 즉시 반환할 때 사용합니다.</p>
 *
 * @param reason 취소 사유
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public record CancellationError(String reason) implements OperationError {

    public CancellationError {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    public static CancellationError of(String reason) {
        return new CancellationError(reason);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CANCELLED;
    }

    @Override
    public String message() {
        return reason;
    }
}
