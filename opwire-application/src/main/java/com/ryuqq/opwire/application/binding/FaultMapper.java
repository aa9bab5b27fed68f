package com.ryuqq.opwire.application.binding;

import com.ryuqq.opwire.core.error.ErrorCategory;
import com.ryuqq.opwire.core.error.OperationError;
import com.ryuqq.opwire.core.outcome.Outcome;

/**
 * Outcome → {@link FaultSignal} 매핑.
 *
 * <ul>
 *   <li>Ok → OK</li>
 *   <li>VALIDATION / BUSINESS_RULE / AUTHORIZATION → CLIENT_FAULT</li>
 *   <li>DEPENDENCY → SERVER_FAULT</li>
 *   <li>CANCELLED → CANCELLED</li>
 *   <li>예외(복구 불가능한 결함) → SERVER_FAULT</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class FaultMapper {

    // Utility class - prevent instantiation
    private FaultMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Outcome을 신호로 변환.
     *
     * @param outcome 실행 결과
     * @return 결과 신호
     * @throws IllegalArgumentException outcome이 null인 경우
     */
    public static FaultSignal map(Outcome<?> outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (outcome.isOk()) {
            return FaultSignal.OK;
        }
        return map(outcome.getErrorOrNull());
    }

    public static FaultSignal map(OperationError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        ErrorCategory category = error.category();
        if (category == ErrorCategory.CANCELLED) {
            return FaultSignal.CANCELLED;
        }
        return category.isClientFault() ? FaultSignal.CLIENT_FAULT : FaultSignal.SERVER_FAULT;
    }

    /**
     * 던져진 결함은 항상 서버 책임.
     *
     * @param fault 결함
     * @return {@link FaultSignal#SERVER_FAULT}
     */
    public static FaultSignal map(Throwable fault) {
        if (fault == null) {
            throw new IllegalArgumentException("fault cannot be null");
        }
        return FaultSignal.SERVER_FAULT;
    }
}
