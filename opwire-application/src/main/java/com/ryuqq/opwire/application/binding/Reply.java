package com.ryuqq.opwire.application.binding;

import com.ryuqq.opwire.core.error.OperationError;
import com.ryuqq.opwire.core.outcome.Outcome;

/**
 * 프런트엔드 바인딩의 호출 결과.
 *
 * <p><strong>두 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li><strong>완료 (outcome non-null):</strong> Operation이 Ok 또는 Fail을 반환한 경우.
 *       signal은 {@link FaultMapper#map(Outcome)} 결과</li>
 *   <li><strong>결함 (fault non-null):</strong> Operation이 예외를 던진 경우.
 *       signal은 항상 {@link FaultSignal#SERVER_FAULT}</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class Reply<R> {

    private final String requestId;
    private final FaultSignal signal;
    private final Outcome<R> outcomeOrNull;
    private final Throwable faultOrNull;

    private Reply(String requestId, FaultSignal signal, Outcome<R> outcomeOrNull, Throwable faultOrNull) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId cannot be null or blank");
        }
        this.requestId = requestId;
        this.signal = signal;
        this.outcomeOrNull = outcomeOrNull;
        this.faultOrNull = faultOrNull;
    }

    /**
     * 완료 결과 생성.
     *
     * @param requestId 요청 ID
     * @param outcome 실행 결과
     * @param <R> 응답 타입
     * @return Reply
     * @throws IllegalArgumentException outcome이 null인 경우
     */
    public static <R> Reply<R> completed(String requestId, Outcome<R> outcome) {
        return new Reply<>(requestId, FaultMapper.map(outcome), outcome, null);
    }

    /**
     * 결함 결과 생성.
     *
     * @param requestId 요청 ID
     * @param fault Operation이 던진 예외
     * @param <R> 응답 타입
     * @return Reply (SERVER_FAULT)
     */
    public static <R> Reply<R> faulted(String requestId, Throwable fault) {
        return new Reply<>(requestId, FaultMapper.map(fault), null, fault);
    }

    public String getRequestId() {
        return requestId;
    }

    public FaultSignal getSignal() {
        return signal;
    }

    public boolean isOk() {
        return signal == FaultSignal.OK;
    }

    /**
     * @return 실행 결과 또는 null (결함 시)
     */
    public Outcome<R> getOutcomeOrNull() {
        return outcomeOrNull;
    }

    public R getResponseOrNull() {
        return outcomeOrNull == null ? null : outcomeOrNull.getResponseOrNull();
    }

    public OperationError getErrorOrNull() {
        return outcomeOrNull == null ? null : outcomeOrNull.getErrorOrNull();
    }

    /**
     * @return Operation이 던진 예외 또는 null
     */
    public Throwable getFaultOrNull() {
        return faultOrNull;
    }

    @Override
    public String toString() {
        return "Reply{requestId=" + requestId + ", signal=" + signal + '}';
    }
}
