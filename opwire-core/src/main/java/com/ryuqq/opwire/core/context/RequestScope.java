package com.ryuqq.opwire.core.context;

import com.ryuqq.opwire.core.spi.TimeSource;
import com.ryuqq.opwire.core.statemachine.RequestState;
import com.ryuqq.opwire.core.statemachine.StateTransition;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 외부 요청 하나의 소유자.
 *
 * <p>프론트엔드 어댑터가 요청마다 하나씩 생성하며, 루트 실행 컨텍스트와 그 취소 신호를 소유합니다.
 * 취소({@link #cancel(String)})는 소유자만 호출하며, 모든 하위 컨텍스트에서 관찰됩니다.</p>
 *
 * <p><strong>상태 전이:</strong> CREATED → COMPLETED ({@link #close()}) | CANCELLED ({@link #cancel(String)})</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (RequestScope scope = RequestScope.open(timeSource, Duration.ofMillis(500))) {
 *     Outcome&lt;Entity&gt; outcome = createEntity.invoke(scope.context(), request);
 *     ...
 * }
 * </pre>
 *
 * <p><strong>동시성:</strong> 상태는 CAS로 전이되므로 cancel과 close가 경쟁해도
 * 정확히 하나의 종료 상태만 기록됩니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class RequestScope implements CancellationSignal, AutoCloseable {

    private final AtomicReference<RequestState> state;
    private final TimeSource timeSource;
    private final Instant deadline;
    private final ExecutionContext context;
    private volatile String cancelReason;

    private RequestScope(TimeSource timeSource, Instant deadline) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.state = new AtomicReference<>(RequestState.CREATED);
        this.timeSource = timeSource;
        this.deadline = deadline;
        this.context = ExecutionContext.root(this);
    }

    /**
     * 데드라인 없는 요청 스코프 생성.
     *
     * @param timeSource 현재 시각 제공자
     * @return 새 RequestScope
     */
    public static RequestScope open(TimeSource timeSource) {
        return new RequestScope(timeSource, null);
    }

    /**
     * 절대 데드라인을 가진 요청 스코프 생성.
     *
     * @param timeSource 현재 시각 제공자
     * @param deadline 데드라인
     * @return 새 RequestScope
     */
    public static RequestScope open(TimeSource timeSource, Instant deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        return new RequestScope(timeSource, deadline);
    }

    /**
     * 시간 예산을 가진 요청 스코프 생성.
     *
     * @param timeSource 현재 시각 제공자
     * @param budget 시간 예산 (양수)
     * @return 새 RequestScope (데드라인 = now + budget)
     */
    public static RequestScope open(TimeSource timeSource, Duration budget) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (budget == null || budget.isNegative() || budget.isZero()) {
            throw new IllegalArgumentException("budget must be positive (current: " + budget + ")");
        }
        return new RequestScope(timeSource, timeSource.now().plus(budget));
    }

    /**
     * 루트 실행 컨텍스트 조회.
     *
     * @return 이 스코프의 취소 신호를 가진 루트 컨텍스트
     */
    public ExecutionContext context() {
        return context;
    }

    /**
     * 현재 상태 조회.
     *
     * @return 요청 상태
     */
    public RequestState state() {
        return state.get();
    }

    /**
     * 요청 취소.
     *
     * @param reason 취소 사유
     * @return 이번 호출로 취소되었으면 true, 이미 종료 상태였으면 false
     */
    public boolean cancel(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        return transition(RequestState.CANCELLED, reason);
    }

    /**
     * 요청 정상 종료. 이미 종료된 경우 아무 동작도 하지 않습니다.
     */
    @Override
    public void close() {
        transition(RequestState.COMPLETED, null);
    }

    @Override
    public boolean isCancelled() {
        return state.get() == RequestState.CANCELLED || deadlinePassed();
    }

    @Override
    public Optional<String> reason() {
        if (state.get() == RequestState.CANCELLED) {
            return Optional.ofNullable(cancelReason);
        }
        if (deadlinePassed()) {
            return Optional.of("deadline exceeded at " + deadline);
        }
        return Optional.empty();
    }

    @Override
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    private boolean transition(RequestState target, String reason) {
        RequestState current = state.get();
        if (current.isTerminal()) {
            return false;
        }
        StateTransition.validate(current, target);
        // 사유를 먼저 기록해야 CANCELLED를 관찰한 쪽이 사유도 볼 수 있음
        if (reason != null) {
            cancelReason = reason;
        }
        return state.compareAndSet(current, target);
    }

    private boolean deadlinePassed() {
        return deadline != null
            && state.get() == RequestState.CREATED
            && !timeSource.now().isBefore(deadline);
    }
}
