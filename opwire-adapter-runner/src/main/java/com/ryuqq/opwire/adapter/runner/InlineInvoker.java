package com.ryuqq.opwire.adapter.runner;

import com.ryuqq.opwire.application.binding.Invoker;
import com.ryuqq.opwire.application.binding.Reply;
import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.context.RequestScope;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.spi.IdGenerator;
import com.ryuqq.opwire.core.spi.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.UnaryOperator;

/**
 * Inline Invoker 구현체.
 *
 * <p>호출 스레드에서 Operation을 동기 실행합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>요청 ID 생성 ({@link IdGenerator})</li>
 *   <li>timeBudget을 데드라인으로 하는 {@link RequestScope} 열기</li>
 *   <li>컨텍스트 초기화 (예: 호출자 신원 첨부)</li>
 *   <li>Operation 실행</li>
 *   <li>Ok/Fail → {@link Reply#completed}, 예외 → {@link Reply#faulted}</li>
 *   <li>스코프 닫기 (COMPLETED)</li>
 * </ol>
 *
 * <p>Stateless 설계: 인스턴스 간 상태 공유 없음 (thread-safe)</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class InlineInvoker<Q, R> implements Invoker<Q, R> {

    private static final Logger log = LoggerFactory.getLogger(InlineInvoker.class);

    static final long MIN_TIME_BUDGET_MS = 1;
    static final long MAX_TIME_BUDGET_MS = 60_000;

    private final Operation<Q, R> operation;
    private final IdGenerator idGenerator;
    private final TimeSource timeSource;
    private final UnaryOperator<ExecutionContext> contextInitializer;

    public InlineInvoker(Operation<Q, R> operation, IdGenerator idGenerator, TimeSource timeSource) {
        this(operation, idGenerator, timeSource, UnaryOperator.identity());
    }

    /**
     * 생성자 (컨텍스트 초기화 지정).
     *
     * @param operation 감싼 Operation
     * @param idGenerator 요청 ID 생성기
     * @param timeSource 데드라인 계산용 시간 제공자
     * @param contextInitializer 요청마다 루트 컨텍스트에 값을 첨부하는 함수
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public InlineInvoker(
            Operation<Q, R> operation,
            IdGenerator idGenerator,
            TimeSource timeSource,
            UnaryOperator<ExecutionContext> contextInitializer) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        if (contextInitializer == null) {
            throw new IllegalArgumentException("contextInitializer cannot be null");
        }
        this.operation = operation;
        this.idGenerator = idGenerator;
        this.timeSource = timeSource;
        this.contextInitializer = contextInitializer;
    }

    @Override
    public Reply<R> invoke(Q request, long timeBudgetMs) {
        validateInput(request, timeBudgetMs);

        String requestId = idGenerator.nextId();
        try (RequestScope scope = RequestScope.open(timeSource, Duration.ofMillis(timeBudgetMs))) {
            return execute(operation, contextInitializer.apply(scope.context()), requestId, request);
        }
    }

    /**
     * 입력 유효성 검증.
     *
     * @throws IllegalArgumentException 유효하지 않은 입력인 경우
     */
    private void validateInput(Q request, long timeBudgetMs) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (timeBudgetMs < MIN_TIME_BUDGET_MS || timeBudgetMs > MAX_TIME_BUDGET_MS) {
            throw new IllegalArgumentException(
                String.format("timeBudgetMs must be between %d and %d ms (current: %d)",
                    MIN_TIME_BUDGET_MS, MAX_TIME_BUDGET_MS, timeBudgetMs));
        }
    }

    /**
     * Operation 실행 후 Reply로 변환.
     *
     * <p>예외는 서버 결함으로 기록하고 {@link Reply#faulted}로 반환합니다.
     * 프로토콜 어댑터까지 예외가 전파되지 않습니다.</p>
     */
    static <I, O> Reply<O> execute(Operation<I, O> operation, ExecutionContext ctx, String requestId, I request) {
        try {
            Outcome<O> outcome = operation.invoke(ctx, request);
            if (outcome == null) {
                throw new IllegalStateException("Operation returned null outcome");
            }
            return Reply.completed(requestId, outcome);
        } catch (RuntimeException fault) {
            log.error("Request {} failed with an unrecoverable fault", requestId, fault);
            return Reply.faulted(requestId, fault);
        }
    }
}
