package com.ryuqq.opwire.adapter.runner;

import com.ryuqq.opwire.application.binding.Invoker;
import com.ryuqq.opwire.application.binding.Reply;
import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.context.RequestScope;
import com.ryuqq.opwire.core.error.CancellationError;
import com.ryuqq.opwire.core.operation.Operation;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.spi.IdGenerator;
import com.ryuqq.opwire.core.spi.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Worker Pool Invoker 구현체.
 *
 * <p>인바운드 이벤트(메시지, 스케줄 트리거 등)마다 하나의 호출을 고정 크기 워커 풀에서 실행합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>{@link #submit(Object)}: 요청 ID 생성, {@link RequestScope} 열기, 워커에 제출</li>
 *   <li>워커: Operation 실행 → {@link Reply} 완성 → 스코프 닫기</li>
 *   <li>{@link #shutdown()}: 새 제출 거부, 진행 중 요청의 스코프 취소(협력적),
 *       shutdownTimeoutMs 동안 대기 후 남은 워커 인터럽트</li>
 * </ol>
 *
 * <p>시간 예산은 제출 시점부터 계산되므로, 큐에서 대기한 시간도 예산에 포함됩니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class WorkerPoolInvoker<Q, R> implements Invoker<Q, R>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolInvoker.class);

    static final String SHUTDOWN_REASON = "invoker shutting down";

    private final Operation<Q, R> operation;
    private final IdGenerator idGenerator;
    private final TimeSource timeSource;
    private final WorkerPoolConfig config;
    private final UnaryOperator<ExecutionContext> contextInitializer;
    private final ExecutorService workerExecutor;
    private final Map<String, RequestScope> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public WorkerPoolInvoker(Operation<Q, R> operation, IdGenerator idGenerator, TimeSource timeSource, WorkerPoolConfig config) {
        this(operation, idGenerator, timeSource, config, UnaryOperator.identity());
    }

    public WorkerPoolInvoker(
            Operation<Q, R> operation,
            IdGenerator idGenerator,
            TimeSource timeSource,
            WorkerPoolConfig config,
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
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (contextInitializer == null) {
            throw new IllegalArgumentException("contextInitializer cannot be null");
        }
        this.operation = operation;
        this.idGenerator = idGenerator;
        this.timeSource = timeSource;
        this.config = config;
        this.contextInitializer = contextInitializer;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    /**
     * 기본 시간 예산(maxProcessingTimeMs)으로 이벤트 제출.
     *
     * @param request 요청
     * @return 완료 시 Reply를 담는 future (예외로 완료되지 않음)
     * @throws IllegalStateException 종료된 경우
     */
    public CompletableFuture<Reply<R>> submit(Q request) {
        return submit(request, config.maxProcessingTimeMs());
    }

    public CompletableFuture<Reply<R>> submit(Q request, long timeBudgetMs) {
        return accept(request, timeBudgetMs).future();
    }

    /**
     * 이벤트를 제출하고 완료까지 대기.
     *
     * <p>대기 중 호출 스레드가 인터럽트되면 해당 요청의 스코프를 취소하고
     * 취소 결과를 반환합니다.</p>
     */
    @Override
    public Reply<R> invoke(Q request, long timeBudgetMs) {
        Submission<R> submission = accept(request, timeBudgetMs);
        try {
            return submission.future().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            submission.scope().cancel("caller interrupted");
            return Reply.completed(submission.requestId(), Outcome.fail(CancellationError.of("caller interrupted")));
        } catch (ExecutionException e) {
            return Reply.faulted(submission.requestId(), e.getCause());
        }
    }

    /**
     * Graceful shutdown.
     *
     * <p>진행 중인 모든 요청의 스코프를 취소합니다. 취소를 확인한 Operation은
     * 취소 오류로 끝나고, 트랜잭션 미들웨어가 롤백합니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public void shutdown() throws InterruptedException {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        workerExecutor.shutdown();
        int cancelled = 0;
        for (RequestScope scope : inFlight.values()) {
            if (scope.cancel(SHUTDOWN_REASON)) {
                cancelled++;
            }
        }
        log.info("Shutting down worker pool, cancelled {} in-flight requests", cancelled);

        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Workers did not finish within {}ms, interrupting", config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public WorkerPoolConfig getConfig() {
        return config;
    }

    private Submission<R> accept(Q request, long timeBudgetMs) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (timeBudgetMs <= 0) {
            throw new IllegalArgumentException("timeBudgetMs must be positive (current: " + timeBudgetMs + ")");
        }
        if (shutdown.get()) {
            throw new IllegalStateException("WorkerPoolInvoker is shut down");
        }

        String requestId = idGenerator.nextId();
        RequestScope scope = RequestScope.open(timeSource, Duration.ofMillis(timeBudgetMs));
        inFlight.put(requestId, scope);
        try {
            CompletableFuture<Reply<R>> future = CompletableFuture.supplyAsync(
                () -> process(requestId, scope, request), workerExecutor);
            return new Submission<>(requestId, scope, future);
        } catch (RejectedExecutionException e) {
            inFlight.remove(requestId);
            scope.close();
            throw new IllegalStateException("WorkerPoolInvoker is shut down", e);
        }
    }

    private Reply<R> process(String requestId, RequestScope scope, Q request) {
        try {
            return InlineInvoker.execute(operation, contextInitializer.apply(scope.context()), requestId, request);
        } finally {
            inFlight.remove(requestId);
            scope.close();
        }
    }

    private record Submission<R>(String requestId, RequestScope scope, CompletableFuture<Reply<R>> future) {
    }
}
