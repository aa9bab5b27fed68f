package com.ryuqq.opwire.core.operation;

import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.error.CancellationError;
import com.ryuqq.opwire.core.error.DependencyError;
import com.ryuqq.opwire.core.outcome.Done;
import com.ryuqq.opwire.core.outcome.Outcome;

import java.util.Optional;

/**
 * 의존성 호출 헬퍼.
 *
 * <p>Operation 본문에서 주입된 의존성을 호출할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>컨텍스트가 이미 취소된 경우: 의존성을 호출하지 않고 {@link CancellationError} 반환</li>
 *   <li>의존성 호출</li>
 *   <li>예외 발생 시: 단계 이름과 원인을 보존한 {@link DependencyError} 반환</li>
 *   <li>인터럽트 발생 시: 인터럽트 플래그 복원 후 {@link CancellationError} 반환</li>
 * </ol>
 *
 * <p>{@link Error}는 복구 불가능한 결함으로 간주하여 잡지 않습니다.</p>
 *
 * <pre>
 * Outcome&lt;Optional&lt;String&gt;&gt; existing = Steps.call(ctx, "find-by-name", () -&gt; repository.findIdByName(ctx, name));
 * Outcome&lt;Done&gt; saved = Steps.run(ctx, "insert-entity", () -&gt; repository.insert(ctx, entity));
 * </pre>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class Steps {

    // Utility class - prevent instantiation
    private Steps() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 값을 반환하는 의존성 호출.
     *
     * @param <T> 반환 타입
     */
    @FunctionalInterface
    public interface DependencyCall<T> {
        T call() throws Exception;
    }

    /**
     * 값을 반환하지 않는 의존성 호출.
     */
    @FunctionalInterface
    public interface DependencyAction {
        void run() throws Exception;
    }

    /**
     * 의존성 호출 (값 반환).
     *
     * @param ctx 실행 컨텍스트
     * @param step 단계 이름 (오류 주석에 사용)
     * @param call 의존성 호출
     * @param <T> 반환 타입
     * @return 성공 시 반환값, 실패 시 DependencyError 또는 CancellationError
     */
    public static <T> Outcome<T> call(ExecutionContext ctx, String step, DependencyCall<T> call) {
        validate(ctx, step);
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        Optional<CancellationError> cancelled = ctx.cancellation();
        if (cancelled.isPresent()) {
            return Outcome.fail(cancelled.get());
        }

        try {
            T result = call.call();
            if (result == null) {
                return Outcome.fail(DependencyError.of(step, "dependency returned null", false));
            }
            return Outcome.ok(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.fail(CancellationError.of(step + " interrupted"));
        } catch (Exception e) {
            return Outcome.fail(DependencyError.at(step, e));
        }
    }

    /**
     * 의존성 호출 (값 없음).
     *
     * @param ctx 실행 컨텍스트
     * @param step 단계 이름 (오류 주석에 사용)
     * @param action 의존성 호출
     * @return 성공 시 {@link Done#DONE}, 실패 시 DependencyError 또는 CancellationError
     */
    public static Outcome<Done> run(ExecutionContext ctx, String step, DependencyAction action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return call(ctx, step, () -> {
            action.run();
            return Done.DONE;
        });
    }

    private static void validate(ExecutionContext ctx, String step) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (step == null || step.isBlank()) {
            throw new IllegalArgumentException("step cannot be null or blank");
        }
    }
}
