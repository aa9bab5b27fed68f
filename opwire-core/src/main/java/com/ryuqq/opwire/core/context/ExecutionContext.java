package com.ryuqq.opwire.core.context;

import com.ryuqq.opwire.core.error.CancellationError;

import java.util.Optional;

/**
 * 불변 실행 컨텍스트.
 *
 * <p>모든 Operation 호출의 첫 번째 인자로 명시적으로 전달됩니다. 취소 신호와
 * 부착된 리소스 핸들(대표적으로 활성 트랜잭션 핸들)을 운반합니다.
 * 전역 상태나 ThreadLocal을 사용하지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@link #with(ContextKey, Object)}는 새 자식 컨텍스트를 할당할 뿐 부모를 변경하지 않음</li>
 *   <li>같은 컨텍스트를 여러 호출 지점에서 안전하게 재사용 가능</li>
 *   <li>{@link #find(ContextKey)}는 가장 안쪽 부착부터 바깥쪽으로 탐색 (O(depth))</li>
 *   <li>키가 없으면 예외 대신 {@link Optional#empty()} 반환</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutionContext txCtx = ctx.with(provider.contextKey(), handle);
 * txCtx.find(provider.contextKey());   // Optional.of(handle)
 * ctx.find(provider.contextKey());     // Optional.empty() - 부모는 그대로
 * </pre>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class ExecutionContext {

    private final ExecutionContext parent;
    private final ContextKey<?> key;
    private final Object value;
    private final CancellationSignal signal;
    private final int depth;

    private ExecutionContext(ExecutionContext parent, ContextKey<?> key, Object value, CancellationSignal signal) {
        this.parent = parent;
        this.key = key;
        this.value = value;
        this.signal = signal;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    /**
     * 루트 컨텍스트 생성.
     *
     * @param signal 취소 신호
     * @return 부착된 리소스가 없는 루트 컨텍스트
     * @throws IllegalArgumentException signal이 null인 경우
     */
    public static ExecutionContext root(CancellationSignal signal) {
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        return new ExecutionContext(null, null, null, signal);
    }

    /**
     * 취소되지 않는 루트 컨텍스트 생성.
     *
     * <p>테스트 및 요청 범위 밖의 호출(시작 시점 작업 등)에 사용합니다.</p>
     *
     * @return 취소되지 않는 루트 컨텍스트
     */
    public static ExecutionContext background() {
        return root(CancellationSignal.never());
    }

    /**
     * 리소스를 부착한 자식 컨텍스트 생성.
     *
     * @param key 키
     * @param value 값 (null 불가)
     * @param <T> 값 타입
     * @return 새 자식 컨텍스트
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public <T> ExecutionContext with(ContextKey<T> key, T value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return new ExecutionContext(this, key, value, signal);
    }

    /**
     * 다른 취소 신호를 가진 자식 컨텍스트 생성.
     *
     * <p>부착된 리소스는 그대로 보이며, 취소 신호만 교체됩니다.
     * 보통 {@link CancellationSignal#withDeadline}으로 만든 더 엄격한 신호를 전달합니다.</p>
     *
     * @param signal 새 취소 신호
     * @return 새 자식 컨텍스트
     */
    public ExecutionContext withSignal(CancellationSignal signal) {
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        return new ExecutionContext(this, null, null, signal);
    }

    /**
     * 부착된 리소스 조회.
     *
     * @param key 키
     * @param <T> 값 타입
     * @return 가장 안쪽에 부착된 값, 없으면 empty
     */
    public <T> Optional<T> find(ContextKey<T> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        for (ExecutionContext node = this; node != null; node = node.parent) {
            if (node.key == key) {
                return Optional.of((T) node.value);
            }
        }
        return Optional.empty();
    }

    /**
     * 리소스 부착 여부 확인.
     *
     * @param key 키
     * @return 부착되어 있으면 true
     */
    public boolean contains(ContextKey<?> key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        for (ExecutionContext node = this; node != null; node = node.parent) {
            if (node.key == key) {
                return true;
            }
        }
        return false;
    }

    /**
     * 취소 신호 조회.
     *
     * @return 이 컨텍스트의 취소 신호
     */
    public CancellationSignal signal() {
        return signal;
    }

    /**
     * 취소 여부 확인.
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        return signal.isCancelled();
    }

    /**
     * 취소된 경우 CancellationError 반환.
     *
     * @return 취소된 경우 CancellationError, 아니면 empty
     */
    public Optional<CancellationError> cancellation() {
        if (!signal.isCancelled()) {
            return Optional.empty();
        }
        return Optional.of(CancellationError.of(signal.reason().orElse("cancelled")));
    }

    /**
     * 루트로부터의 깊이 조회.
     *
     * @return 루트는 0
     */
    public int depth() {
        return depth;
    }

    @Override
    public String toString() {
        return "ExecutionContext{depth=" + depth + ", cancelled=" + signal.isCancelled() + '}';
    }
}
