package com.ryuqq.opwire.core.transaction;

import com.ryuqq.opwire.core.spi.TransactionHandle;
import com.ryuqq.opwire.core.statemachine.HandleState;
import com.ryuqq.opwire.core.statemachine.StateTransition;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 종료 동작 1회 보장을 구현한 트랜잭션 핸들 기반 클래스.
 *
 * <p>{@link #commit()}과 {@link #rollback()}은 먼저 상태를 OPEN에서 종료 상태로 CAS 전이한 뒤
 * 실제 저장소 동작({@link #doCommit()}, {@link #doRollback()})을 수행합니다.
 * 따라서 저장소 동작이 실패하더라도 핸들은 종료 상태이며 재사용되지 않습니다.</p>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>doCommit/doRollback 중 정확히 하나가 정확히 한 번 호출됨</li>
 *   <li>두 번째 종료 동작 시도는 {@link IllegalStateException}</li>
 *   <li>종료 후 {@link #ensureOpen()}은 {@link IllegalStateException}</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public abstract class AbstractTransactionHandle implements TransactionHandle {

    private final AtomicReference<HandleState> state = new AtomicReference<>(HandleState.OPEN);

    @Override
    public final void commit() {
        terminate(HandleState.COMMITTED);
        doCommit();
    }

    @Override
    public final void rollback() {
        terminate(HandleState.ROLLED_BACK);
        doRollback();
    }

    @Override
    public final HandleState state() {
        return state.get();
    }

    /**
     * 저장소 커밋 수행.
     */
    protected abstract void doCommit();

    /**
     * 저장소 롤백 수행.
     */
    protected abstract void doRollback();

    /**
     * 핸들이 아직 열려 있는지 확인. 하위 클래스의 읽기/쓰기 메서드에서 호출합니다.
     *
     * @throws IllegalStateException 이미 종료된 핸들인 경우
     */
    protected final void ensureOpen() {
        HandleState current = state.get();
        if (current != HandleState.OPEN) {
            throw new IllegalStateException("Handle is not open (state: " + current + ")");
        }
    }

    private void terminate(HandleState target) {
        HandleState current = state.get();
        StateTransition.validate(current, target);
        if (!state.compareAndSet(current, target)) {
            throw new IllegalStateException(
                String.format("Handle already terminated: %s → %s", state.get(), target)
            );
        }
    }
}
