package com.ryuqq.opwire.core.transaction;

import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.spi.TransactionHandle;
import com.ryuqq.opwire.core.spi.TransactionProvider;

import java.util.Optional;

/**
 * 실행 컨텍스트에서 활성 트랜잭션 핸들을 빌려오는 유틸리티.
 *
 * <p>저장소 어댑터는 쓰기 전에 {@link #current(ExecutionContext, TransactionProvider)}로
 * 활성 핸들을 찾고, 있으면 그 핸들에 쓰기를 위임합니다. 빌린 핸들을 종료하지 않습니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class Transactions {

    // Utility class - prevent instantiation
    private Transactions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 활성 핸들 조회.
     *
     * @param ctx 실행 컨텍스트
     * @param provider 트랜잭션 제공자
     * @param <H> 핸들 타입
     * @return 부착된 핸들, 없으면 empty
     */
    public static <H extends TransactionHandle> Optional<H> current(ExecutionContext ctx, TransactionProvider<H> provider) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        return ctx.find(provider.contextKey());
    }

    /**
     * 활성 핸들 필수 조회.
     *
     * @param ctx 실행 컨텍스트
     * @param provider 트랜잭션 제공자
     * @param <H> 핸들 타입
     * @return 부착된 핸들
     * @throws IllegalStateException 핸들이 부착되어 있지 않은 경우 (트랜잭션 미들웨어 누락)
     */
    public static <H extends TransactionHandle> H require(ExecutionContext ctx, TransactionProvider<H> provider) {
        return current(ctx, provider).orElseThrow(() -> new IllegalStateException(
            "No active transaction for " + provider.contextKey().getName()
                + "; wrap the operation with the transaction middleware"));
    }
}
