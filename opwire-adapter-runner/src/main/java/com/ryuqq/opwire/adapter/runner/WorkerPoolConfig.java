package com.ryuqq.opwire.adapter.runner;

/**
 * WorkerPoolInvoker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 처리 스레드 수 (기본 5)</li>
 *   <li>maxProcessingTimeMs: 이벤트당 기본 시간 예산 (기본 30000ms = 30초)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중 요청 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>높은 처리량: concurrency 증가 (5 → 20)</li>
 *   <li>빠른 종료: shutdownTimeoutMs 감소</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 * @param concurrency 동시 처리 스레드 수 (1 이상이어야 함)
 * @param maxProcessingTimeMs 기본 시간 예산 (밀리초, 양수여야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record WorkerPoolConfig(
    int concurrency,
    long maxProcessingTimeMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=5, maxProcessingTimeMs=30000ms, shutdownTimeoutMs=60000ms</p>
     */
    public WorkerPoolConfig() {
        this(5, 30000, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerPoolConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (maxProcessingTimeMs <= 0) {
            throw new IllegalArgumentException(
                "maxProcessingTimeMs must be positive (current: " + maxProcessingTimeMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withConcurrency(int concurrency) {
        return new WorkerPoolConfig(concurrency, maxProcessingTimeMs, shutdownTimeoutMs);
    }

    /**
     * maxProcessingTimeMs만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withMaxProcessingTimeMs(long maxProcessingTimeMs) {
        return new WorkerPoolConfig(concurrency, maxProcessingTimeMs, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new WorkerPoolConfig(concurrency, maxProcessingTimeMs, shutdownTimeoutMs);
    }
}
