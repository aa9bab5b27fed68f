package com.ryuqq.opwire.middleware;

/**
 * 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 시도를 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>baseDelayMs: 첫 재시도 전 기본 대기 시간 (기본 100ms)</li>
 *   <li>maxDelayMs: 재시도 간 최대 대기 시간 (기본 2000ms)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * @author Opwire Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record RetryPolicy(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 정책 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelayMs=100ms, maxDelayMs=2000ms, jitterFactor=0.1</p>
     */
    public RetryPolicy() {
        this(3, 100, 2000, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must not be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 지연 없이 재시도하는 정책. 테스트용.
     *
     * @param maxAttempts 최대 시도 횟수
     * @return 지연 0ms 정책
     */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, 0, 0, 0.0);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 이 정책의 지연 설정으로 {@link BackoffCalculator} 생성.
     *
     * @return 백오프 계산기
     */
    public BackoffCalculator toBackoff() {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }
}
