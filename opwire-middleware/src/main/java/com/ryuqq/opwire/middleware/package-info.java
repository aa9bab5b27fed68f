/**
 * 표준 미들웨어 구현.
 *
 * <p>정규 순서(바깥 → 안쪽): {@link com.ryuqq.opwire.middleware.LoggingMiddleware},
 * {@link com.ryuqq.opwire.middleware.TimingMiddleware}, {@link com.ryuqq.opwire.middleware.DeadlineMiddleware},
 * {@link com.ryuqq.opwire.middleware.AuthorizationMiddleware}, {@link com.ryuqq.opwire.middleware.ValidationMiddleware},
 * {@link com.ryuqq.opwire.middleware.RetryMiddleware}, {@link com.ryuqq.opwire.middleware.TransactionMiddleware}.</p>
 *
 * <p>모든 미들웨어는 상태를 갖지 않으며 여러 스레드에서 동시에 사용할 수 있습니다.
 * 시간, 대기, 난수는 모두 주입받습니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
package com.ryuqq.opwire.middleware;
