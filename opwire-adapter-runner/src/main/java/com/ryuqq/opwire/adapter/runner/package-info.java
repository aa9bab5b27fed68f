/**
 * Runner Adapter Layer - 프런트엔드 바인딩 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.opwire.adapter.runner.InlineInvoker} - 호출 스레드에서 동기 실행 (HTTP 핸들러용)</li>
 *   <li>{@link com.ryuqq.opwire.adapter.runner.WorkerPoolInvoker} - 이벤트당 한 번, 고정 워커 풀에서 실행 (메시지 컨슈머용)</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (InlineInvoker, WorkerPoolInvoker)
 *   ↓ implements
 * application (Invoker, Reply, FaultMapper)
 *   ↓ depends on
 * core (Operation, Outcome, RequestScope, ExecutionContext)
 * </pre>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
package com.ryuqq.opwire.adapter.runner;
