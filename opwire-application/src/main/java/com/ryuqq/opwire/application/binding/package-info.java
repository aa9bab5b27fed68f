/**
 * 프런트엔드 바인딩 계약.
 *
 * <p>{@link com.ryuqq.opwire.application.binding.Invoker}가 요청을 받아
 * {@link com.ryuqq.opwire.application.binding.Reply}로 응답하고,
 * {@link com.ryuqq.opwire.application.binding.FaultMapper}가 결과를 프로토콜 중립적인
 * {@link com.ryuqq.opwire.application.binding.FaultSignal}로 분류합니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
package com.ryuqq.opwire.application.binding;
