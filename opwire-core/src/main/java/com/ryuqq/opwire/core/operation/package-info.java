/**
 * Operation 계약.
 *
 * <p>Operation은 {@code (ExecutionContext, 요청) → Outcome} 형태의 단일 작업 단위입니다.
 * 예상 가능한 실패는 {@link com.ryuqq.opwire.core.outcome.Fail}로 반환하고,
 * 예외는 복구 불가능한 결함(프로그래밍 오류)에만 사용합니다.</p>
 *
 * <p>의존성 호출은 {@link com.ryuqq.opwire.core.operation.Steps}로 감싸서
 * 취소 확인과 예외 → {@link com.ryuqq.opwire.core.error.DependencyError} 변환을 일관되게 적용합니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
package com.ryuqq.opwire.core.operation;
