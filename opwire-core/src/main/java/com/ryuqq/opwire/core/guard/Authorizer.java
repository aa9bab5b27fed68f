package com.ryuqq.opwire.core.guard;

import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.error.AuthorizationError;

import java.util.Optional;

/**
 * 요청 권한 검사.
 *
 * <p>호출자 정보는 보통 프론트엔드 어댑터가 실행 컨텍스트에 부착합니다.</p>
 *
 * @param <Q> 요청 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Authorizer<Q> {

    /**
     * 권한 검사.
     *
     * @param ctx 실행 컨텍스트
     * @param request 요청
     * @return 거부 시 AuthorizationError, 허용 시 empty
     */
    Optional<AuthorizationError> authorize(ExecutionContext ctx, Q request);
}
