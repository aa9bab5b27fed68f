package com.ryuqq.opwire.core.guard;

import com.ryuqq.opwire.core.error.Violation;

import java.util.List;

/**
 * 요청 검증 규칙.
 *
 * <p>검증 규칙 자체는 도메인별 코드이며, 이 인터페이스는 검증 미들웨어가 필요로 하는 형태만 정의합니다.
 * 의존성을 호출하지 않는 순수 함수여야 합니다.</p>
 *
 * @param <Q> 요청 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Validator<Q> {

    /**
     * 요청 검증.
     *
     * @param request 요청
     * @return 위반 목록 (위반이 없으면 빈 목록, null 불가)
     */
    List<Violation> validate(Q request);
}
