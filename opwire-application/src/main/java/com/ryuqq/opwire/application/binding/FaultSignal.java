package com.ryuqq.opwire.application.binding;

/**
 * 프런트엔드에 전달되는 결과 신호.
 *
 * <p>프로토콜 어댑터는 이 신호만 보고 응답 코드를 결정합니다
 * (예: HTTP 200 / 4xx / 5xx / 499, 메시지 ack / nack).</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public enum FaultSignal {

    /** 성공 */
    OK,

    /** 호출자 책임 실패: 검증, 비즈니스 규칙, 권한 */
    CLIENT_FAULT,

    /** 서버 책임 실패: 의존성 오류, 복구 불가능한 결함 */
    SERVER_FAULT,

    /** 취소 또는 데드라인 초과 */
    CANCELLED
}
