package com.ryuqq.opwire.core.outcome;

/**
 * 응답 값이 없는 성공을 나타내는 단일 값.
 *
 * <p>{@link Ok}는 null 응답을 허용하지 않으므로, 반환값 없는 단계는 {@link #DONE}을 응답으로 사용합니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public enum Done {
    DONE
}
