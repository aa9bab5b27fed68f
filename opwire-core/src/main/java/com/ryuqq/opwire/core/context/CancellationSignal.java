package com.ryuqq.opwire.core.context;

import com.ryuqq.opwire.core.spi.TimeSource;

import java.time.Instant;
import java.util.Optional;

/**
 * 협력적 취소 신호.
 *
 * <p>신호는 요청의 소유자(가장 바깥 컨텍스트를 만든 쪽)만 설정할 수 있으며,
 * 모든 하위 컨텍스트에서 관찰됩니다. 강제 중단(interrupt)은 하지 않습니다.
 * 블로킹 또는 오래 걸리는 의존성을 호출하는 Operation은 이 신호를 확인하고
 * 취소된 경우 즉시 반환해야 합니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public interface CancellationSignal {

    /**
     * 취소 여부 확인.
     *
     * @return 명시적으로 취소되었거나 데드라인이 지났으면 true
     */
    boolean isCancelled();

    /**
     * 취소 사유 조회.
     *
     * @return 취소된 경우 사유, 아니면 empty
     */
    Optional<String> reason();

    /**
     * 데드라인 조회.
     *
     * @return 데드라인이 있으면 해당 시각, 없으면 empty
     */
    Optional<Instant> deadline();

    /**
     * 절대 취소되지 않는 신호.
     *
     * @return 취소되지 않는 신호
     */
    static CancellationSignal never() {
        return NeverCancelled.INSTANCE;
    }

    /**
     * 부모 신호에 데드라인을 더한 파생 신호 생성.
     *
     * <p>파생 신호는 부모가 취소되었거나 데드라인에 도달하면 취소됨으로 보고합니다.
     * 부모의 데드라인이 더 이르면 부모의 데드라인을 유지합니다.</p>
     *
     * @param parent 부모 신호
     * @param deadline 데드라인
     * @param timeSource 현재 시각 제공자
     * @return 파생 신호
     */
    static CancellationSignal withDeadline(CancellationSignal parent, Instant deadline, TimeSource timeSource) {
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        Instant effective = parent.deadline()
            .filter(parentDeadline -> parentDeadline.isBefore(deadline))
            .orElse(deadline);
        return new DeadlineSignal(parent, effective, timeSource);
    }
}
