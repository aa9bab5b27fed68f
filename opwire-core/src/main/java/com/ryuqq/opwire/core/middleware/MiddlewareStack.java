package com.ryuqq.opwire.core.middleware;

import com.ryuqq.opwire.core.operation.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 명시적인 미들웨어 순서 목록.
 *
 * <p>계층은 바깥쪽(outermost)부터 안쪽(innermost) 순서로 보관되며, {@link #apply(Operation)}는
 * 오른쪽에서 왼쪽으로 접어(fold) 가장 안쪽 계층이 기본 Operation을 먼저 감싸도록 합니다.
 * 순서 자체가 테스트 가능한 설정 값입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MiddlewareStack&lt;CreateEntityRequest, Entity&gt; stack = MiddlewareStack.of(
 *     LoggingMiddleware.create("create-entity", log),
 *     RetryMiddleware.create(retryPolicy, sleeper),
 *     TransactionMiddleware.create(txProvider)
 * );
 * Operation&lt;CreateEntityRequest, Entity&gt; wired = stack.apply(createEntity);
 * // == logging.wrap(retry.wrap(transaction.wrap(createEntity)))
 * </pre>
 *
 * <p>정규 순서({@link MiddlewareKind})를 어긴 스택도 만들 수 있지만 경고 로그를 남기며
 * {@link #isCanonical()}이 false를 반환합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 변경 불가. {@link #then(Middleware)}은 새 스택을 반환합니다.</p>
 *
 * @param <Q> 요청 타입
 * @param <R> 응답 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class MiddlewareStack<Q, R> {

    private static final Logger log = LoggerFactory.getLogger(MiddlewareStack.class);

    private final List<Middleware<Q, R>> layers;

    private MiddlewareStack(List<Middleware<Q, R>> layers) {
        this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
    }

    /**
     * 빈 스택 생성.
     *
     * @param <Q> 요청 타입
     * @param <R> 응답 타입
     * @return 기본 Operation을 그대로 반환하는 스택
     */
    public static <Q, R> MiddlewareStack<Q, R> empty() {
        return new MiddlewareStack<>(List.of());
    }

    /**
     * 스택 생성 (바깥쪽부터 안쪽 순서).
     *
     * @param layers 계층 목록
     * @param <Q> 요청 타입
     * @param <R> 응답 타입
     * @return 새 스택
     * @throws IllegalArgumentException layers가 null이거나 null 요소를 포함하는 경우
     */
    public static <Q, R> MiddlewareStack<Q, R> of(List<Middleware<Q, R>> layers) {
        if (layers == null) {
            throw new IllegalArgumentException("layers cannot be null");
        }
        for (Middleware<Q, R> layer : layers) {
            if (layer == null) {
                throw new IllegalArgumentException("layers cannot contain null");
            }
        }
        MiddlewareStack<Q, R> stack = new MiddlewareStack<>(layers);
        if (!stack.isCanonical()) {
            log.warn("Middleware stack {} is not in canonical order {}; semantics differ from the canonical stack",
                stack.kinds(), canonicalOrder());
        }
        return stack;
    }

    /**
     * 스택 생성 (바깥쪽부터 안쪽 순서).
     *
     * @param layers 계층
     * @param <Q> 요청 타입
     * @param <R> 응답 타입
     * @return 새 스택
     */
    @SafeVarargs
    public static <Q, R> MiddlewareStack<Q, R> of(Middleware<Q, R>... layers) {
        if (layers == null) {
            throw new IllegalArgumentException("layers cannot be null");
        }
        return of(Arrays.asList(layers));
    }

    /**
     * 가장 안쪽에 계층을 추가한 새 스택 생성.
     *
     * @param inner 추가할 계층
     * @return 새 스택
     */
    public MiddlewareStack<Q, R> then(Middleware<Q, R> inner) {
        if (inner == null) {
            throw new IllegalArgumentException("inner cannot be null");
        }
        List<Middleware<Q, R>> extended = new ArrayList<>(layers);
        extended.add(inner);
        return of(extended);
    }

    /**
     * 기본 Operation에 스택 적용.
     *
     * @param base 기본 Operation
     * @return 모든 계층으로 감싼 Operation
     */
    public Operation<Q, R> apply(Operation<Q, R> base) {
        if (base == null) {
            throw new IllegalArgumentException("base cannot be null");
        }
        Operation<Q, R> wrapped = base;
        for (int i = layers.size() - 1; i >= 0; i--) {
            wrapped = layers.get(i).wrap(wrapped);
            if (wrapped == null) {
                throw new IllegalStateException("Middleware at position " + i + " returned null");
            }
        }
        return wrapped;
    }

    /**
     * 계층 종류 목록 조회 (바깥쪽부터).
     *
     * @return 종류 목록
     */
    public List<MiddlewareKind> kinds() {
        return layers.stream()
            .map(Middleware::kind)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 계층 목록 조회 (바깥쪽부터).
     *
     * @return 변경 불가능한 계층 목록
     */
    public List<Middleware<Q, R>> layers() {
        return layers;
    }

    /**
     * 정규 순서 준수 여부 확인. CUSTOM 계층은 무시합니다.
     *
     * @return 순서를 지키면 true
     */
    public boolean isCanonical() {
        int previous = -1;
        for (Middleware<Q, R> layer : layers) {
            MiddlewareKind kind = layer.kind();
            if (!kind.isOrdered()) {
                continue;
            }
            if (kind.ordinal() < previous) {
                return false;
            }
            previous = kind.ordinal();
        }
        return true;
    }

    /**
     * 계층 수 조회.
     *
     * @return 계층 수
     */
    public int size() {
        return layers.size();
    }

    private static List<MiddlewareKind> canonicalOrder() {
        return Arrays.stream(MiddlewareKind.values())
            .filter(MiddlewareKind::isOrdered)
            .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "MiddlewareStack" + kinds();
    }
}
