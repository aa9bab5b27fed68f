package com.ryuqq.opwire.core.context;

/**
 * 실행 컨텍스트에 리소스를 부착할 때 사용하는 타입 있는 키.
 *
 * <p>키는 인스턴스 동일성(identity)으로 비교됩니다. 이름이 같아도 서로 다른 인스턴스는
 * 다른 키입니다. 따라서 키를 가진 쪽(예: TransactionProvider)만 해당 슬롯을 읽고 쓸 수 있습니다.</p>
 *
 * <pre>
 * private static final ContextKey&lt;Principal&gt; PRINCIPAL = ContextKey.named("principal");
 *
 * ExecutionContext child = ctx.with(PRINCIPAL, principal);
 * Optional&lt;Principal&gt; found = child.find(PRINCIPAL);
 * </pre>
 *
 * @param <T> 부착되는 값의 타입
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class ContextKey<T> {

    private final String name;

    private ContextKey(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    /**
     * 새 키 생성.
     *
     * @param name 디버깅용 이름
     * @param <T> 값 타입
     * @return 새 ContextKey (다른 모든 키와 구별됨)
     */
    public static <T> ContextKey<T> named(String name) {
        return new ContextKey<>(name);
    }

    /**
     * 키 이름 조회.
     *
     * @return 키 이름
     */
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "ContextKey{" + name + '}';
    }
}
