package com.ryuqq.opwire.middleware;

/**
 * 선언되지 않은 checked 예외를 던지는 테스트 헬퍼.
 *
 * <p>Lombok {@code @SneakyThrows}나 Kotlin 호출자처럼 컴파일러 검사를 우회하는 코드를 흉내냅니다.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
final class Faults {

    private Faults() {
    }

    /**
     * 예외를 그대로 던집니다. 반환값은 {@code throw Faults.undeclared(e)} 형태로 쓰기 위한 것입니다.
     */
    static RuntimeException undeclared(Throwable fault) {
        Faults.<RuntimeException>throwAs(fault);
        return new IllegalStateException("unreachable");
    }

    private static <E extends Throwable> void throwAs(Throwable fault) throws E {
        throw (E) fault;
    }
}
