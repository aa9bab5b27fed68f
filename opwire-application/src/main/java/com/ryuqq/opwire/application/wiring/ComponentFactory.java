package com.ryuqq.opwire.application.wiring;

/**
 * Builds one component from its declared dependencies.
 *
 * <p>Called exactly once per {@link WiringPlan#assemble()}. Any exception aborts the assembly.</p>
 *
 * @param <T> component type
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ComponentFactory<T> {

    T create(Dependencies dependencies) throws Exception;
}
