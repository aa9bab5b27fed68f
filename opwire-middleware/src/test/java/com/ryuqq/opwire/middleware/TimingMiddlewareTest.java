package com.ryuqq.opwire.middleware;

import com.ryuqq.opwire.core.context.ExecutionContext;
import com.ryuqq.opwire.core.error.BusinessRuleError;
import com.ryuqq.opwire.core.error.ErrorCategory;
import com.ryuqq.opwire.core.outcome.Outcome;
import com.ryuqq.opwire.core.spi.TimingRecorder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

/**
 * TimingMiddleware 유닛 테스트.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TimingMiddlewareTest {

    @Mock
    private TimingRecorder recorder;

    @Test
    void wrap_성공_시_카테고리_없이_소요시간_기록() {
        // given
        StubTimeSource time = new StubTimeSource();
        TimingMiddleware<String, String> middleware = TimingMiddleware.create("get-entity", recorder, time);

        // when
        middleware.wrap((ctx, request) -> {
            time.advance(Duration.ofNanos(1_500));
            return Outcome.ok(request);
        }).invoke(ExecutionContext.background(), "id-1");

        // then
        verify(recorder).record(eq("get-entity"), isNull(), eq(1_500L));
    }

    @Test
    void wrap_실패_시_오류_카테고리_기록() {
        // given
        StubTimeSource time = new StubTimeSource();
        TimingMiddleware<String, String> middleware = TimingMiddleware.create("get-entity", recorder, time);

        // when
        middleware.wrap((ctx, request) -> Outcome.<String>fail(BusinessRuleError.of("NOT_FOUND", "missing")))
            .invoke(ExecutionContext.background(), "id-1");

        // then
        verify(recorder).record("get-entity", ErrorCategory.BUSINESS_RULE, 0L);
    }

    @Test
    void wrap_예외_시_DEPENDENCY로_기록_후_재전파() {
        // given
        StubTimeSource time = new StubTimeSource();
        TimingMiddleware<String, String> middleware = TimingMiddleware.create("get-entity", recorder, time);

        // when & then
        assertThatThrownBy(() -> middleware.wrap((ctx, request) -> {
            throw new IllegalStateException("bug");
        }).invoke(ExecutionContext.background(), "id-1"))
            .isInstanceOf(IllegalStateException.class);
        verify(recorder).record("get-entity", ErrorCategory.DEPENDENCY, 0L);
    }

    @Test
    void wrap_선언되지_않은_checked_예외도_기록_후_재전파() {
        // given
        StubTimeSource time = new StubTimeSource();
        TimingMiddleware<String, String> middleware = TimingMiddleware.create("get-entity", recorder, time);
        IOException fault = new IOException("disk");

        // when & then
        assertThatThrownBy(() -> middleware.wrap((ctx, request) -> {
            time.advance(Duration.ofNanos(700));
            throw Faults.undeclared(fault);
        }).invoke(ExecutionContext.background(), "id-1"))
            .isSameAs(fault);
        verify(recorder).record("get-entity", ErrorCategory.DEPENDENCY, 700L);
    }
}
