package com.ryuqq.opwire.core.context;

import com.ryuqq.opwire.core.spi.TimeSource;

import java.time.Instant;
import java.util.Optional;

/**
 * 부모 신호 + 데드라인.
 */
final class DeadlineSignal implements CancellationSignal {

    private final CancellationSignal parent;
    private final Instant deadline;
    private final TimeSource timeSource;

    DeadlineSignal(CancellationSignal parent, Instant deadline, TimeSource timeSource) {
        this.parent = parent;
        this.deadline = deadline;
        this.timeSource = timeSource;
    }

    @Override
    public boolean isCancelled() {
        return parent.isCancelled() || deadlinePassed();
    }

    @Override
    public Optional<String> reason() {
        Optional<String> parentReason = parent.reason();
        if (parentReason.isPresent()) {
            return parentReason;
        }
        if (deadlinePassed()) {
            return Optional.of("deadline exceeded at " + deadline);
        }
        return Optional.empty();
    }

    @Override
    public Optional<Instant> deadline() {
        return Optional.of(deadline);
    }

    private boolean deadlinePassed() {
        return !timeSource.now().isBefore(deadline);
    }
}
