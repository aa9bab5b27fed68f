package com.ryuqq.opwire.adapter.inmemory.time;

import com.ryuqq.opwire.core.spi.Sleeper;
import com.ryuqq.opwire.core.spi.TimeSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Time source that only moves when told to.
 *
 * <p>Wall clock and monotonic clock advance together. {@link #sleeper()} returns a
 * {@link Sleeper} that advances this clock instead of blocking, so retry backoff runs
 * instantly and deterministically in tests.</p>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class ManualTimeSource implements TimeSource {

    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private Instant now;
    private long nanos;

    public ManualTimeSource() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public ManualTimeSource(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    @Override
    public synchronized long nanoTime() {
        return nanos;
    }

    public synchronized void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative (current: " + duration + ")");
        }
        now = now.plus(duration);
        nanos += duration.toNanos();
    }

    public Sleeper sleeper() {
        return duration -> {
            sleeps.add(duration);
            advance(duration);
        };
    }

    /**
     * @return every duration passed to {@link #sleeper()} so far
     */
    public List<Duration> sleeps() {
        synchronized (sleeps) {
            return List.copyOf(sleeps);
        }
    }
}
