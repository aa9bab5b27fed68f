package com.ryuqq.opwire.core.context;

import java.time.Instant;
import java.util.Optional;

final class NeverCancelled implements CancellationSignal {

    static final NeverCancelled INSTANCE = new NeverCancelled();

    private NeverCancelled() {
    }

    @Override
    public boolean isCancelled() {
        return false;
    }

    @Override
    public Optional<String> reason() {
        return Optional.empty();
    }

    @Override
    public Optional<Instant> deadline() {
        return Optional.empty();
    }
}
