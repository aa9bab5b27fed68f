package com.ryuqq.opwire.testkit.recording;

import com.ryuqq.opwire.core.context.ContextKey;
import com.ryuqq.opwire.core.spi.TransactionProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transaction provider that counts begin, commit and rollback calls.
 *
 * <p>Failures can be injected for the next {@code begin()} or {@code commit()} to drive the
 * transaction middleware's error paths.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * RecordingTransactionProvider provider = new RecordingTransactionProvider("orders");
 * Operation<Req, Res> op = TransactionMiddleware.<Req, Res, RecordingTransaction>create(provider).wrap(base);
 * op.invoke(ctx, request);
 * assertThat(provider.getCommitCount()).isEqualTo(1);
 * }</pre>
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class RecordingTransactionProvider implements TransactionProvider<RecordingTransaction> {

    private final ContextKey<RecordingTransaction> contextKey;
    private final AtomicInteger begins = new AtomicInteger();
    private final AtomicInteger commits = new AtomicInteger();
    private final AtomicInteger rollbacks = new AtomicInteger();
    private final List<RecordingTransaction> opened = new ArrayList<>();

    private volatile RuntimeException nextBeginFailure;
    private volatile RuntimeException nextCommitFailure;

    public RecordingTransactionProvider(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.contextKey = ContextKey.named("recording-tx:" + name);
    }

    @Override
    public ContextKey<RecordingTransaction> contextKey() {
        return contextKey;
    }

    @Override
    public RecordingTransaction begin() {
        RuntimeException failure = nextBeginFailure;
        if (failure != null) {
            nextBeginFailure = null;
            throw failure;
        }
        RecordingTransaction handle = new RecordingTransaction(this, begins.incrementAndGet());
        synchronized (opened) {
            opened.add(handle);
        }
        return handle;
    }

    public void failNextBegin(RuntimeException failure) {
        this.nextBeginFailure = failure;
    }

    public void failNextCommit(RuntimeException failure) {
        this.nextCommitFailure = failure;
    }

    public int getBeginCount() {
        return begins.get();
    }

    public int getCommitCount() {
        return commits.get();
    }

    public int getRollbackCount() {
        return rollbacks.get();
    }

    public List<RecordingTransaction> getOpened() {
        synchronized (opened) {
            return List.copyOf(opened);
        }
    }

    void onCommit(RecordingTransaction handle) {
        RuntimeException failure = nextCommitFailure;
        if (failure != null) {
            nextCommitFailure = null;
            throw failure;
        }
        commits.incrementAndGet();
    }

    void onRollback(RecordingTransaction handle) {
        rollbacks.incrementAndGet();
    }
}
