package com.ryuqq.opwire.testkit.recording;

import com.ryuqq.opwire.core.transaction.AbstractTransactionHandle;

/**
 * Transaction handle that only reports its terminal calls to its provider.
 *
 * @author Opwire Team
 * @since 1.0.0
 */
public final class RecordingTransaction extends AbstractTransactionHandle {

    private final RecordingTransactionProvider provider;
    private final int sequence;

    RecordingTransaction(RecordingTransactionProvider provider, int sequence) {
        this.provider = provider;
        this.sequence = sequence;
    }

    /**
     * @return 1-based order in which this handle was opened
     */
    public int getSequence() {
        return sequence;
    }

    @Override
    protected void doCommit() {
        provider.onCommit(this);
    }

    @Override
    protected void doRollback() {
        provider.onRollback(this);
    }

    @Override
    public String toString() {
        return "RecordingTransaction#" + sequence + "[" + state() + "]";
    }
}
