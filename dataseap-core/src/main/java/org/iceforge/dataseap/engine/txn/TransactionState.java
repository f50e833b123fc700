package org.iceforge.dataseap.engine.txn;

public enum TransactionState {
    BEGUN,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ABORTED;
    }
}
