package org.iceforge.dataseap.engine.txn;

/**
 * Explicit begin/commit/abort for two-phase-commit Stream Loads.
 * <p>
 * Loads join a transaction through {@code LoadOptions.Builder#transaction(long)}. Nothing here
 * guards against committing or aborting the same id twice; the engine decides.
 */
public interface TransactionCoordinator {

    BeginResult begin(String database, String table, String label, int timeoutSeconds);

    void commit(String database, long txnId);

    /** A rejection by the engine is logged, not raised. */
    void abort(String database, long txnId);
}
