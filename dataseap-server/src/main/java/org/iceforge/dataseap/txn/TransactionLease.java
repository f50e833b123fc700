package org.iceforge.dataseap.txn;

import org.iceforge.dataseap.engine.txn.TransactionState;

import java.time.Instant;

/**
 * Local record of a 2PC transaction opened through this service.
 */
public record TransactionLease(
        String database,
        String table,
        String label,
        long txnId,
        TransactionState state,
        Instant createdAt,
        Instant expiresAt,
        Instant updatedAt
) {
    public TransactionLease withState(TransactionState next, Instant now) {
        return new TransactionLease(database, table, label, txnId, next, createdAt, expiresAt, now);
    }

    public boolean isExpired(Instant now) {
        return state == TransactionState.BEGUN && now.isAfter(expiresAt);
    }
}
