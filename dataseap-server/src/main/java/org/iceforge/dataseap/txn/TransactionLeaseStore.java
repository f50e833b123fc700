package org.iceforge.dataseap.txn;

import java.util.List;
import java.util.Optional;

public interface TransactionLeaseStore {

    void save(TransactionLease lease);

    Optional<TransactionLease> findByTxnId(long txnId);

    /**
     * Stores {@code updated} only if the current lease for its id still equals {@code expected}.
     *
     * @return false when the lease changed or disappeared in the meantime
     */
    boolean replace(TransactionLease expected, TransactionLease updated);

    List<TransactionLease> findAll();

    void remove(long txnId);
}
