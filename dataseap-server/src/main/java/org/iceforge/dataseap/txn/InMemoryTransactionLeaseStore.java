package org.iceforge.dataseap.txn;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local lease store. Leases are lost on restart; the engine still expires their
 * transactions after the begin timeout.
 */
@Component
public class InMemoryTransactionLeaseStore implements TransactionLeaseStore {

    private final ConcurrentHashMap<Long, TransactionLease> leases = new ConcurrentHashMap<>();

    @Override
    public void save(TransactionLease lease) {
        leases.put(lease.txnId(), lease);
    }

    @Override
    public Optional<TransactionLease> findByTxnId(long txnId) {
        return Optional.ofNullable(leases.get(txnId));
    }

    @Override
    public boolean replace(TransactionLease expected, TransactionLease updated) {
        return leases.replace(expected.txnId(), expected, updated);
    }

    @Override
    public List<TransactionLease> findAll() {
        return List.copyOf(leases.values());
    }

    @Override
    public void remove(long txnId) {
        leases.remove(txnId);
    }
}
