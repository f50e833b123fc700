package org.iceforge.dataseap.txn;

import org.iceforge.dataseap.engine.txn.BeginResult;
import org.iceforge.dataseap.engine.txn.TransactionCoordinator;
import org.iceforge.dataseap.engine.txn.TransactionState;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 2PC transactions with local leases.
 * <p>
 * A commit of a lease already recorded as committed or aborted fails with {@code INVALID_STATE}
 * without contacting the engine; an abort of such a lease is a no-op. Transaction ids this service
 * never saw are passed to the engine unchanged.
 * <p>
 * A confirmed commit always overwrites the lease. Aborts, including the sweeper's, only replace
 * the exact lease they read, so a concurrent commit is never recorded as aborted.
 */
@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final TransactionCoordinator coordinator;
    private final TransactionLeaseStore store;
    private final TransactionProperties props;
    private final Clock clock;

    @Autowired
    public TransactionService(TransactionCoordinator coordinator, TransactionLeaseStore store, TransactionProperties props) {
        this(coordinator, store, props, Clock.systemUTC());
    }

    TransactionService(TransactionCoordinator coordinator, TransactionLeaseStore store, TransactionProperties props,
                       Clock clock) {
        this.coordinator = Objects.requireNonNull(coordinator);
        this.store = Objects.requireNonNull(store);
        this.props = Objects.requireNonNull(props);
        this.clock = Objects.requireNonNull(clock);
    }

    public TransactionLease begin(String database, String table, String label, Integer timeoutSeconds) {
        int timeout = timeoutSeconds != null && timeoutSeconds > 0 ? timeoutSeconds : props.getDefaultTimeoutSeconds();
        BeginResult result = coordinator.begin(database, table, label, timeout);

        if (result.existing()) {
            Optional<TransactionLease> known = store.findByTxnId(result.txnId());
            if (known.isPresent()) {
                return known.get();
            }
        }
        Instant now = clock.instant();
        TransactionLease lease = new TransactionLease(database, table, label, result.txnId(), TransactionState.BEGUN,
                now, now.plusSeconds(timeout), now);
        store.save(lease);
        return lease;
    }

    public TransactionLease commit(String database, long txnId) {
        Optional<TransactionLease> known = store.findByTxnId(txnId);
        if (known.isPresent() && known.get().state().isTerminal()) {
            throw new DataseapException(ErrorCode.INVALID_STATE,
                    "Transaction " + txnId + " is already " + known.get().state());
        }
        coordinator.commit(database, txnId);
        return record(known, database, txnId, TransactionState.COMMITTED);
    }

    public TransactionLease abort(String database, long txnId) {
        Optional<TransactionLease> known = store.findByTxnId(txnId);
        if (known.isPresent() && known.get().state().isTerminal()) {
            log.info("Transaction {} is already {}, abort ignored", txnId, known.get().state());
            return known.get();
        }
        coordinator.abort(database, txnId);
        if (known.isEmpty()) {
            return record(known, database, txnId, TransactionState.ABORTED);
        }
        TransactionLease updated = known.get().withState(TransactionState.ABORTED, clock.instant());
        if (store.replace(known.get(), updated)) {
            return updated;
        }
        TransactionLease current = store.findByTxnId(txnId).orElse(updated);
        log.warn("Transaction {} changed to {} while aborting, keeping it", txnId, current.state());
        return current;
    }

    public Optional<TransactionLease> find(long txnId) {
        return store.findByTxnId(txnId);
    }

    /**
     * Aborts every open lease past its expiry and forgets terminal leases older than their lifetime.
     *
     * @return number of leases aborted
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int aborted = 0;
        for (TransactionLease lease : store.findAll()) {
            if (lease.isExpired(now)) {
                try {
                    coordinator.abort(lease.database(), lease.txnId());
                    if (store.replace(lease, lease.withState(TransactionState.ABORTED, now))) {
                        aborted++;
                        log.warn("Aborted expired transaction {} (label={}, table={}.{})",
                                lease.txnId(), lease.label(), lease.database(), lease.table());
                    } else {
                        log.info("Expired transaction {} was finished concurrently, sweep leaves it", lease.txnId());
                    }
                } catch (DataseapException e) {
                    log.warn("Could not abort expired transaction {}, will retry: {}", lease.txnId(), e.getMessage());
                }
            } else if (lease.state().isTerminal()) {
                Duration lifetime = Duration.between(lease.createdAt(), lease.expiresAt());
                if (lease.updatedAt().plus(lifetime).isBefore(now)) {
                    store.remove(lease.txnId());
                }
            }
        }
        return aborted;
    }

    private TransactionLease record(Optional<TransactionLease> known, String database, long txnId, TransactionState state) {
        Instant now = clock.instant();
        if (known.isEmpty()) {
            return new TransactionLease(database, null, null, txnId, state, now, now, now);
        }
        TransactionLease updated = known.get().withState(state, now);
        store.save(updated);
        return updated;
    }
}
