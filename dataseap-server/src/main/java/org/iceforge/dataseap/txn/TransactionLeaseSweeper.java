package org.iceforge.dataseap.txn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class TransactionLeaseSweeper {

    private static final Logger log = LoggerFactory.getLogger(TransactionLeaseSweeper.class);

    private final TransactionService transactions;
    private final TransactionProperties props;

    public TransactionLeaseSweeper(TransactionService transactions, TransactionProperties props) {
        this.transactions = Objects.requireNonNull(transactions);
        this.props = Objects.requireNonNull(props);
    }

    @Scheduled(fixedDelayString = "${dataseap.transactions.sweep-interval-ms:30000}",
            initialDelayString = "${dataseap.transactions.sweep-interval-ms:30000}")
    public void sweep() {
        if (!props.isSweepEnabled()) {
            return;
        }
        int aborted = transactions.sweepExpired();
        if (aborted > 0) {
            log.info("Lease sweep aborted {} expired transaction(s)", aborted);
        }
    }
}
