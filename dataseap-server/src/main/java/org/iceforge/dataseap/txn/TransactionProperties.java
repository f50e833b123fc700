package org.iceforge.dataseap.txn;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dataseap.transactions")
public class TransactionProperties {

    /** Timeout sent on begin when the caller gives none; also the lease lifetime. */
    private int defaultTimeoutSeconds = 600;

    private long sweepIntervalMs = 30_000;

    /** Abort leases left open past their expiry. */
    private boolean sweepEnabled = true;

    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public boolean isSweepEnabled() {
        return sweepEnabled;
    }

    public void setSweepEnabled(boolean sweepEnabled) {
        this.sweepEnabled = sweepEnabled;
    }
}
