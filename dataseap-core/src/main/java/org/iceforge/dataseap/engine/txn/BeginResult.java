package org.iceforge.dataseap.engine.txn;

/**
 * Outcome of a 2PC begin.
 *
 * @param existing true when the label already had an open transaction and {@code txnId} is that one
 */
public record BeginResult(long txnId, String label, boolean existing) {
}
