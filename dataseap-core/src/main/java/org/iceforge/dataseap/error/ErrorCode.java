package org.iceforge.dataseap.error;

/**
 * Failure categories surfaced by the engine client and the services built on it.
 */
public enum ErrorCode {
    /** Transport-level failure: connect, read, timeout, premature close. */
    NETWORK_ERROR,
    /** The engine answered with a non-success status or a non-zero envelope code. */
    DATABASE_ERROR,
    SERIALIZATION_ERROR,
    DESERIALIZATION_ERROR,
    INVALID_ARGUMENT,
    /** Operation not allowed in the current state of a tracked resource. */
    INVALID_STATE,
    CONFIG_ERROR,
    NOT_FOUND,
    INTERNAL_ERROR
}
