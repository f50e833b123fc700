package org.iceforge.dataseap.engine;

/**
 * How an {@link EndpointSelector} picks the next frontend.
 */
public enum SelectionPolicy {
    /** Cycle through the endpoints, starting from a random position. */
    ROUND_ROBIN,
    /** Pick uniformly at random on every call. */
    RANDOM
}
