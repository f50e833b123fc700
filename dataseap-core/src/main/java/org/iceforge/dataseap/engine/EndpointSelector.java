package org.iceforge.dataseap.engine;

import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Hands out one configured frontend per call.
 * <p>
 * There is no health checking or failover here: an unreachable frontend is only noticed when the
 * request sent to it fails.
 */
public final class EndpointSelector {

    private final List<Endpoint> endpoints;
    private final SelectionPolicy policy;
    private final Object lock = new Object();
    private int nextIndex;

    public EndpointSelector(List<Endpoint> endpoints, SelectionPolicy policy) {
        this(endpoints, policy, -1);
    }

    EndpointSelector(List<Endpoint> endpoints, SelectionPolicy policy, int startIndex) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new DataseapException(ErrorCode.CONFIG_ERROR, "No engine frontend endpoints configured");
        }
        this.endpoints = List.copyOf(endpoints);
        this.policy = Objects.requireNonNull(policy, "policy");
        this.nextIndex = startIndex >= 0
                ? startIndex % this.endpoints.size()
                : ThreadLocalRandom.current().nextInt(this.endpoints.size());
    }

    public Endpoint next() {
        if (endpoints.size() == 1) {
            return endpoints.get(0);
        }
        if (policy == SelectionPolicy.RANDOM) {
            return endpoints.get(ThreadLocalRandom.current().nextInt(endpoints.size()));
        }
        synchronized (lock) {
            Endpoint e = endpoints.get(nextIndex);
            nextIndex = (nextIndex + 1) % endpoints.size();
            return e;
        }
    }

    public List<Endpoint> endpoints() {
        return endpoints;
    }

    public SelectionPolicy policy() {
        return policy;
    }
}
