package org.iceforge.dataseap.engine;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable connection settings for the engine frontends.
 *
 * @param hosts           frontend addresses used for queries, {@code host} or {@code host:port}
 * @param loadHosts       frontend addresses used for stream load and 2PC control; empty means {@code hosts}
 * @param httpPort        port applied to addresses that carry none
 * @param database        default database sent with queries; may be null
 * @param querySelection  how query traffic picks a frontend (load traffic always round-robins)
 */
public record EngineClientConfig(
        List<String> hosts,
        List<String> loadHosts,
        int httpPort,
        String user,
        String password,
        String database,
        Duration connectTimeout,
        Duration queryTimeout,
        SelectionPolicy querySelection,
        int maxConnections
) {
    public static final int DEFAULT_HTTP_PORT = 8030;

    public EngineClientConfig {
        hosts = hosts == null ? List.of() : List.copyOf(hosts);
        loadHosts = loadHosts == null ? List.of() : List.copyOf(loadHosts);
        if (httpPort <= 0) httpPort = DEFAULT_HTTP_PORT;
        user = Objects.requireNonNullElse(user, "root");
        password = Objects.requireNonNullElse(password, "");
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            connectTimeout = Duration.ofSeconds(10);
        }
        if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) {
            queryTimeout = Duration.ofSeconds(30);
        }
        querySelection = Objects.requireNonNullElse(querySelection, SelectionPolicy.RANDOM);
        if (maxConnections <= 0) maxConnections = 100;
    }

    public static EngineClientConfig of(List<String> hosts, String user, String password, String database) {
        return new EngineClientConfig(hosts, List.of(), DEFAULT_HTTP_PORT, user, password, database,
                null, null, null, 0);
    }

    public List<Endpoint> queryEndpoints() {
        return hosts.stream().map(h -> Endpoint.parse(h, httpPort, EndpointRole.QUERY)).toList();
    }

    public List<Endpoint> loadEndpoints() {
        List<String> source = loadHosts.isEmpty() ? hosts : loadHosts;
        return source.stream().map(h -> Endpoint.parse(h, httpPort, EndpointRole.LOAD)).toList();
    }

    @Override
    public String toString() {
        return "EngineClientConfig[hosts=" + hosts + ", loadHosts=" + loadHosts + ", httpPort=" + httpPort
                + ", user=" + user + ", database=" + database + ", connectTimeout=" + connectTimeout
                + ", queryTimeout=" + queryTimeout + ", querySelection=" + querySelection + "]";
    }
}
