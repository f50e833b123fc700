package org.iceforge.dataseap.engine;

import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Objects;

/**
 * One engine frontend (FE) HTTP address.
 */
public record Endpoint(String host, int port, EndpointRole role) {

    public Endpoint {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(role, "role");
        if (host.isBlank()) {
            throw new DataseapException(ErrorCode.CONFIG_ERROR, "Endpoint host must not be blank");
        }
        if (port <= 0 || port > 65_535) {
            throw new DataseapException(ErrorCode.CONFIG_ERROR, "Invalid port " + port + " for host " + host);
        }
    }

    /**
     * Parses {@code host} or {@code host:port}, optionally prefixed with {@code http://}.
     */
    public static Endpoint parse(String address, int defaultPort, EndpointRole role) {
        if (address == null || address.isBlank()) {
            throw new DataseapException(ErrorCode.CONFIG_ERROR, "Empty endpoint address");
        }
        String s = address.trim();
        if (s.startsWith("http://")) {
            s = s.substring("http://".length());
        }
        if (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        int colon = s.lastIndexOf(':');
        if (colon < 0) {
            return new Endpoint(s, defaultPort, role);
        }
        String host = s.substring(0, colon);
        String portText = s.substring(colon + 1);
        try {
            return new Endpoint(host, Integer.parseInt(portText), role);
        } catch (NumberFormatException e) {
            throw new DataseapException(ErrorCode.CONFIG_ERROR, "Invalid port in endpoint '" + address + "'", e);
        }
    }

    public UriComponentsBuilder uriBuilder() {
        return UriComponentsBuilder.newInstance().scheme("http").host(host).port(port);
    }

    @Override
    public String toString() {
        return host + ":" + port + "(" + role + ")";
    }
}
