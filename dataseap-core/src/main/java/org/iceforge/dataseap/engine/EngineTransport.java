package org.iceforge.dataseap.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Shared, pooled HTTP access to the engine frontends.
 * <p>
 * Every call is blocking and fully buffers the response body. Frontends answer stream loads with a
 * 307 redirect to a backend node; the redirect is followed and the credentials are sent again, since
 * the underlying client strips {@code Authorization} when the host changes.
 * <p>
 * Owns its connection pool; {@link #close()} releases it.
 */
public final class EngineTransport implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EngineTransport.class);

    static final int MAX_RESPONSE_BYTES = 64 * 1024 * 1024;

    private final ConnectionProvider pool;
    private final WebClient webClient;
    private final String authorization;
    private final ObjectMapper mapper;
    private final EngineClientConfig config;

    public EngineTransport(EngineClientConfig config) {
        this(config, WebClient.builder());
    }

    public EngineTransport(EngineClientConfig config, WebClient.Builder builder) {
        this.config = Objects.requireNonNull(config, "config");
        this.authorization = "Basic " + HttpHeaders.encodeBasicAuth(config.user(), config.password(), StandardCharsets.UTF_8);
        this.mapper = JsonMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();

        this.pool = ConnectionProvider.builder("dataseap-engine")
                .maxConnections(config.maxConnections())
                .maxIdleTime(Duration.ofSeconds(90))
                .build();
        HttpClient httpClient = HttpClient.create(pool)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .compress(true)
                .followRedirect(
                        (req, res) -> res.status().code() == 307 || res.status().code() == 302,
                        req -> req.header(HttpHeaderNames.AUTHORIZATION, authorization));

        this.webClient = builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }

    @Override
    public void close() {
        pool.dispose();
    }

    boolean isClosed() {
        return pool.isDisposed();
    }

    public EngineClientConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Sends one request and waits for the complete response.
     *
     * @param body request payload, or null for a bodiless request
     * @throws DataseapException with {@link ErrorCode#NETWORK_ERROR} on connect, I/O or deadline failures,
     *         {@link ErrorCode#INVALID_ARGUMENT} when a header value cannot be sent
     */
    public EngineHttpResponse send(HttpMethod method, URI uri, Map<String, String> headers, byte[] body,
                                   Duration timeout, String operation) {
        log.debug("{}: {} {}", operation, method, uri);
        WebClient.RequestBodySpec request = webClient.method(method)
                .uri(uri)
                .headers(h -> {
                    h.set(HttpHeaders.AUTHORIZATION, authorization);
                    headers.forEach(h::set);
                });
        WebClient.RequestHeadersSpec<?> ready = body == null ? request : request.bodyValue(body);
        EngineHttpResponse response;
        try {
            response = ready.exchangeToMono(r -> r.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(b -> new EngineHttpResponse(r.statusCode().value(), b)))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            IllegalArgumentException invalid = findInvalidArgument(cause);
            if (invalid != null) {
                log.error("{} request to {} rejected before sending: {}", operation, uri, invalid.getMessage());
                throw new DataseapException(ErrorCode.INVALID_ARGUMENT,
                        operation + " request to " + uri + " is invalid: " + invalid.getMessage(), cause);
            }
            log.error("{} request to {} failed: {}", operation, uri, cause.toString());
            throw new DataseapException(ErrorCode.NETWORK_ERROR,
                    operation + " request to " + uri + " failed: " + cause, cause);
        }
        if (response == null) {
            throw new DataseapException(ErrorCode.NETWORK_ERROR, operation + ": no response from " + uri);
        }
        log.debug("{}: HTTP {} from {}", operation, response.status(), uri);
        return response;
    }

    // Netty reports prohibited header values as IllegalArgumentException, wrapped by WebClient.
    private static IllegalArgumentException findInvalidArgument(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause() == c ? null : c.getCause()) {
            if (c instanceof IllegalArgumentException iae) {
                return iae;
            }
        }
        return null;
    }

    public byte[] encode(Object value, String operation) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new DataseapException(ErrorCode.SERIALIZATION_ERROR,
                    "Failed to serialize " + operation + " request: " + e.getOriginalMessage(), e);
        }
    }

    public <T> T decode(String body, Class<T> type, String operation) {
        if (body == null || body.isBlank()) {
            throw new DataseapException(ErrorCode.DESERIALIZATION_ERROR, "Empty " + operation + " response body");
        }
        try {
            T value = mapper.readValue(body, type);
            if (value == null) {
                throw new DataseapException(ErrorCode.DESERIALIZATION_ERROR,
                        "Null " + operation + " response, body: " + body);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new DataseapException(ErrorCode.DESERIALIZATION_ERROR,
                    "Failed to parse " + operation + " response: " + e.getOriginalMessage() + ", body: " + body, e);
        }
    }
}
