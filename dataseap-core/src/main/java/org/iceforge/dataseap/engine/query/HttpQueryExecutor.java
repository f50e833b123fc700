package org.iceforge.dataseap.engine.query;

import org.iceforge.dataseap.engine.Endpoint;
import org.iceforge.dataseap.engine.EndpointSelector;
import org.iceforge.dataseap.engine.EngineHttpResponse;
import org.iceforge.dataseap.engine.EngineTransport;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs SQL through the frontend {@code /api/v1/query} endpoint.
 */
public final class HttpQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpQueryExecutor.class);

    static final String QUERY_PATH = "/api/v1/query";
    static final String CONTENT_TYPE_JSON = "application/json;charset=UTF-8";

    private final EngineTransport transport;
    private final EndpointSelector selector;

    public HttpQueryExecutor(EngineTransport transport, EndpointSelector selector) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    @Override
    public QueryResult execute(QueryStatement statement) {
        Objects.requireNonNull(statement, "statement");
        String sql = statement.sql();
        if (sql == null || sql.isBlank()) {
            throw DataseapException.invalidArgument("SQL must not be empty");
        }
        if (!statement.args().isEmpty()) {
            log.warn("Engine query API has no parameter binding; ignoring {} positional argument(s), SQL is sent as-is",
                    statement.args().size());
        }

        Endpoint endpoint = selector.next();
        URI uri = endpoint.uriBuilder().path(QUERY_PATH).build().toUri();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON);
        String database = statement.database() != null && !statement.database().isBlank()
                ? statement.database()
                : transport.config().database();
        if (database != null && !database.isBlank()) {
            headers.put("Database", database);
        }
        Duration timeout = statement.timeout() != null ? statement.timeout() : transport.config().queryTimeout();

        log.debug("Executing on {}: {}", endpoint, sql);
        byte[] payload = transport.encode(Map.of("sql", sql), "query");
        EngineHttpResponse response = transport.send(HttpMethod.POST, uri, headers, payload, timeout, "query");

        if (!response.isOk()) {
            log.error("Engine query failed with HTTP {} on {}", response.status(), endpoint);
            throw new DataseapException(ErrorCode.DATABASE_ERROR,
                    "Engine query failed: HTTP " + response.status() + ", response: " + response.body());
        }

        QueryEnvelope envelope = transport.decode(response.body(), QueryEnvelope.class, "query");
        if (envelope.code() == null) {
            throw new DataseapException(ErrorCode.DESERIALIZATION_ERROR,
                    "Query response carries no code, body: " + response.body());
        }
        if (envelope.code() != 0) {
            log.error("Engine query error code {} on {}: {}", envelope.code(), endpoint, envelope.msg());
            throw new DataseapException(ErrorCode.DATABASE_ERROR,
                    "Engine query error: code " + envelope.code() + ", msg: " + envelope.msg()
                            + ", response: " + response.body());
        }
        return toResult(envelope.data());
    }

    private static QueryResult toResult(QueryEnvelope.Data data) {
        if (data == null) {
            return new QueryResult(List.of(), List.of(), null);
        }
        List<String> columns = new ArrayList<>();
        if (data.meta() != null) {
            for (QueryEnvelope.Column c : data.meta()) {
                columns.add(c.name());
            }
        }
        return new QueryResult(columns, data.result(), QueryStats.fromProperties(data.property()));
    }
}
