package org.iceforge.dataseap.engine.txn;

import org.iceforge.dataseap.engine.Endpoint;
import org.iceforge.dataseap.engine.EndpointSelector;
import org.iceforge.dataseap.engine.EngineHttpResponse;
import org.iceforge.dataseap.engine.EngineTransport;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class HttpTransactionCoordinator implements TransactionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(HttpTransactionCoordinator.class);

    static final int DEFAULT_TIMEOUT_SECONDS = 600;

    private final EngineTransport transport;
    private final EndpointSelector selector;

    public HttpTransactionCoordinator(EngineTransport transport, EndpointSelector loadSelector) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.selector = Objects.requireNonNull(loadSelector, "loadSelector");
    }

    @Override
    public BeginResult begin(String database, String table, String label, int timeoutSeconds) {
        requireName(database, "database");
        requireName(table, "table");
        requireName(label, "label");
        int timeout = timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;

        Endpoint endpoint = selector.next();
        URI uri = endpoint.uriBuilder()
                .pathSegment("api", database, table, "_stream_load_2pc")
                .queryParam("txn_action", "begin")
                .build()
                .encode()
                .toUri();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("label", label);
        headers.put("timeout", Integer.toString(timeout));

        TransactionControlResponse response = call(uri, headers, "2pc begin");
        if (response.existingTxnId() != null && response.existingTxnId() > 0) {
            log.info("Label {} on {}.{} already has open transaction {}", label, database, table, response.existingTxnId());
            return new BeginResult(response.existingTxnId(), label, true);
        }
        if (!response.isSuccess() || response.txnId() == null) {
            log.error("2PC begin for label {} on {}.{} failed: status={}, msg={}",
                    label, database, table, response.status(), response.message());
            throw new DataseapException(ErrorCode.DATABASE_ERROR, "Begin transaction for label " + label
                    + " failed: status=" + response.status() + ", msg=" + response.message());
        }
        log.info("Began transaction {} for label {} on {}.{}", response.txnId(), label, database, table);
        return new BeginResult(response.txnId(), label, false);
    }

    @Override
    public void commit(String database, long txnId) {
        TransactionControlResponse response = control(database, txnId, "commit");
        if (!response.isSuccess()) {
            log.error("Commit of transaction {} in {} failed: status={}, msg={}",
                    txnId, database, response.status(), response.message());
            throw new DataseapException(ErrorCode.DATABASE_ERROR, "Commit of transaction " + txnId
                    + " failed: status=" + response.status() + ", msg=" + response.message());
        }
        log.info("Committed transaction {} in {}", txnId, database);
    }

    @Override
    public void abort(String database, long txnId) {
        TransactionControlResponse response = control(database, txnId, "abort");
        if (!response.isSuccess()) {
            log.warn("Abort of transaction {} in {} not acknowledged: status={}, msg={}",
                    txnId, database, response.status(), response.message());
            return;
        }
        log.info("Aborted transaction {} in {}", txnId, database);
    }

    private TransactionControlResponse control(String database, long txnId, String action) {
        requireName(database, "database");
        Endpoint endpoint = selector.next();
        URI uri = endpoint.uriBuilder()
                .pathSegment("api", database, "_stream_load_2pc")
                .queryParam("txn_action", action)
                .queryParam("txn_id", txnId)
                .build()
                .encode()
                .toUri();
        return call(uri, Map.of(), "2pc " + action);
    }

    private TransactionControlResponse call(URI uri, Map<String, String> headers, String operation) {
        Duration deadline = transport.config().queryTimeout().plus(transport.config().connectTimeout());
        EngineHttpResponse http = transport.send(HttpMethod.PUT, uri, headers, null, deadline, operation);
        return transport.decode(http.body(), TransactionControlResponse.class, operation);
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw DataseapException.invalidArgument(what + " must not be empty");
        }
    }
}
