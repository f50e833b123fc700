package org.iceforge.dataseap.engine.load;

import org.iceforge.dataseap.engine.Endpoint;
import org.iceforge.dataseap.engine.EndpointSelector;
import org.iceforge.dataseap.engine.EngineHttpResponse;
import org.iceforge.dataseap.engine.EngineTransport;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Synchronous Stream Load over {@code PUT /api/{db}/{table}/_stream_load}.
 * <p>
 * The payload is read fully into memory before sending so that it can be replayed when the
 * frontend redirects to a backend. Callers split very large loads themselves.
 */
public final class HttpStreamLoadClient implements StreamLoadClient {

    private static final Logger log = LoggerFactory.getLogger(HttpStreamLoadClient.class);

    private final EngineTransport transport;
    private final EndpointSelector selector;

    public HttpStreamLoadClient(EngineTransport transport, EndpointSelector loadSelector) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.selector = Objects.requireNonNull(loadSelector, "loadSelector");
    }

    @Override
    public LoadResponse streamLoad(String database, String table, InputStream data, LoadOptions options) {
        requireName(database, "database");
        requireName(table, "table");
        Objects.requireNonNull(data, "data");
        LoadOptions opts = options == null ? LoadOptions.json() : options;

        byte[] payload;
        try {
            payload = data.readAllBytes();
        } catch (IOException e) {
            throw new DataseapException(ErrorCode.SERIALIZATION_ERROR,
                    "Failed to read load payload for " + database + "." + table, e);
        }

        Endpoint endpoint = selector.next();
        URI uri = endpoint.uriBuilder()
                .pathSegment("api", database, table, "_stream_load")
                .build()
                .encode()
                .toUri();
        Duration deadline = Duration.ofSeconds(opts.timeoutSeconds()).plus(transport.config().connectTimeout());

        log.debug("Stream load of {} bytes into {}.{} via {} (label={})",
                payload.length, database, table, endpoint, opts.label());
        EngineHttpResponse http = transport.send(HttpMethod.PUT, uri, headers(opts), payload, deadline, "stream load");

        LoadResponse response;
        try {
            response = transport.decode(http.body(), LoadResponse.class, "stream load");
        } catch (DataseapException e) {
            log.error("Stream load into {}.{} returned HTTP {} with an unreadable body", database, table, http.status());
            throw e;
        }

        if (response.isPublishTimeout()) {
            log.warn("Stream load into {}.{} (label={}, txn={}) hit Publish Timeout; data probably landed, verify before reloading",
                    database, table, response.label(), response.txnId());
            return response;
        }
        if (response.isLabelAlreadyExists()) {
            log.error("Stream load into {}.{} reused label {}: existing job {} is {}",
                    database, table, response.label(), response.existingTxnId(), response.existingJobStatus());
            throw new StreamLoadFailedException("Stream load into " + database + "." + table + " failed: label "
                    + response.label() + " already used by transaction " + response.existingTxnId()
                    + " (" + response.existingJobStatus() + ")", response);
        }
        if (!response.isSuccess()) {
            log.error("Stream load into {}.{} failed: status={}, message={}, errorURL={}",
                    database, table, response.status(), response.message(), response.errorUrl());
            throw new StreamLoadFailedException("Stream load into " + database + "." + table + " failed: status="
                    + response.status() + ", message=" + response.message() + ", errorURL=" + response.errorUrl(),
                    response);
        }
        if (!response.rowCountsConsistent()) {
            log.warn("Stream load into {}.{} reported inconsistent row counts: total={}, loaded={}, filtered={}, unselected={}",
                    database, table, response.numberTotalRows(), response.numberLoadedRows(),
                    response.numberFilteredRows(), response.numberUnselectedRows());
        }
        log.info("Stream load into {}.{} done: label={}, txn={}, loaded={}/{}, filtered={}, {} ms",
                database, table, response.label(), response.txnId(), response.numberLoadedRows(),
                response.numberTotalRows(), response.numberFilteredRows(), response.loadTimeMs());
        return response;
    }

    static Map<String, String> headers(LoadOptions opts) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("Expect", "100-continue");
        h.put("format", opts.format().wireName());
        if (opts.format() == LoadFormat.CSV) {
            if (opts.columnSeparator() != null && !opts.columnSeparator().isEmpty()) {
                h.put("column_separator", separatorHeader(opts.columnSeparator()));
            }
            if (opts.rowDelimiter() != null && !opts.rowDelimiter().isEmpty()) {
                h.put("row_delimiter", separatorHeader(opts.rowDelimiter()));
            }
        }
        if (opts.format() == LoadFormat.JSON && opts.stripOuterArray()) {
            h.put("strip_outer_array", "true");
        }
        if (opts.maxFilterRatio() > 0) {
            h.put("max_filter_ratio", Double.toString(opts.maxFilterRatio()));
        }
        h.put("timeout", Integer.toString(opts.timeoutSeconds()));
        if (opts.mergeCondition() != null && !opts.mergeCondition().isBlank()) {
            h.put("merge_condition", opts.mergeCondition());
        }
        if (opts.label() != null && !opts.label().isBlank()) {
            h.put("label", opts.label());
        }
        if (opts.twoPhaseCommit() && opts.transactionId() != null) {
            h.put("txn_id", Long.toString(opts.transactionId()));
            h.put("two_phase_commit", "true");
        }
        h.putAll(opts.headers());
        return h;
    }

    /**
     * Header values may not carry control characters, and leading or trailing blanks are trimmed,
     * so those characters travel in the engine's {@code \xHH} form.
     */
    static String separatorHeader(String separator) {
        StringBuilder sb = new StringBuilder(separator.length());
        for (int i = 0; i < separator.length(); i++) {
            char c = separator.charAt(i);
            if (c <= 0x20 || c == 0x7f) {
                sb.append(String.format("\\x%02x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw DataseapException.invalidArgument(what + " must not be empty");
        }
    }
}
