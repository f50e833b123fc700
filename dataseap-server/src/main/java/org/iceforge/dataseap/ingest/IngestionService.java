package org.iceforge.dataseap.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.dataseap.config.EngineProperties;
import org.iceforge.dataseap.engine.load.LoadOptions;
import org.iceforge.dataseap.engine.load.LoadResponse;
import org.iceforge.dataseap.engine.load.StreamLoadClient;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validates raw events and stores them with one Stream Load per data type.
 * <p>
 * Each data type maps to the table of the same name. Event columns are {@code event_id},
 * {@code data_source_id} and {@code event_time} plus the keys of {@code data}; events that only carry
 * a raw payload store it as {@code raw_payload}.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private static final DateTimeFormatter EVENT_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private final StreamLoadClient loadClient;
    private final IngestProperties props;
    private final EngineProperties engineProps;
    private final ObjectMapper mapper;

    public IngestionService(StreamLoadClient loadClient, IngestProperties props, EngineProperties engineProps,
                            ObjectMapper mapper) {
        this.loadClient = Objects.requireNonNull(loadClient);
        this.props = Objects.requireNonNull(props);
        this.engineProps = Objects.requireNonNull(engineProps);
        this.mapper = Objects.requireNonNull(mapper);
    }

    public IngestModels.IngestResult ingest(List<IngestModels.RawEvent> events) {
        if (events == null || events.isEmpty()) {
            log.info("No events to ingest");
            return new IngestModels.IngestResult(0, 0, 0, List.of());
        }
        String database = database();
        List<String> errors = new ArrayList<>();
        int validationFailed = 0;
        Map<String, List<Map<String, Object>>> byTable = new LinkedHashMap<>();
        for (IngestModels.RawEvent e : events) {
            String problem = e == null ? "event is null" : e.validationError();
            if (problem != null) {
                validationFailed++;
                log.warn("Event validation failed (id={}, source={}): {}",
                        e == null ? null : e.id(), e == null ? null : e.dataSourceId(), problem);
                errors.add(problem);
                continue;
            }
            byTable.computeIfAbsent(e.dataType(), k -> new ArrayList<>()).add(toRow(e));
        }

        int ingested = 0;
        int persistFailed = 0;
        for (Map.Entry<String, List<Map<String, Object>>> batch : byTable.entrySet()) {
            String table = batch.getKey();
            List<Map<String, Object>> rows = batch.getValue();
            try {
                LoadResponse r = loadClient.streamLoad(database, table, toJson(rows), loadOptions());
                ingested += rows.size();
                log.debug("Loaded {} event(s) into {}.{} (txn={})", rows.size(), database, table, r.txnId());
            } catch (DataseapException ex) {
                persistFailed += rows.size();
                log.warn("Failed to persist {} event(s) into {}.{}: {}", rows.size(), database, table, ex.getMessage());
                errors.add(table + ": " + ex.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Ingestion finished with failures: total={}, succeeded={}, validationFailed={}, persistFailed={}",
                    events.size(), ingested, validationFailed, persistFailed);
        } else {
            log.info("Ingested {} event(s) into {} table(s)", ingested, byTable.size());
        }
        return new IngestModels.IngestResult(ingested, persistFailed, validationFailed, errors);
    }

    private LoadOptions loadOptions() {
        return LoadOptions.json().toBuilder()
                .maxFilterRatio(props.getMaxFilterRatio())
                .timeoutSeconds(props.getLoadTimeoutSeconds())
                .build();
    }

    private String database() {
        String db = props.getDatabase();
        if (db == null || db.isBlank()) {
            db = engineProps.getDatabase();
        }
        if (db == null || db.isBlank()) {
            throw new DataseapException(ErrorCode.CONFIG_ERROR,
                    "No ingest database configured (dataseap.ingest.database or dataseap.engine.database)");
        }
        return db;
    }

    static Map<String, Object> toRow(IngestModels.RawEvent e) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (e.data() != null) {
            row.putAll(e.data());
        } else {
            row.put("raw_payload", new String(e.rawPayload(), StandardCharsets.UTF_8));
        }
        if (e.id() != null && !e.id().isBlank()) {
            row.put("event_id", e.id());
        }
        row.put("data_source_id", e.dataSourceId());
        row.put("event_time", EVENT_TIME.format(e.timestamp()));
        return row;
    }

    private byte[] toJson(List<Map<String, Object>> rows) {
        try {
            return mapper.writeValueAsBytes(rows);
        } catch (JsonProcessingException e) {
            throw new DataseapException(ErrorCode.SERIALIZATION_ERROR, "Failed to encode events: " + e.getOriginalMessage(), e);
        }
    }
}
