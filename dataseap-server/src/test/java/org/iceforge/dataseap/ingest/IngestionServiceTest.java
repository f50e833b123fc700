package org.iceforge.dataseap.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.dataseap.config.EngineProperties;
import org.iceforge.dataseap.engine.load.LoadOptions;
import org.iceforge.dataseap.engine.load.LoadResponse;
import org.iceforge.dataseap.engine.load.StreamLoadClient;
import org.iceforge.dataseap.engine.load.StreamLoadFailedException;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class IngestionServiceTest {

    private static final Instant TS = Instant.parse("2024-05-01T10:15:30Z");

    private StreamLoadClient loadClient;
    private IngestProperties props;
    private EngineProperties engineProps;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        loadClient = mock(StreamLoadClient.class);
        props = new IngestProperties();
        engineProps = new EngineProperties();
        engineProps.setDatabase("security");
        service = new IngestionService(loadClient, props, engineProps, new ObjectMapper());
    }

    @Test
    void ingest_groupsByDataTypeAndLoadsJsonArrays() throws Exception {
        when(loadClient.streamLoad(eq("security"), any(String.class), any(byte[].class), any(LoadOptions.class)))
                .thenReturn(success());

        IngestModels.IngestResult r = service.ingest(List.of(
                event("e1", "firewall_log", Map.of("src_ip", "10.0.0.1")),
                event("e2", "edr_event", Map.of("pid", 42)),
                event("e3", "firewall_log", Map.of("src_ip", "10.0.0.2"))));

        assertEquals(new IngestModels.IngestResult(3, 0, 0, List.of()), r);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        ArgumentCaptor<LoadOptions> opts = ArgumentCaptor.forClass(LoadOptions.class);
        verify(loadClient).streamLoad(eq("security"), eq("firewall_log"), body.capture(), opts.capture());
        verify(loadClient).streamLoad(eq("security"), eq("edr_event"), any(byte[].class), any(LoadOptions.class));

        JsonNode rows = new ObjectMapper().readTree(new String(body.getValue(), StandardCharsets.UTF_8));
        assertEquals(2, rows.size());
        assertEquals("10.0.0.1", rows.get(0).get("src_ip").asText());
        assertEquals("e1", rows.get(0).get("event_id").asText());
        assertEquals("sensor-1", rows.get(0).get("data_source_id").asText());
        assertEquals("2024-05-01 10:15:30.000", rows.get(0).get("event_time").asText());
        assertTrue(opts.getValue().stripOuterArray());
    }

    @Test
    void ingest_countsValidationFailuresWithoutLoadingThem() {
        when(loadClient.streamLoad(any(String.class), any(String.class), any(byte[].class), any(LoadOptions.class)))
                .thenReturn(success());

        IngestModels.IngestResult r = service.ingest(List.of(
                event("ok", "firewall_log", Map.of("a", 1)),
                new IngestModels.RawEvent("bad1", "", "firewall_log", TS, Map.of("a", 1), null, null),
                new IngestModels.RawEvent("bad2", "sensor-1", "firewall_log", null, Map.of("a", 1), null, null),
                new IngestModels.RawEvent("bad3", "sensor-1", "firewall_log", TS, null, null, null),
                new IngestModels.RawEvent("bad4", "sensor-1", "drop table", TS, Map.of("a", 1), null, null)));

        assertEquals(1, r.ingested());
        assertEquals(4, r.validationFailed());
        assertEquals(0, r.persistFailed());
        assertEquals(4, r.errors().size());
    }

    @Test
    void ingest_countsPersistFailuresPerBatch() {
        when(loadClient.streamLoad(eq("security"), eq("edr_event"), any(byte[].class), any(LoadOptions.class)))
                .thenThrow(new StreamLoadFailedException("too many filtered rows", null));
        when(loadClient.streamLoad(eq("security"), eq("firewall_log"), any(byte[].class), any(LoadOptions.class)))
                .thenReturn(success());

        IngestModels.IngestResult r = service.ingest(List.of(
                event("e1", "firewall_log", Map.of("a", 1)),
                event("e2", "edr_event", Map.of("b", 1)),
                event("e3", "edr_event", Map.of("b", 2))));

        assertEquals(1, r.ingested());
        assertEquals(2, r.persistFailed());
        assertFalse(r.allSucceeded());
    }

    @Test
    void ingest_rawPayloadOnlyEventIsStoredAsText() {
        IngestModels.RawEvent e = new IngestModels.RawEvent(null, "sensor-9", "syslog", TS, null,
                "<13>Jan 1 host msg".getBytes(StandardCharsets.UTF_8), null);

        Map<String, Object> row = IngestionService.toRow(e);

        assertEquals("<13>Jan 1 host msg", row.get("raw_payload"));
        assertFalse(row.containsKey("event_id"));
    }

    @Test
    void ingest_emptyBatchIsNoop() {
        assertEquals(new IngestModels.IngestResult(0, 0, 0, List.of()), service.ingest(List.of()));
        verifyNoInteractions(loadClient);
    }

    @Test
    void ingest_ingestDatabaseOverridesEngineDefault() {
        props.setDatabase("raw_events");
        when(loadClient.streamLoad(eq("raw_events"), eq("syslog"), any(byte[].class), any(LoadOptions.class)))
                .thenReturn(success());

        IngestModels.IngestResult r = service.ingest(List.of(event("e1", "syslog", Map.of("m", "x"))));

        assertEquals(1, r.ingested());
    }

    @Test
    void ingest_withoutAnyDatabaseIsConfigError() {
        engineProps.setDatabase(null);

        DataseapException e = assertThrows(DataseapException.class,
                () -> service.ingest(List.of(event("e1", "syslog", Map.of("m", "x")))));

        assertEquals(ErrorCode.CONFIG_ERROR, e.code());
    }

    private static IngestModels.RawEvent event(String id, String type, Map<String, Object> data) {
        return new IngestModels.RawEvent(id, "sensor-1", type, TS, data, null, Map.of());
    }

    private static LoadResponse success() {
        return new LoadResponse(1, "l", "Success", null, null, "OK", 1, 1, 0, 0, 10, 5, 0, 0, 0, 0, 0, null);
    }
}
