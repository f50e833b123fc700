package org.iceforge.dataseap.ingest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class IngestModels {
    private IngestModels() {}

    /**
     * One event from a data source. {@code dataType} names the target table.
     */
    public record RawEvent(
            String id,
            String dataSourceId,
            String dataType,
            Instant timestamp,
            Map<String, Object> data,
            byte[] rawPayload,
            Map<String, String> tags
    ) {
        /** Returns the reason the event cannot be stored, or null when it is valid. */
        public String validationError() {
            if (dataSourceId == null || dataSourceId.isBlank()) {
                return "dataSourceId cannot be empty";
            }
            if (dataType == null || dataType.isBlank()) {
                return "dataType cannot be empty";
            }
            if (!dataType.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                return "dataType is not a valid table name: " + dataType;
            }
            if (timestamp == null || timestamp.equals(Instant.EPOCH)) {
                return "timestamp cannot be zero";
            }
            if (data == null && (rawPayload == null || rawPayload.length == 0)) {
                return "either data or rawPayload must be provided";
            }
            return null;
        }
    }

    public record IngestRequest(List<RawEvent> events) {}

    public record IngestResult(int ingested, int persistFailed, int validationFailed, List<String> errors) {
        public boolean allSucceeded() {
            return persistFailed == 0 && validationFailed == 0;
        }
    }
}
