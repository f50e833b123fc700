package org.iceforge.dataseap.engine.load;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stream Load result as reported by the engine backend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoadResponse(
        @JsonProperty("TxnId") long txnId,
        @JsonProperty("Label") String label,
        @JsonProperty("Status") String status,
        @JsonProperty("ExistingJobStatus") String existingJobStatus,
        @JsonProperty("ExistingTxnId") Long existingTxnId,
        @JsonProperty("Message") String message,
        @JsonProperty("NumberTotalRows") long numberTotalRows,
        @JsonProperty("NumberLoadedRows") long numberLoadedRows,
        @JsonProperty("NumberFilteredRows") long numberFilteredRows,
        @JsonProperty("NumberUnselectedRows") long numberUnselectedRows,
        @JsonProperty("LoadBytes") long loadBytes,
        @JsonProperty("LoadTimeMs") long loadTimeMs,
        @JsonProperty("BeginTxnTimeMs") long beginTxnTimeMs,
        @JsonProperty("StreamLoadPutTimeMs") long streamLoadPutTimeMs,
        @JsonProperty("ReadDataTimeMs") long readDataTimeMs,
        @JsonProperty("WriteDataTimeMs") long writeDataTimeMs,
        @JsonProperty("CommitAndPublishTimeMs") long commitAndPublishTimeMs,
        @JsonProperty("ErrorURL") String errorUrl
) {
    public static final String STATUS_SUCCESS = "Success";
    public static final String STATUS_PUBLISH_TIMEOUT = "Publish Timeout";
    public static final String STATUS_LABEL_ALREADY_EXISTS = "Label Already Exists";

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    public boolean isPublishTimeout() {
        return STATUS_PUBLISH_TIMEOUT.equals(status);
    }

    /** The label was used before; {@code ExistingJobStatus} tells whether that load finished. */
    public boolean isLabelAlreadyExists() {
        return STATUS_LABEL_ALREADY_EXISTS.equals(status);
    }

    /** {@code Publish Timeout} means the data was committed but visibility was not confirmed in time. */
    public boolean isSuccessEquivalent() {
        return isSuccess() || isPublishTimeout();
    }

    public boolean rowCountsConsistent() {
        return numberLoadedRows + numberFilteredRows + numberUnselectedRows == numberTotalRows;
    }
}
