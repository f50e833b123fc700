package org.iceforge.dataseap.engine.load;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call Stream Load settings.
 *
 * @param columnSeparator csv only
 * @param rowDelimiter    csv only
 * @param stripOuterArray json only; the payload is one JSON array of row objects
 * @param maxFilterRatio  sent only when positive
 * @param headers         extra headers, sent after the standard ones and able to override them
 * @param transactionId   id from a 2PC begin; used only together with {@code twoPhaseCommit}
 */
public record LoadOptions(
        LoadFormat format,
        String columnSeparator,
        String rowDelimiter,
        boolean stripOuterArray,
        int timeoutSeconds,
        double maxFilterRatio,
        Map<String, String> headers,
        String mergeCondition,
        boolean twoPhaseCommit,
        Long transactionId,
        String label
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    public LoadOptions {
        if (format == null) format = LoadFormat.JSON;
        if (timeoutSeconds <= 0) timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static LoadOptions json() {
        return builder().format(LoadFormat.JSON).stripOuterArray(true).build();
    }

    public static LoadOptions csv(String columnSeparator) {
        return builder().format(LoadFormat.CSV).columnSeparator(columnSeparator).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.format = format;
        b.columnSeparator = columnSeparator;
        b.rowDelimiter = rowDelimiter;
        b.stripOuterArray = stripOuterArray;
        b.timeoutSeconds = timeoutSeconds;
        b.maxFilterRatio = maxFilterRatio;
        b.headers.putAll(headers);
        b.mergeCondition = mergeCondition;
        b.twoPhaseCommit = twoPhaseCommit;
        b.transactionId = transactionId;
        b.label = label;
        return b;
    }

    public static final class Builder {
        private LoadFormat format = LoadFormat.JSON;
        private String columnSeparator;
        private String rowDelimiter;
        private boolean stripOuterArray;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private double maxFilterRatio;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String mergeCondition;
        private boolean twoPhaseCommit;
        private Long transactionId;
        private String label;

        private Builder() {
        }

        public Builder format(LoadFormat format) {
            this.format = format;
            return this;
        }

        public Builder columnSeparator(String columnSeparator) {
            this.columnSeparator = columnSeparator;
            return this;
        }

        public Builder rowDelimiter(String rowDelimiter) {
            this.rowDelimiter = rowDelimiter;
            return this;
        }

        public Builder stripOuterArray(boolean stripOuterArray) {
            this.stripOuterArray = stripOuterArray;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder maxFilterRatio(double maxFilterRatio) {
            this.maxFilterRatio = maxFilterRatio;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder mergeCondition(String mergeCondition) {
            this.mergeCondition = mergeCondition;
            return this;
        }

        /** Joins the load to a transaction opened with {@code begin}. */
        public Builder transaction(long transactionId) {
            this.twoPhaseCommit = true;
            this.transactionId = transactionId;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public LoadOptions build() {
            return new LoadOptions(format, columnSeparator, rowDelimiter, stripOuterArray, timeoutSeconds,
                    maxFilterRatio, headers, mergeCondition, twoPhaseCommit, transactionId, label);
        }
    }
}
