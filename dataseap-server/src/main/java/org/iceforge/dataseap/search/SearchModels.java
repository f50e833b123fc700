package org.iceforge.dataseap.search;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class SearchModels {
    private SearchModels() {}

    /** Either bound may be null. */
    public record TimeRange(Instant start, Instant end) {}

    public record Pagination(Integer page, Integer pageSize) {}

    /**
     * @param targetFields   fields searched in every table
     * @param tableFields    per-table field lists; an entry replaces {@code targetFields} for that table
     * @param tokenizer      analyzer hint; the engine applies the analyzer configured on the index
     * @param recallPriority true or null: a hit on any keyword counts, false: all keywords must match
     * @param timeField      column for {@code timeRangeFilter}; defaults to the configured time field
     */
    public record SearchRequest(
            String keywords,
            List<String> targetTables,
            List<String> targetFields,
            Map<String, List<String>> tableFields,
            String tokenizer,
            Boolean recallPriority,
            String timeField,
            TimeRange timeRangeFilter,
            Map<String, Object> additionalFilters,
            Pagination pagination
    ) {
        public boolean recall() {
            return recallPriority == null || recallPriority;
        }

        public List<String> fieldsFor(String table) {
            if (tableFields != null) {
                List<String> own = tableFields.get(table);
                if (own != null && !own.isEmpty()) {
                    return own;
                }
            }
            return targetFields == null ? List.of() : targetFields;
        }
    }

    /**
     * One matching row. {@code score} is a constant placeholder; the engine ranks nothing.
     */
    public record SearchHit(
            String sourceTable,
            String id,
            float score,
            Map<String, Object> document,
            Map<String, String> hitFields
    ) {}

    public record PageInfo(int page, int pageSize, long total, int totalPages) {}

    /**
     * {@code totalHits} counts the rows fetched across tables, each table capped at the per-table
     * limit, so it is a lower bound once any table hits the cap.
     */
    public record SearchResult(List<SearchHit> hits, long totalHits, PageInfo pagination) {}
}
