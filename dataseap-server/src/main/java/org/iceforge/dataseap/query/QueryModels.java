package org.iceforge.dataseap.query;

import org.iceforge.dataseap.engine.query.QueryStats;

import java.util.List;
import java.util.Map;

public final class QueryModels {
    private QueryModels() {}

    /**
     * @param queryTimeoutSecs zero or negative falls back to the configured query timeout
     */
    public record SqlQueryRequest(String sql, String database, Integer queryTimeoutSecs) {}

    public record SqlQueryResponse(
            List<String> columns,
            List<Map<String, Object>> rows,
            long affectedRows,
            QueryStats stats,
            long executionTimeMs
    ) {}
}
