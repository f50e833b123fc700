package org.iceforge.dataseap.engine.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Columns and positional rows of one query. {@code stats} is null when the engine sent none.
 */
public record QueryResult(List<String> columns, List<List<Object>> rows, QueryStats stats) {

    public QueryResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        // rows may hold SQL NULLs, which List.copyOf rejects
        rows = rows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Rows keyed by column name, in column order. Missing trailing values map to null.
     */
    public List<Map<String, Object>> rowsAsMaps() {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> m = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                m.put(columns.get(i), row != null && i < row.size() ? row.get(i) : null);
            }
            out.add(m);
        }
        return out;
    }
}
