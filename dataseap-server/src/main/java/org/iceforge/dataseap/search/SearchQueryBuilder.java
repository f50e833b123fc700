package org.iceforge.dataseap.search;

import org.iceforge.dataseap.error.DataseapException;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Builds the per-table {@code MATCH_ANY}/{@code MATCH_ALL} statement of a keyword search.
 */
@Component
public class SearchQueryBuilder {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern QUALIFIED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    private static final DateTimeFormatter DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final SearchProperties props;

    public SearchQueryBuilder(SearchProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Rejects the whole request before any table is queried.
     */
    public void validate(SearchModels.SearchRequest req) {
        if (req == null) {
            throw DataseapException.invalidArgument("Search request is required");
        }
        if (req.keywords() == null || req.keywords().isBlank()) {
            throw DataseapException.invalidArgument("Keywords for full-text search cannot be empty");
        }
        if (req.targetTables() == null || req.targetTables().isEmpty()) {
            throw DataseapException.invalidArgument(
                    "targetTables must be specified; searchable tables are not discovered automatically");
        }
        for (String table : req.targetTables()) {
            requireQualified(table, "table");
            List<String> fields = req.fieldsFor(table);
            if (fields.isEmpty()) {
                throw DataseapException.invalidArgument("targetFields must be specified for table " + table);
            }
            fields.forEach(f -> requireIdentifier(f, "field"));
        }
        if (req.timeRangeFilter() != null) {
            requireIdentifier(timeField(req), "time field");
        }
        if (req.additionalFilters() != null) {
            req.additionalFilters().keySet().forEach(k -> requireIdentifier(k, "filter"));
        }
    }

    public String build(String table, SearchModels.SearchRequest req) {
        List<String> fields = req.fieldsFor(table);
        String op = req.recall() ? "MATCH_ANY" : "MATCH_ALL";
        String keywords = quote(req.keywords());

        List<String> matches = new ArrayList<>(fields.size());
        for (String f : fields) {
            matches.add(f + " " + op + " " + keywords);
        }
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table)
                .append(" WHERE (").append(String.join(" OR ", matches)).append(')');

        SearchModels.TimeRange range = req.timeRangeFilter();
        if (range != null) {
            String tf = timeField(req);
            if (range.start() != null) {
                sql.append(" AND ").append(tf).append(" >= '").append(DATETIME.format(range.start())).append('\'');
            }
            if (range.end() != null) {
                sql.append(" AND ").append(tf).append(" <= '").append(DATETIME.format(range.end())).append('\'');
            }
        }
        if (req.additionalFilters() != null) {
            for (Map.Entry<String, Object> e : req.additionalFilters().entrySet()) {
                sql.append(" AND ").append(e.getKey());
                if (e.getValue() == null) {
                    sql.append(" IS NULL");
                } else {
                    sql.append(" = ").append(literal(e.getValue()));
                }
            }
        }
        sql.append(" LIMIT ").append(Math.max(1, props.getPerTableLimit())).append(" OFFSET 0");
        return sql.toString();
    }

    private String timeField(SearchModels.SearchRequest req) {
        return req.timeField() != null && !req.timeField().isBlank() ? req.timeField() : props.getDefaultTimeField();
    }

    static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    static String literal(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return quote(value.toString());
    }

    private static void requireIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw DataseapException.invalidArgument("Invalid " + what + " name: " + name);
        }
    }

    private static void requireQualified(String name, String what) {
        if (name == null || !QUALIFIED.matcher(name).matches()) {
            throw DataseapException.invalidArgument("Invalid " + what + " name: " + name);
        }
    }
}
