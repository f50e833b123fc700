package org.iceforge.dataseap.engine.query;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One SQL statement for the engine.
 *
 * @param database overrides the configured default database when non-blank
 * @param timeout  overrides the configured query timeout when non-null
 * @param args     positional arguments; the HTTP query API cannot bind them
 */
public record QueryStatement(String sql, String database, Duration timeout, List<Object> args) {

    public QueryStatement {
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static QueryStatement of(String sql) {
        return new QueryStatement(sql, null, null, List.of());
    }

    public QueryStatement withDatabase(String database) {
        return new QueryStatement(sql, database, timeout, args);
    }

    public QueryStatement withTimeout(Duration timeout) {
        return new QueryStatement(sql, database, timeout, args);
    }
}
