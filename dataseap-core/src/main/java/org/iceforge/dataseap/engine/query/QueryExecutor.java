package org.iceforge.dataseap.engine.query;

import java.util.Arrays;
import java.util.List;

public interface QueryExecutor {

    QueryResult execute(QueryStatement statement);

    default QueryResult execute(String sql, Object... args) {
        List<Object> positional = args == null ? List.of() : Arrays.asList(args);
        return execute(new QueryStatement(sql, null, null, positional));
    }
}
