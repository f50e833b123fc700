package org.iceforge.dataseap.query;

import org.iceforge.dataseap.engine.query.QueryExecutor;
import org.iceforge.dataseap.engine.query.QueryResult;
import org.iceforge.dataseap.engine.query.QueryStatement;
import org.iceforge.dataseap.error.DataseapException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;

@Service
public class SqlQueryService {

    private static final Logger log = LoggerFactory.getLogger(SqlQueryService.class);

    private final QueryExecutor queryExecutor;

    public SqlQueryService(QueryExecutor queryExecutor) {
        this.queryExecutor = Objects.requireNonNull(queryExecutor);
    }

    public QueryModels.SqlQueryResponse execute(QueryModels.SqlQueryRequest req) {
        if (req == null || req.sql() == null || req.sql().isBlank()) {
            throw DataseapException.invalidArgument("SQL query string cannot be empty");
        }
        QueryStatement stmt = QueryStatement.of(req.sql()).withDatabase(req.database());
        if (req.queryTimeoutSecs() != null && req.queryTimeoutSecs() > 0) {
            stmt = stmt.withTimeout(Duration.ofSeconds(req.queryTimeoutSecs()));
        }

        long t0 = System.nanoTime();
        QueryResult result = queryExecutor.execute(stmt);
        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.debug("SQL query returned {} row(s) in {} ms", result.rowCount(), tookMs);

        long affected = result.stats() == null ? 0 : result.stats().affectedRows();
        return new QueryModels.SqlQueryResponse(result.columns(), result.rowsAsMaps(), affected, result.stats(), tookMs);
    }
}
