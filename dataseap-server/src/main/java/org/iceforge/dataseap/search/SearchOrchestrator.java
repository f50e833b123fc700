package org.iceforge.dataseap.search;

import org.iceforge.dataseap.engine.query.QueryExecutor;
import org.iceforge.dataseap.engine.query.QueryResult;
import org.iceforge.dataseap.engine.query.QueryStatement;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs one keyword search across a list of tables.
 * <p>
 * A table whose query fails is logged and left out; the search as a whole only fails on invalid input.
 * Hits keep table-list order, then row order, whether tables are queried one by one or concurrently.
 */
@Service
public class SearchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    static final float PLACEHOLDER_SCORE = 1.0f;

    private final QueryExecutor queryExecutor;
    private final SearchQueryBuilder queryBuilder;
    private final ResultPaginator paginator;
    private final SearchProperties props;
    private final ExecutorService searchExecutor;

    public SearchOrchestrator(QueryExecutor queryExecutor,
                              SearchQueryBuilder queryBuilder,
                              ResultPaginator paginator,
                              SearchProperties props,
                              @Qualifier("searchExecutor") ExecutorService searchExecutor) {
        this.queryExecutor = Objects.requireNonNull(queryExecutor);
        this.queryBuilder = Objects.requireNonNull(queryBuilder);
        this.paginator = Objects.requireNonNull(paginator);
        this.props = Objects.requireNonNull(props);
        this.searchExecutor = Objects.requireNonNull(searchExecutor);
    }

    public SearchModels.SearchResult search(SearchModels.SearchRequest req) {
        queryBuilder.validate(req);
        List<String> tables = req.targetTables();
        if (req.tokenizer() != null && !req.tokenizer().isBlank()) {
            log.debug("Tokenizer hint '{}' not sent; the engine uses the analyzer of each index", req.tokenizer());
        }

        List<List<SearchModels.SearchHit>> perTable = props.getParallelism() > 1 && tables.size() > 1
                ? searchConcurrently(tables, req)
                : searchSequentially(tables, req);

        List<SearchModels.SearchHit> hits = new ArrayList<>();
        perTable.forEach(hits::addAll);
        log.info("Full-text search for '{}' over {} table(s) collected {} hit(s)", req.keywords(), tables.size(), hits.size());
        return paginator.paginate(hits, req.pagination());
    }

    private List<List<SearchModels.SearchHit>> searchSequentially(List<String> tables, SearchModels.SearchRequest req) {
        List<List<SearchModels.SearchHit>> out = new ArrayList<>(tables.size());
        for (String table : tables) {
            out.add(searchTable(table, req));
        }
        return out;
    }

    private List<List<SearchModels.SearchHit>> searchConcurrently(List<String> tables, SearchModels.SearchRequest req) {
        List<Future<List<SearchModels.SearchHit>>> futures = new ArrayList<>(tables.size());
        for (String table : tables) {
            futures.add(searchExecutor.submit(() -> searchTable(table, req)));
        }
        List<List<SearchModels.SearchHit>> out = new ArrayList<>(tables.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new DataseapException(ErrorCode.INTERNAL_ERROR, "Search interrupted", e);
            } catch (ExecutionException e) {
                log.warn("Full-text search on table {} failed, skipping: {}", tables.get(i), e.getCause().toString());
                out.add(List.of());
            }
        }
        return out;
    }

    List<SearchModels.SearchHit> searchTable(String table, SearchModels.SearchRequest req) {
        String sql = queryBuilder.build(table, req);
        log.debug("Full-text SQL for table {}: {}", table, sql);
        QueryResult result;
        try {
            result = queryExecutor.execute(QueryStatement.of(sql));
        } catch (RuntimeException e) {
            log.warn("Full-text search on table {} failed, skipping: {}", table, e.toString());
            return List.of();
        }
        List<String> fields = req.fieldsFor(table);
        String needle = req.keywords().toLowerCase(Locale.ROOT);
        List<SearchModels.SearchHit> hits = new ArrayList<>(result.rowCount());
        for (Map<String, Object> row : result.rowsAsMaps()) {
            hits.add(new SearchModels.SearchHit(table, extractId(result.columns(), row), PLACEHOLDER_SCORE,
                    row, snippets(fields, row, needle)));
        }
        return hits;
    }

    static String extractId(List<String> columns, Map<String, Object> row) {
        for (String c : columns) {
            String lower = c.toLowerCase(Locale.ROOT);
            if (lower.equals("id") || lower.endsWith("_id")) {
                Object v = row.get(c);
                if (v != null) {
                    return String.valueOf(v);
                }
            }
        }
        return null;
    }

    private Map<String, String> snippets(List<String> fields, Map<String, Object> row, String needle) {
        Map<String, String> out = new LinkedHashMap<>();
        int max = Math.max(1, props.getSnippetLength());
        for (String field : fields) {
            if (row.get(field) instanceof String text && text.toLowerCase(Locale.ROOT).contains(needle)) {
                out.put(field, text.length() > max ? text.substring(0, max) + "..." : text);
            }
        }
        return out;
    }
}
