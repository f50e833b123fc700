package org.iceforge.dataseap.api;

import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.query.QueryModels;
import org.iceforge.dataseap.query.SqlQueryService;
import org.iceforge.dataseap.search.SearchModels;
import org.iceforge.dataseap.search.SearchOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

@RestController
@RequestMapping("/api/v1/query")
public class QueryController {

    private final SqlQueryService sqlQueryService;
    private final SearchOrchestrator searchOrchestrator;

    public QueryController(SqlQueryService sqlQueryService, SearchOrchestrator searchOrchestrator) {
        this.sqlQueryService = Objects.requireNonNull(sqlQueryService);
        this.searchOrchestrator = Objects.requireNonNull(searchOrchestrator);
    }

    @PostMapping("/sql")
    public ResponseEntity<ApiResponse<QueryModels.SqlQueryResponse>> sql(@RequestBody QueryModels.SqlQueryRequest req) {
        try {
            return ApiErrors.ok(sqlQueryService.execute(req));
        } catch (DataseapException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * Keyword search over the requested tables. {@code totalHits} is approximate: each table
     * contributes at most the per-table limit.
     */
    @PostMapping("/fulltext")
    public ResponseEntity<ApiResponse<SearchModels.SearchResult>> fulltext(@RequestBody SearchModels.SearchRequest req) {
        try {
            return ApiErrors.ok(searchOrchestrator.search(req));
        } catch (DataseapException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
