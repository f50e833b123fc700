package org.iceforge.dataseap.search;

import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchQueryBuilderTest {

    private SearchQueryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SearchQueryBuilder(new SearchProperties());
    }

    @Test
    void build_recallPriorityUsesMatchAnyOnEveryField() {
        String sql = builder.build("logs", request("error", true, List.of("message", "host")));

        assertEquals("SELECT * FROM logs WHERE (message MATCH_ANY 'error' OR host MATCH_ANY 'error') LIMIT 1000 OFFSET 0", sql);
    }

    @Test
    void build_precisionUsesMatchAllOnEveryField() {
        String sql = builder.build("logs", request("disk full", false, List.of("message", "host")));

        assertTrue(sql.contains("message MATCH_ALL 'disk full' OR host MATCH_ALL 'disk full'"));
        assertFalse(sql.contains("MATCH_ANY"));
    }

    @Test
    void build_nullRecallPriorityDefaultsToMatchAny() {
        SearchModels.SearchRequest req = new SearchModels.SearchRequest("x", List.of("t"), List.of("f"), null,
                null, null, null, null, null, null);

        assertTrue(builder.build("t", req).contains("f MATCH_ANY 'x'"));
    }

    @Test
    void build_escapesQuotesAndBackslashesInKeywords() {
        String sql = builder.build("logs", request("it's a \\path", true, List.of("message")));

        assertTrue(sql.contains("message MATCH_ANY 'it\\'s a \\\\path'"), sql);
    }

    @Test
    void build_appendsTimeRangeAndEqualityFilters() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("status", "active");
        filters.put("severity", 3);
        filters.put("owner", null);
        SearchModels.SearchRequest req = new SearchModels.SearchRequest("boom", List.of("alerts"), List.of("body"), null,
                null, true, null,
                new SearchModels.TimeRange(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T12:30:00Z")),
                filters, null);

        String sql = builder.build("alerts", req);

        assertEquals("SELECT * FROM alerts WHERE (body MATCH_ANY 'boom')"
                + " AND event_time >= '2024-01-01 00:00:00' AND event_time <= '2024-01-02 12:30:00'"
                + " AND status = 'active' AND severity = 3 AND owner IS NULL LIMIT 1000 OFFSET 0", sql);
    }

    @Test
    void build_usesRequestTimeFieldAndPerTableFields() {
        SearchModels.SearchRequest req = new SearchModels.SearchRequest("x", List.of("a", "b"), List.of("shared"),
                Map.of("b", List.of("title", "body")), null, true, "created_at",
                new SearchModels.TimeRange(null, Instant.parse("2024-03-01T00:00:00Z")), null, null);

        assertTrue(builder.build("a", req).startsWith("SELECT * FROM a WHERE (shared MATCH_ANY 'x') AND created_at <= "));
        assertTrue(builder.build("b", req).startsWith("SELECT * FROM b WHERE (title MATCH_ANY 'x' OR body MATCH_ANY 'x')"));
    }

    @Test
    void build_honoursConfiguredPerTableLimit() {
        SearchProperties props = new SearchProperties();
        props.setPerTableLimit(50);
        String sql = new SearchQueryBuilder(props).build("t", request("x", true, List.of("f")));

        assertTrue(sql.endsWith(" LIMIT 50 OFFSET 0"));
    }

    @Test
    void validate_rejectsBlankKeywords() {
        assertInvalid(request(" ", true, List.of("f")));
    }

    @Test
    void validate_rejectsMissingTables() {
        assertInvalid(new SearchModels.SearchRequest("x", List.of(), List.of("f"), null, null, true, null, null, null, null));
    }

    @Test
    void validate_rejectsTableWithoutFields() {
        assertInvalid(new SearchModels.SearchRequest("x", List.of("t"), List.of(), null, null, true, null, null, null, null));
    }

    @Test
    void validate_rejectsInjectedIdentifiers() {
        assertInvalid(new SearchModels.SearchRequest("x", List.of("t; DROP TABLE t"), List.of("f"), null, null, true,
                null, null, null, null));
        assertInvalid(new SearchModels.SearchRequest("x", List.of("t"), List.of("f OR 1=1"), null, null, true,
                null, null, null, null));
        assertInvalid(new SearchModels.SearchRequest("x", List.of("t"), List.of("f"), null, null, true,
                null, null, Map.of("a=1 --", "v"), null));
    }

    @Test
    void validate_acceptsDatabaseQualifiedTable() {
        assertDoesNotThrow(() -> builder.validate(new SearchModels.SearchRequest("x", List.of("db1.logs"), List.of("f"),
                null, null, true, null, null, null, null)));
    }

    private void assertInvalid(SearchModels.SearchRequest req) {
        DataseapException e = assertThrows(DataseapException.class, () -> builder.validate(req));
        assertEquals(ErrorCode.INVALID_ARGUMENT, e.code());
    }

    private static SearchModels.SearchRequest request(String keywords, boolean recall, List<String> fields) {
        return new SearchModels.SearchRequest(keywords, List.of("logs"), fields, null, null, recall, null, null, null, null);
    }
}
