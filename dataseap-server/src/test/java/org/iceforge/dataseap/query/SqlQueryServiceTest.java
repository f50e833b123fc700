package org.iceforge.dataseap.query;

import org.iceforge.dataseap.engine.query.QueryExecutor;
import org.iceforge.dataseap.engine.query.QueryResult;
import org.iceforge.dataseap.engine.query.QueryStatement;
import org.iceforge.dataseap.engine.query.QueryStats;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SqlQueryServiceTest {

    private final QueryExecutor executor = mock(QueryExecutor.class);
    private final SqlQueryService service = new SqlQueryService(executor);

    @Test
    void execute_mapsRowsByColumnAndPassesOptions() {
        QueryStats stats = new QueryStats(10, 100, Duration.ofMillis(5), 0, null, 2, "Time: 5ms");
        when(executor.execute(any(QueryStatement.class))).thenReturn(
                new QueryResult(List.of("a", "b"), List.of(List.<Object>of(1, "x")), stats));

        QueryModels.SqlQueryResponse resp = service.execute(new QueryModels.SqlQueryRequest("SELECT a, b FROM t", "db1", 5));

        assertEquals(List.of("a", "b"), resp.columns());
        assertEquals(List.of(Map.of("a", 1, "b", "x")), resp.rows());
        assertEquals(2, resp.affectedRows());
        assertSame(stats, resp.stats());

        ArgumentCaptor<QueryStatement> captor = ArgumentCaptor.forClass(QueryStatement.class);
        verify(executor).execute(captor.capture());
        assertEquals("db1", captor.getValue().database());
        assertEquals(Duration.ofSeconds(5), captor.getValue().timeout());
    }

    @Test
    void execute_nonPositiveTimeoutUsesDefault() {
        when(executor.execute(any(QueryStatement.class))).thenReturn(new QueryResult(List.of(), List.of(), null));

        QueryModels.SqlQueryResponse resp = service.execute(new QueryModels.SqlQueryRequest("SELECT 1", null, 0));

        assertEquals(0, resp.affectedRows());
        ArgumentCaptor<QueryStatement> captor = ArgumentCaptor.forClass(QueryStatement.class);
        verify(executor).execute(captor.capture());
        assertNull(captor.getValue().timeout());
    }

    @Test
    void execute_blankSqlIsInvalidArgument() {
        DataseapException e = assertThrows(DataseapException.class,
                () -> service.execute(new QueryModels.SqlQueryRequest("", null, null)));

        assertEquals(ErrorCode.INVALID_ARGUMENT, e.code());
        verifyNoInteractions(executor);
    }

    @Test
    void execute_propagatesEngineErrors() {
        when(executor.execute(any(QueryStatement.class)))
                .thenThrow(new DataseapException(ErrorCode.DATABASE_ERROR, "Unknown table"));

        DataseapException e = assertThrows(DataseapException.class,
                () -> service.execute(new QueryModels.SqlQueryRequest("SELECT * FROM nope", null, null)));

        assertEquals(ErrorCode.DATABASE_ERROR, e.code());
    }
}
