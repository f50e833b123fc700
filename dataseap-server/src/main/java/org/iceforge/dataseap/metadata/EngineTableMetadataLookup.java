package org.iceforge.dataseap.metadata;

import org.iceforge.dataseap.engine.query.QueryExecutor;
import org.iceforge.dataseap.engine.query.QueryResult;
import org.iceforge.dataseap.engine.query.QueryStatement;
import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads table metadata with {@code SHOW TABLES} and {@code DESC}.
 */
@Service
public class EngineTableMetadataLookup implements TableMetadataLookup {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final QueryExecutor queryExecutor;

    public EngineTableMetadataLookup(QueryExecutor queryExecutor) {
        this.queryExecutor = Objects.requireNonNull(queryExecutor);
    }

    @Override
    public List<String> listTables(String database) {
        requireIdentifier(database, "database");
        QueryResult result = queryExecutor.execute(QueryStatement.of("SHOW TABLES FROM " + database));
        List<String> tables = new ArrayList<>(result.rowCount());
        for (List<Object> row : result.rows()) {
            if (row != null && !row.isEmpty() && row.get(0) != null) {
                tables.add(row.get(0).toString());
            }
        }
        return tables;
    }

    @Override
    public TableSchema describeTable(String database, String table) {
        requireIdentifier(database, "database");
        requireIdentifier(table, "table");
        QueryResult result;
        try {
            result = queryExecutor.execute(QueryStatement.of("DESC " + database + "." + table));
        } catch (DataseapException e) {
            if (e.code() == ErrorCode.DATABASE_ERROR && looksMissing(e.getMessage())) {
                throw new DataseapException(ErrorCode.NOT_FOUND, "Table " + database + "." + table + " not found", e);
            }
            throw e;
        }
        if (result.rowCount() == 0) {
            throw new DataseapException(ErrorCode.NOT_FOUND, "Table " + database + "." + table + " not found");
        }
        List<FieldSchema> fields = new ArrayList<>(result.rowCount());
        for (Map<String, Object> row : result.rowsAsMaps()) {
            fields.add(new FieldSchema(
                    text(row.get("Field")),
                    text(row.get("Type")),
                    "YES".equalsIgnoreCase(text(row.get("Null"))),
                    "true".equalsIgnoreCase(text(row.get("Key"))) || "PRI".equalsIgnoreCase(text(row.get("Key"))),
                    text(row.get("Default")),
                    text(row.get("Extra"))));
        }
        return new TableSchema(database, table, fields);
    }

    private static boolean looksMissing(String message) {
        if (message == null) {
            return false;
        }
        String m = message.toLowerCase(Locale.ROOT);
        return m.contains("unknown table") || m.contains("does not exist") || m.contains("not exist");
    }

    private static String text(Object v) {
        return v == null ? null : v.toString();
    }

    private static void requireIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw DataseapException.invalidArgument("Invalid " + what + " name: " + name);
        }
    }
}
