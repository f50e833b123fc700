package org.iceforge.dataseap.metadata;

import java.util.List;

/**
 * Schema discovery for engine tables.
 */
public interface TableMetadataLookup {

    List<String> listTables(String database);

    /**
     * @throws org.iceforge.dataseap.error.DataseapException with {@code NOT_FOUND} when the table does not exist
     */
    TableSchema describeTable(String database, String table);
}
