package org.iceforge.dataseap.engine.load;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

public interface StreamLoadClient {

    /**
     * Loads one payload into {@code database.table} synchronously.
     *
     * @return the engine response; its status is {@code Success} or {@code Publish Timeout}
     * @throws StreamLoadFailedException when the engine reports any other status
     */
    LoadResponse streamLoad(String database, String table, InputStream data, LoadOptions options);

    default LoadResponse streamLoad(String database, String table, byte[] data, LoadOptions options) {
        return streamLoad(database, table, new ByteArrayInputStream(data), options);
    }
}
