package org.iceforge.dataseap.engine.load;

import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;

/**
 * A Stream Load the engine answered with a non-success status. The response, including the
 * {@code ErrorURL} pointing at the rejected rows, is kept for the caller.
 */
public class StreamLoadFailedException extends DataseapException {

    private final transient LoadResponse response;

    public StreamLoadFailedException(String message, LoadResponse response) {
        super(ErrorCode.DATABASE_ERROR, message);
        this.response = response;
    }

    public LoadResponse response() {
        return response;
    }
}
