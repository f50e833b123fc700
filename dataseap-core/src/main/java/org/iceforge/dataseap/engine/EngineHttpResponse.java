package org.iceforge.dataseap.engine;

/**
 * Status line and fully buffered body of one engine HTTP exchange.
 */
public record EngineHttpResponse(int status, String body) {

    public boolean isOk() {
        return status == 200;
    }
}
