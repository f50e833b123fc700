package org.iceforge.dataseap.engine;

public enum EndpointRole {
    QUERY,
    LOAD
}
