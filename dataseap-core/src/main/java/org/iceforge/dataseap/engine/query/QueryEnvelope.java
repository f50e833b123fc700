package org.iceforge.dataseap.engine.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/** Wire shape of {@code /api/v1/query} responses. */
@JsonIgnoreProperties(ignoreUnknown = true)
record QueryEnvelope(Integer code, String msg, Data data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Data(String type, List<Column> meta, List<List<Object>> result, Map<String, Object> property) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Column(String name, String type) {
    }
}
