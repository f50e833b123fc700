package org.iceforge.dataseap.metadata;

import java.util.List;
import java.util.Optional;

public record TableSchema(String database, String table, List<FieldSchema> fields) {

    public TableSchema {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public Optional<FieldSchema> field(String name) {
        return fields.stream().filter(f -> f.name().equalsIgnoreCase(name)).findFirst();
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSchema::name).toList();
    }
}
