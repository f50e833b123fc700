package org.iceforge.dataseap.api;

import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.metadata.TableMetadataLookup;
import org.iceforge.dataseap.metadata.TableSchema;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/api/v1/metadata")
public class MetadataController {

    private final TableMetadataLookup metadata;

    public MetadataController(TableMetadataLookup metadata) {
        this.metadata = Objects.requireNonNull(metadata);
    }

    @GetMapping("/{database}/tables")
    public ResponseEntity<ApiResponse<List<String>>> tables(@PathVariable String database) {
        try {
            return ApiErrors.ok(metadata.listTables(database));
        } catch (DataseapException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/{database}/tables/{table}")
    public ResponseEntity<ApiResponse<TableSchema>> table(@PathVariable String database, @PathVariable String table) {
        try {
            return ApiErrors.ok(metadata.describeTable(database, table));
        } catch (DataseapException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
