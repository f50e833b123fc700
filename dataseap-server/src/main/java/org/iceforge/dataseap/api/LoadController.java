package org.iceforge.dataseap.api;

import org.iceforge.dataseap.engine.load.LoadFormat;
import org.iceforge.dataseap.engine.load.LoadOptions;
import org.iceforge.dataseap.engine.load.LoadResponse;
import org.iceforge.dataseap.engine.load.StreamLoadClient;
import org.iceforge.dataseap.engine.load.StreamLoadFailedException;
import org.iceforge.dataseap.error.DataseapException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Objects;

/**
 * Raw Stream Load passthrough: the request body is sent to the engine as-is.
 */
@RestController
@RequestMapping("/api/v1/load")
public class LoadController {

    private final StreamLoadClient streamLoadClient;

    public LoadController(StreamLoadClient streamLoadClient) {
        this.streamLoadClient = Objects.requireNonNull(streamLoadClient);
    }

    @PutMapping("/{database}/{table}")
    public ResponseEntity<ApiResponse<LoadResponse>> load(@PathVariable String database,
                                                          @PathVariable String table,
                                                          @RequestBody byte[] body,
                                                          @RequestParam(defaultValue = "json") String format,
                                                          @RequestParam(required = false) String columnSeparator,
                                                          @RequestParam(required = false) String rowDelimiter,
                                                          @RequestParam(defaultValue = "true") boolean stripOuterArray,
                                                          @RequestParam(defaultValue = "0") int timeoutSeconds,
                                                          @RequestParam(defaultValue = "0") double maxFilterRatio,
                                                          @RequestParam(required = false) String mergeCondition,
                                                          @RequestParam(required = false) String label,
                                                          @RequestParam(required = false) Long txnId) {
        LoadFormat loadFormat;
        try {
            loadFormat = LoadFormat.valueOf(format.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ApiErrors.toResponse(DataseapException.invalidArgument("Unsupported load format: " + format));
        }
        LoadOptions.Builder opts = LoadOptions.builder()
                .format(loadFormat)
                .columnSeparator(columnSeparator)
                .rowDelimiter(rowDelimiter)
                .stripOuterArray(stripOuterArray)
                .timeoutSeconds(timeoutSeconds)
                .maxFilterRatio(maxFilterRatio)
                .mergeCondition(mergeCondition)
                .label(label);
        if (txnId != null) {
            opts.transaction(txnId);
        }
        try {
            return ApiErrors.ok(streamLoadClient.streamLoad(database, table, body, opts.build()));
        } catch (StreamLoadFailedException e) {
            return ApiErrors.toResponse(e, e.response());
        } catch (DataseapException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
