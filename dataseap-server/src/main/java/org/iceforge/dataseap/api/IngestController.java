package org.iceforge.dataseap.api;

import org.iceforge.dataseap.error.DataseapException;
import org.iceforge.dataseap.error.ErrorCode;
import org.iceforge.dataseap.ingest.IngestModels;
import org.iceforge.dataseap.ingest.IngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

@RestController
@RequestMapping("/api/v1/ingest")
public class IngestController {

    private final IngestionService ingestionService;

    public IngestController(IngestionService ingestionService) {
        this.ingestionService = Objects.requireNonNull(ingestionService);
    }

    @PostMapping("/events")
    public ResponseEntity<ApiResponse<IngestModels.IngestResult>> events(@RequestBody IngestModels.IngestRequest req) {
        IngestModels.IngestResult result;
        try {
            result = ingestionService.ingest(req == null ? null : req.events());
        } catch (DataseapException e) {
            return ApiErrors.toResponse(e);
        }
        if (result.persistFailed() > 0) {
            return ApiErrors.toResponse(new DataseapException(ErrorCode.DATABASE_ERROR,
                    result.persistFailed() + " event(s) failed to persist"), result);
        }
        if (result.validationFailed() > 0) {
            return ApiErrors.toResponse(new DataseapException(ErrorCode.INVALID_ARGUMENT,
                    result.validationFailed() + " event(s) failed validation"), result);
        }
        return ApiErrors.ok(result);
    }
}
