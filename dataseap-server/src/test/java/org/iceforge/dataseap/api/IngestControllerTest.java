package org.iceforge.dataseap.api;

import org.iceforge.dataseap.ingest.IngestModels;
import org.iceforge.dataseap.ingest.IngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class IngestControllerTest {

    private static final String BODY = "{\"events\":[{\"id\":\"e1\",\"dataSourceId\":\"sensor-1\",\"dataType\":\"firewall_log\","
            + "\"timestamp\":\"2024-05-01T10:15:30Z\",\"data\":{\"src_ip\":\"10.0.0.1\"}}]}";

    private IngestionService ingestionService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ingestionService = mock(IngestionService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new IngestController(ingestionService)).build();
    }

    @Test
    void events_allIngested() throws Exception {
        when(ingestionService.ingest(any())).thenReturn(new IngestModels.IngestResult(1, 0, 0, List.of()));

        mockMvc.perform(post("/api/v1/ingest/events").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.ingested").value(1));

        verify(ingestionService).ingest(argThat((List<IngestModels.RawEvent> events) -> events.size() == 1
                && events.get(0).dataType().equals("firewall_log")
                && events.get(0).timestamp() != null));
    }

    @Test
    void events_validationFailuresAre400WithCounts() throws Exception {
        when(ingestionService.ingest(any())).thenReturn(new IngestModels.IngestResult(0, 0, 1, List.of("dataType cannot be empty")));

        mockMvc.perform(post("/api/v1/ingest/events").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data.validationFailed").value(1));
    }

    @Test
    void events_persistFailuresAre502() throws Exception {
        when(ingestionService.ingest(any())).thenReturn(new IngestModels.IngestResult(0, 1, 0, List.of("firewall_log: boom")));

        mockMvc.perform(post("/api/v1/ingest/events").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.code").value("DATABASE_ERROR"))
                .andExpect(jsonPath("$.data.persistFailed").value(1));
    }
}
