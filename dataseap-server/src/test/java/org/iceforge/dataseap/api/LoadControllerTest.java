package org.iceforge.dataseap.api;

import org.iceforge.dataseap.engine.load.LoadFormat;
import org.iceforge.dataseap.engine.load.LoadOptions;
import org.iceforge.dataseap.engine.load.LoadResponse;
import org.iceforge.dataseap.engine.load.StreamLoadClient;
import org.iceforge.dataseap.engine.load.StreamLoadFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class LoadControllerTest {

    private StreamLoadClient client;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        client = mock(StreamLoadClient.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new LoadController(client)).build();
    }

    @Test
    void load_passesBodyAndOptions() throws Exception {
        when(client.streamLoad(eq("db1"), eq("events"), any(byte[].class), any(LoadOptions.class)))
                .thenReturn(response("Success", null));

        mockMvc.perform(put("/api/v1/load/db1/events")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("1,a\n2,b")
                        .param("format", "csv")
                        .param("columnSeparator", ",")
                        .param("label", "batch-7")
                        .param("txnId", "99"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.NumberLoadedRows").value(2));

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        ArgumentCaptor<LoadOptions> opts = ArgumentCaptor.forClass(LoadOptions.class);
        verify(client).streamLoad(eq("db1"), eq("events"), body.capture(), opts.capture());
        assertEquals("1,a\n2,b", new String(body.getValue()));
        assertEquals(LoadFormat.CSV, opts.getValue().format());
        assertEquals(",", opts.getValue().columnSeparator());
        assertEquals("batch-7", opts.getValue().label());
        assertTrue(opts.getValue().twoPhaseCommit());
        assertEquals(99L, opts.getValue().transactionId());
    }

    @Test
    void load_failureKeepsEngineResponse() throws Exception {
        LoadResponse failed = response("Fail", "http://be1:8040/api/_load_error_log?file=x");
        when(client.streamLoad(eq("db1"), eq("events"), any(byte[].class), any(LoadOptions.class)))
                .thenThrow(new StreamLoadFailedException("load failed", failed));

        mockMvc.perform(put("/api/v1/load/db1/events").content("[]"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.code").value("DATABASE_ERROR"))
                .andExpect(jsonPath("$.error.details").value("http://be1:8040/api/_load_error_log?file=x"))
                .andExpect(jsonPath("$.data.Status").value("Fail"));
    }

    @Test
    void load_unknownFormatIs400() throws Exception {
        mockMvc.perform(put("/api/v1/load/db1/events").content("x").param("format", "parquet"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(client);
    }

    private static LoadResponse response(String status, String errorUrl) {
        return new LoadResponse(5, "batch-7", status, null, null, "", 2, 2, 0, 0, 8, 3, 0, 0, 0, 0, 0, errorUrl);
    }
}
