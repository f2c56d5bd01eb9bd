package com.bitanalytics.api;

import com.bitanalytics.api.dto.BitOpRequest;
import com.bitanalytics.api.dto.BitOpResponse;
import com.bitanalytics.schema.BitOperator;
import com.bitanalytics.service.BitOpQueryService;
import com.bitanalytics.service.BitOperationEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BitOpController.class)
@DisplayName("BitOpController")
class BitOpControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BitOpQueryService queryService;

    @MockBean
    private BitOperationEngine engine;

    @Test
    @DisplayName("POST /bitop parses a nested operand tree")
    void evaluateNested() throws Exception {
        Map<Long, Boolean> present = new LinkedHashMap<>();
        present.put(123L, true);
        present.put(224L, false);
        when(queryService.evaluate(any(BitOpRequest.class)))
                .thenReturn(new BitOpResponse("bitanalytics_bitop_AND_x", 1, true, false, present));

        String body = """
                {
                  "operator": "AND",
                  "identifiers": [123, 224],
                  "operands": [
                    {"operator": "AND", "operands": [
                      {"event": "active", "granularity": "MONTH", "year": 2014, "month": 1},
                      {"event": "active", "granularity": "MONTH", "year": 2014, "month": 3}
                    ]},
                    {"event": "active", "granularity": "MONTH", "year": 2014, "month": 3}
                  ]
                }
                """;

        mockMvc.perform(post("/api/v1/bitop").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.exists").value(true))
                .andExpect(jsonPath("$.present['123']").value(true))
                .andExpect(jsonPath("$.present['224']").value(false));

        ArgumentCaptor<BitOpRequest> captor = ArgumentCaptor.forClass(BitOpRequest.class);
        verify(queryService).evaluate(captor.capture());
        BitOpRequest req = captor.getValue();
        assertThat(req.getOperator()).isEqualTo(BitOperator.AND);
        assertThat(req.getOperands()).hasSize(2);
        assertThat(req.getOperands().get(0).isNested()).isTrue();
        assertThat(req.getOperands().get(0).getOperands()).hasSize(2);
        assertThat(req.getIdentifiers()).containsExactly(123L, 224L);
        assertThat(req.isKeep()).isFalse();
    }

    @Test
    @DisplayName("missing operands return 400")
    void emptyOperands() throws Exception {
        mockMvc.perform(post("/api/v1/bitop").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operator\":\"OR\",\"operands\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("more than sixteen operands return 400")
    void tooManyOperands() throws Exception {
        String operand = "{\"event\":\"a\",\"granularity\":\"MONTH\",\"year\":2014,\"month\":1}";
        String operands = String.join(",", Collections.nCopies(17, operand));

        mockMvc.perform(post("/api/v1/bitop").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operator\":\"OR\",\"operands\":[" + operands + "]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
        verify(queryService, never()).evaluate(any(BitOpRequest.class));
    }

    @Test
    @DisplayName("unknown operator returns 400")
    void unknownOperator() throws Exception {
        mockMvc.perform(post("/api/v1/bitop").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operator\":\"NAND\",\"operands\":[{\"event\":\"a\",\"granularity\":\"MONTH\",\"year\":2014,\"month\":1}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("DELETE /temporary clears bitop keys")
    void deleteTemporary() throws Exception {
        when(engine.deleteTemporaryKeys()).thenReturn(3L);

        mockMvc.perform(delete("/api/v1/bitop/temporary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(3));
    }
}
