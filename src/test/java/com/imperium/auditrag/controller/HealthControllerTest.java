package com.imperium.auditrag.controller;

import com.imperium.auditrag.model.dto.response.HealthResponse;
import com.imperium.auditrag.service.HealthService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = HealthController.class)
class HealthControllerTest {

    @Autowired
    MockMvc mvc;

    @MockitoBean
    HealthService healthService;

    @Test
    void reportsDependencyStatus() throws Exception {
        when(healthService.check()).thenReturn(HealthResponse.builder()
                .status(HealthResponse.DEGRADED)
                .generatorAvailable(false)
                .storeAvailable(true)
                .embeddingModel("all-minilm")
                .embeddingDimension(384)
                .build());

        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.generator_available").value(false))
                .andExpect(jsonPath("$.store_available").value(true))
                .andExpect(jsonPath("$.embedding_model").value("all-minilm"))
                .andExpect(jsonPath("$.embedding_dimension").value(384));
    }
}
