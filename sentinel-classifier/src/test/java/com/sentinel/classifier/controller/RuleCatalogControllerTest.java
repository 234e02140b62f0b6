package com.sentinel.classifier.controller;

import com.sentinel.classifier.dto.CatalogSummary;
import com.sentinel.classifier.engine.CatalogConfigException;
import com.sentinel.classifier.service.RuleCatalogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RuleCatalogController.class)
class RuleCatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RuleCatalogService ruleCatalogService;

    private static CatalogSummary summary(int overrides) {
        return CatalogSummary.builder()
                .source("classpath:classification-rules.json")
                .loadedAt(Instant.parse("2024-05-01T10:15:30Z"))
                .keywordsPerCategory(Map.of("food", 27))
                .overrideCount(overrides)
                .build();
    }

    @Test
    void returnsCurrentCatalog() throws Exception {
        when(ruleCatalogService.summary()).thenReturn(summary(4));

        mockMvc.perform(get("/api/v1/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("classpath:classification-rules.json"))
                .andExpect(jsonPath("$.keywordsPerCategory.food").value(27))
                .andExpect(jsonPath("$.overrideCount").value(4));
    }

    @Test
    void reloadReturnsNewSummary() throws Exception {
        when(ruleCatalogService.reload()).thenReturn(summary(5));

        mockMvc.perform(post("/api/v1/rules/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overrideCount").value(5));
    }

    @Test
    void rejectedReloadIsUnprocessable() throws Exception {
        when(ruleCatalogService.reload()).thenThrow(new CatalogConfigException("Unknown category 'groceries'"));

        mockMvc.perform(post("/api/v1/rules/reload"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("invalid_catalog"))
                .andExpect(jsonPath("$.message").value("Unknown category 'groceries'"));
    }
}
