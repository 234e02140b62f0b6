package com.sentinel.classifier.controller;

import com.sentinel.classifier.dto.ClassifiedTransactionEvent;
import com.sentinel.classifier.dto.TransactionStatsResponse;
import com.sentinel.classifier.engine.Category;
import com.sentinel.classifier.engine.ClassificationMethod;
import com.sentinel.classifier.exception.TransactionNotFoundException;
import com.sentinel.classifier.service.ClassificationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ClassifiedTransactionController.class)
@DisplayName("ClassifiedTransactionController Tests")
class ClassifiedTransactionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ClassificationService classificationService;

    private static ClassifiedTransactionEvent uber() {
        return ClassifiedTransactionEvent.builder()
                .id(3L)
                .text("Uber to airport")
                .category(Category.TRANSPORT)
                .confidence(0.75)
                .method(ClassificationMethod.TOKEN_MATCH)
                .matchedTerm("uber")
                .hitCount(1)
                .build();
    }

    @Test
    @DisplayName("Should list all transactions")
    void shouldListAll() throws Exception {
        when(classificationService.getTransactions(null)).thenReturn(List.of(uber()));

        mockMvc.perform(get("/api/v1/transactions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(3))
                .andExpect(jsonPath("$[0].category").value("transport"));
    }

    @Test
    @DisplayName("Should filter by category name regardless of case")
    void shouldFilterByCategory() throws Exception {
        when(classificationService.getTransactions(Category.TRANSPORT)).thenReturn(List.of(uber()));

        mockMvc.perform(get("/api/v1/transactions").param("category", "Transport"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("Should reject an unknown category")
    void shouldRejectUnknownCategory() throws Exception {
        mockMvc.perform(get("/api/v1/transactions").param("category", "groceries"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"));

        verify(classificationService, never()).getTransactions(any());
    }

    @Test
    @DisplayName("Should return 404 for an unknown id")
    void shouldReturnNotFound() throws Exception {
        when(classificationService.getTransaction(99L)).thenThrow(new TransactionNotFoundException(99L));

        mockMvc.perform(get("/api/v1/transactions/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"))
                .andExpect(jsonPath("$.message").value("Transaction not found: 99"));
    }

    @Test
    @DisplayName("Should reject a non-numeric id")
    void shouldRejectNonNumericId() throws Exception {
        mockMvc.perform(get("/api/v1/transactions/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"));
    }

    @Test
    @DisplayName("Should return per-category stats")
    void shouldReturnStats() throws Exception {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("food", 2L);
        counts.put("other", 0L);
        when(classificationService.getStats()).thenReturn(TransactionStatsResponse.builder()
                .totalTransactions(2)
                .stats(counts)
                .build());

        mockMvc.perform(get("/api/v1/transactions/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTransactions").value(2))
                .andExpect(jsonPath("$.stats.food").value(2))
                .andExpect(jsonPath("$.stats.other").value(0));
    }
}
