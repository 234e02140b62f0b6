package com.sentinel.classifier.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionStatsResponse {

    private long totalTransactions;

    /**
     * Count per category wire name; every category is present, unused ones with 0
     */
    private Map<String, Long> stats;
}
