package com.sentinel.classifier.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchClassifyRequest {

    @NotEmpty(message = "At least one transaction is required")
    private List<@NotNull(message = "Transaction entries must not be null") @Valid ClassifyTransactionRequest> transactions;
}
