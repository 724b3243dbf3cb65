package com.fraud.analytics.api;

import com.fraud.analytics.domain.TransactionRecord;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch submitted for analysis. Individual records are validated by the pipeline, not here,
 * so that one bad record does not reject the whole batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequestDto {

    @NotNull(message = "transactions is required")
    @Size(max = 100_000, message = "at most 100000 transactions per batch")
    private List<TransactionRecord> transactions;
}
