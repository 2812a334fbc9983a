package com.PayRecon.recon_backend.model;

import com.PayRecon.recon_backend.enums.AllocationSource;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One cost-center share inside a {@link CostAllocationRule}, stored as part of its JSON column.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AllocationEntry {
    private BigDecimal percentage;
    private BigDecimal amount;
    private BigDecimal hours;
    private AllocationSource source;
}
