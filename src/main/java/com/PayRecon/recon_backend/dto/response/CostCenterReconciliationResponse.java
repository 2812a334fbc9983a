package com.PayRecon.recon_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostCenterReconciliationResponse {
    private String costCenter;
    private BigDecimal paidAmount;
    private BigDecimal journalAmount;
    private BigDecimal variance;
    private BigDecimal variancePct;
    private boolean flagged;
}
