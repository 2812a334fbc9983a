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
public class JournalReconciliationResponse {
    private String description;
    private String glAccount;
    private boolean includeInTotalCost;
    private boolean mapped;
    private BigDecimal journalDebit;
    private BigDecimal journalCredit;
    private BigDecimal journalNet;
}
