package com.PayRecon.recon_backend.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalLineRequest {
    private String ledgerAccount;
    private String costAccount;
    private String description;
    private BigDecimal debit;
    private BigDecimal credit;
}
