package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SplitExpansionRequest {

    // Cost account -> amount
    @NotNull(message = "Amounts are required")
    private Map<String, BigDecimal> amounts;
}
