package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AllocationOverrideRequest {

    // Cost account -> percentage
    @NotEmpty(message = "At least one allocation is required")
    private Map<String, BigDecimal> allocations;

    private String updatedBy;
}
