package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SplitTargetsRequest {

    @NotEmpty(message = "At least one split target is required")
    @Valid
    private List<Target> targets;

    private String notes;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Target {

        @NotBlank(message = "Target account is required")
        private String targetAccount;

        // Fraction of the source amount, 0.6 = 60%
        @NotNull(message = "Percentage is required")
        @DecimalMin(value = "0.0", inclusive = false, message = "Percentage must be positive")
        @DecimalMax(value = "1.0", message = "Percentage is a fraction and cannot exceed 1")
        private BigDecimal percentage;
    }
}
