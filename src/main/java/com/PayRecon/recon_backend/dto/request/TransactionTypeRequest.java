package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TransactionTypeRequest {

    @NotBlank(message = "Transaction type is required")
    private String transactionType;

    private boolean includeInHours;
    private boolean includeInCosts;
    private String notes;
    private boolean active = true;
}
