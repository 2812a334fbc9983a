package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayrollDetailLineRequest {

    @NotBlank(message = "Employee code is required")
    private String employeeCode;

    private String employeeName;
    private String employmentType;
    private String costAccountCode;
    private String payCompCode;

    @NotBlank(message = "Transaction type is required")
    private String transactionType;

    private BigDecimal hours;

    @NotNull(message = "Amount is required")
    private BigDecimal amount;
}
