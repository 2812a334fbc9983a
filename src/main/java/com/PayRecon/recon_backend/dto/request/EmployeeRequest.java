package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeRequest {

    @NotBlank(message = "Employee code is required")
    private String code;

    private String firstName;
    private String surname;
    private String employmentType;
    private LocalDate terminationDate;
    private boolean autoPay;

    @DecimalMin(value = "0.00", message = "Auto pay amount cannot be negative")
    private BigDecimal autoPayAmount;

    private String defaultCostAccount;
}
