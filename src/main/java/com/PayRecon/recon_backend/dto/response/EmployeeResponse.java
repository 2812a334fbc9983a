package com.PayRecon.recon_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeResponse {
    private String code;
    private String firstName;
    private String surname;
    private String fullName;
    private String employmentType;
    private LocalDate terminationDate;
    private boolean autoPay;
    private BigDecimal autoPayAmount;
    private String defaultCostAccount;
    private boolean salaried;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
