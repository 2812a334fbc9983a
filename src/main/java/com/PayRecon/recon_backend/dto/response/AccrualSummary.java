package com.PayRecon.recon_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccrualSummary {
    private String periodId;
    private LocalDate startDate;
    private LocalDate endDate;
    private int daysInPeriod;
    private int processed;
    private int skipped;
    private List<String> employeesNotFound;
    private List<String> terminatedEmployees;
    private List<String> autoPayOnlyEmployees;
    private List<String> errors;
    private BigDecimal totalAccrued;
}
