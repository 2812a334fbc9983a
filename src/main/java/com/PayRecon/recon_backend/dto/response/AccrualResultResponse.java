package com.PayRecon.recon_backend.dto.response;

import com.PayRecon.recon_backend.enums.AccrualAllocationSource;
import com.PayRecon.recon_backend.enums.WageSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccrualResultResponse {
    private UUID id;
    private String periodId;
    private String employeeCode;
    private String employeeName;
    private String employmentType;
    private LocalDate accrualStart;
    private LocalDate accrualEnd;
    private int daysInPeriod;
    private BigDecimal baseWage;
    private BigDecimal superannuation;
    private BigDecimal annualLeave;
    private BigDecimal payrollTax;
    private BigDecimal workcover;
    private BigDecimal totalOnCosts;
    private BigDecimal total;
    private WageSource wageSource;
    private AccrualAllocationSource allocationSource;
    private Map<String, BigDecimal> costAllocation;
    private LocalDateTime calculatedAt;
}
