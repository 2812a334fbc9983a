package com.PayRecon.recon_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeReconciliationResponse {
    private UUID id;
    private String periodId;
    private UUID runId;
    private String employeeId;
    private String employeeName;
    private String employmentType;
    private boolean salaried;
    private BigDecimal autoPayAmount;

    private BigDecimal workedHours;
    private BigDecimal workedCost;
    private int shiftCount;
    private BigDecimal workedNormalHours;
    private BigDecimal workedLeaveHours;
    private Map<String, BigDecimal> leaveBreakdown;
    private List<String> locations;

    private BigDecimal paidHours;
    private BigDecimal paidGross;
    private BigDecimal paidSuperannuation;
    private BigDecimal paidNormalHours;
    private BigDecimal paidNormalPay;
    private BigDecimal paidOvertimeHours;
    private BigDecimal paidOvertimePay;
    private BigDecimal paidAnnualLeaveHours;
    private BigDecimal paidAnnualLeavePay;
    private BigDecimal paidSickLeaveHours;
    private BigDecimal paidSickLeavePay;
    private BigDecimal paidOtherLeaveHours;
    private BigDecimal paidOtherLeavePay;
    private List<String> costCenters;

    private BigDecimal expectedCost;
    private BigDecimal hoursVariance;
    private BigDecimal hoursVariancePct;
    private BigDecimal costVariance;
    private BigDecimal costVariancePct;
    private boolean hoursMatch;
    private boolean costMatch;
    private boolean hasIssues;
    private String issueDescription;
}
