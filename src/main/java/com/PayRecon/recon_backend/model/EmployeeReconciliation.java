package com.PayRecon.recon_backend.model;

import com.PayRecon.recon_backend.model.converter.AmountMapConverter;
import com.PayRecon.recon_backend.model.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Worked and paid totals of one employee for a period, with the variances between them.
 */
@Entity
@Table(name = "employee_reconciliations", indexes = {
        @Index(name = "idx_emp_recon_period", columnList = "pay_period_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmployeeReconciliation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pay_period_id", nullable = false)
    private PayPeriod payPeriod;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private ReconciliationRun run;

    @Column(nullable = false, length = 50)
    private String employeeId;

    private String employeeName;

    private String employmentType;

    @Builder.Default
    private boolean salaried = false;

    @Column(precision = 12, scale = 2)
    private BigDecimal autoPayAmount;

    // Worked side
    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal workedHours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal workedCost = BigDecimal.ZERO;

    @Builder.Default
    private int shiftCount = 0;

    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal workedNormalHours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal workedLeaveHours = BigDecimal.ZERO;

    @Builder.Default
    @Convert(converter = AmountMapConverter.class)
    @Column(length = 4000)
    private Map<String, BigDecimal> leaveBreakdown = new TreeMap<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 4000)
    private List<String> locations = new ArrayList<>();

    // Paid side
    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal paidHours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal paidGross = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal paidSuperannuation = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal paidNormalHours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal paidNormalPay = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal paidOvertimeHours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal paidOvertimePay = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal paidAnnualLeaveHours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal paidAnnualLeavePay = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal paidSickLeaveHours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal paidSickLeavePay = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal paidOtherLeaveHours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal paidOtherLeavePay = BigDecimal.ZERO;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 4000)
    private List<String> costCenters = new ArrayList<>();

    // Variances
    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal expectedCost = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 10, scale = 2)
    private BigDecimal hoursVariance = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal hoursVariancePct = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal costVariance = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2)
    private BigDecimal costVariancePct = BigDecimal.ZERO;

    @Builder.Default
    private boolean hoursMatch = true;

    @Builder.Default
    private boolean costMatch = true;

    @Builder.Default
    private boolean hasIssues = false;

    @Column(length = 1000)
    private String issueDescription;
}
