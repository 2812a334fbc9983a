package com.PayRecon.recon_backend.model;

import com.PayRecon.recon_backend.enums.AccrualAllocationSource;
import com.PayRecon.recon_backend.enums.WageSource;
import com.PayRecon.recon_backend.model.converter.AmountMapConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

@Entity
@Table(name = "accrual_results", uniqueConstraints = {
        @UniqueConstraint(name = "uk_accrual_period_employee", columnNames = {"pay_period_id", "employee_code"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccrualResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pay_period_id", nullable = false)
    private PayPeriod payPeriod;

    @Column(name = "employee_code", nullable = false, length = 50)
    private String employeeCode;

    private String employeeName;

    private String employmentType;

    private LocalDate accrualStart;

    private LocalDate accrualEnd;

    private int daysInPeriod;

    @Column(precision = 12, scale = 2)
    private BigDecimal baseWage;

    @Column(precision = 12, scale = 2)
    private BigDecimal superannuation;

    @Column(precision = 12, scale = 2)
    private BigDecimal annualLeave;

    @Column(precision = 12, scale = 2)
    private BigDecimal payrollTax;

    @Column(precision = 12, scale = 2)
    private BigDecimal workcover;

    @Column(precision = 12, scale = 2)
    private BigDecimal totalOnCosts;

    @Column(precision = 12, scale = 2)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    private WageSource wageSource;

    @Enumerated(EnumType.STRING)
    private AccrualAllocationSource allocationSource;

    // Cost account -> percentage
    @Builder.Default
    @Convert(converter = AmountMapConverter.class)
    @Column(length = 4000)
    private Map<String, BigDecimal> costAllocation = new TreeMap<>();

    @UpdateTimestamp
    private LocalDateTime calculatedAt;
}
