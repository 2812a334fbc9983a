package com.PayRecon.recon_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One line of the payroll bureau detail report.
 */
@Entity
@Table(name = "payroll_detail_lines", indexes = {
        @Index(name = "idx_payroll_period_employee", columnList = "pay_period_id, employee_code")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayrollDetailLine {

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

    @Column(length = 50)
    private String costAccountCode;

    @Column(length = 50)
    private String payCompCode;

    @Column(nullable = false)
    private String transactionType;

    @Builder.Default
    @Column(precision = 10, scale = 4, nullable = false)
    private BigDecimal hours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 2, nullable = false)
    private BigDecimal amount = BigDecimal.ZERO;
}
