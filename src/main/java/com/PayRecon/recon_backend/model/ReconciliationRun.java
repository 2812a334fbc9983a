package com.PayRecon.recon_backend.model;

import com.PayRecon.recon_backend.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "reconciliation_runs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconciliationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pay_period_id", nullable = false)
    private PayPeriod payPeriod;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.RUNNING;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    @Builder.Default
    private int totalChecks = 0;

    @Builder.Default
    private int checksPassed = 0;

    @Builder.Default
    private int checksFailed = 0;

    @Builder.Default
    private int criticalExceptions = 0;

    @Builder.Default
    private int warnings = 0;

    @Builder.Default
    @Column(precision = 15, scale = 2)
    private BigDecimal journalTotalCost = BigDecimal.ZERO;

    @Builder.Default
    private int unmappedDescriptions = 0;

    @Column(length = 4000)
    private String errorMessage;
}
