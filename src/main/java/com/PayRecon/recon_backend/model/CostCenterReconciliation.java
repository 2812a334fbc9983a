package com.PayRecon.recon_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "cost_center_reconciliations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CostCenterReconciliation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private ReconciliationRun run;

    @Column(nullable = false, length = 50)
    private String costCenter;

    @Column(precision = 15, scale = 2)
    private BigDecimal paidAmount;

    @Column(precision = 15, scale = 2)
    private BigDecimal journalAmount;

    @Column(precision = 15, scale = 2)
    private BigDecimal variance;

    @Column(precision = 12, scale = 2)
    private BigDecimal variancePct;

    @Builder.Default
    private boolean flagged = false;
}
