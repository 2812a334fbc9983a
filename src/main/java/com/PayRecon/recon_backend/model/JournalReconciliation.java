package com.PayRecon.recon_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "journal_reconciliations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JournalReconciliation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private ReconciliationRun run;

    @Column(nullable = false)
    private String description;

    @Column(length = 50)
    private String glAccount;

    @Builder.Default
    private boolean includeInTotalCost = false;

    @Builder.Default
    private boolean mapped = false;

    @Column(precision = 15, scale = 2)
    private BigDecimal journalDebit;

    @Column(precision = 15, scale = 2)
    private BigDecimal journalCredit;

    @Column(precision = 15, scale = 2)
    private BigDecimal journalNet;
}
