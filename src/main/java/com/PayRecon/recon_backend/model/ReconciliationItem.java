package com.PayRecon.recon_backend.model;

import com.PayRecon.recon_backend.enums.ExceptionStatus;
import com.PayRecon.recon_backend.enums.ReconType;
import com.PayRecon.recon_backend.enums.Severity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A classified reconciliation exception raised by a run. Only the review fields change after creation.
 */
@Entity
@Table(name = "reconciliation_exceptions", indexes = {
        @Index(name = "idx_recon_exception_run", columnList = "run_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconciliationItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private ReconciliationRun run;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReconType reconType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @Column(length = 50)
    private String employeeId;

    private String employeeName;

    @Column(length = 50)
    private String costCenter;

    @Column(precision = 15, scale = 2)
    private BigDecimal expectedValue;

    @Column(precision = 15, scale = 2)
    private BigDecimal actualValue;

    @Column(precision = 15, scale = 2)
    private BigDecimal variance;

    @Column(precision = 12, scale = 2)
    private BigDecimal variancePct;

    @Column(nullable = false, length = 1000)
    private String description;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExceptionStatus status = ExceptionStatus.OPEN;

    @Column(length = 2000)
    private String resolutionNotes;

    private String resolvedBy;

    private LocalDateTime resolvedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
