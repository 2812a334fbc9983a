package com.PayRecon.recon_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One weighted target of a virtual split account. Weights are fractions, 0.6 meaning 60%.
 */
@Entity
@Table(name = "cost_center_splits", uniqueConstraints = {
        @UniqueConstraint(name = "uk_split_source_target", columnNames = {"source_account", "target_account"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CostCenterSplit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_account", nullable = false, length = 50)
    private String sourceAccount;

    @Column(name = "target_account", nullable = false, length = 50)
    private String targetAccount;

    @Column(nullable = false, precision = 5, scale = 4)
    private BigDecimal percentage;

    @Builder.Default
    private boolean active = true;

    private String notes;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
