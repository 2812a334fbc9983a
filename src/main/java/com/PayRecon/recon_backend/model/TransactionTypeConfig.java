package com.PayRecon.recon_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Whether a payroll transaction type counts towards paid hours and paid cost.
 */
@Entity
@Table(name = "transaction_type_configs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionTypeConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String transactionType;

    @Builder.Default
    private boolean includeInHours = false;

    @Builder.Default
    private boolean includeInCosts = false;

    private String notes;

    @Builder.Default
    private boolean active = true;
}
