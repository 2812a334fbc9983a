package com.PayRecon.recon_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Employee master record, keyed by the payroll employee code.
 */
@Entity
@Table(name = "employees")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Employee {

    @Id
    @Column(length = 50)
    private String code;

    private String firstName;

    private String surname;

    private String employmentType;

    private LocalDate terminationDate;

    @Builder.Default
    private boolean autoPay = false;

    @Column(precision = 12, scale = 2)
    private BigDecimal autoPayAmount;

    @Column(length = 50)
    private String defaultCostAccount;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public String getFullName() {
        String first = firstName != null ? firstName.trim() : "";
        String last = surname != null ? surname.trim() : "";
        return (first + " " + last).trim();
    }

    public boolean hasAutoPayAmount() {
        return autoPay && autoPayAmount != null && autoPayAmount.signum() > 0;
    }

    /**
     * Salaried staff are paid a fixed auto-pay amount rather than their timesheet cost.
     */
    public boolean isSalaried() {
        if (!autoPay || employmentType == null) {
            return false;
        }
        String type = employmentType.trim().toUpperCase();
        return type.contains("SALARIED") || type.startsWith("SF");
    }

    public boolean isCasual() {
        return employmentType != null && employmentType.toLowerCase().contains("casual");
    }

    public boolean isTerminatedBefore(LocalDate date) {
        return terminationDate != null && terminationDate.isBefore(date);
    }
}
