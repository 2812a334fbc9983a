package com.PayRecon.recon_backend.model;

import com.PayRecon.recon_backend.enums.AllocationSource;
import com.PayRecon.recon_backend.model.converter.AllocationMapConverter;
import com.PayRecon.recon_backend.model.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Percentage split of one employee's cost across cost centers for a period.
 */
@Entity
@Table(name = "cost_allocation_rules", uniqueConstraints = {
        @UniqueConstraint(name = "uk_allocation_period_employee", columnNames = {"pay_period_id", "employee_code"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CostAllocationRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pay_period_id", nullable = false)
    private PayPeriod payPeriod;

    @Column(name = "employee_code", nullable = false, length = 50)
    private String employeeCode;

    private String employeeName;

    @Column(nullable = false, length = 20)
    private AllocationSource source;

    @Builder.Default
    @Convert(converter = AllocationMapConverter.class)
    @Column(length = 4000)
    private Map<String, AllocationEntry> allocations = new TreeMap<>();

    @Builder.Default
    @Column(precision = 7, scale = 2)
    private BigDecimal totalPercentage = BigDecimal.ZERO;

    @Builder.Default
    private boolean valid = false;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 4000)
    private List<String> validationErrors = new ArrayList<>();

    private String updatedBy;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
