package com.PayRecon.recon_backend.model;

import com.PayRecon.recon_backend.enums.PeriodStatus;
import com.PayRecon.recon_backend.enums.SourceSystem;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "pay_periods")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayPeriod {

    // Period end date in ISO form, e.g. 2025-10-05
    @Id
    @Column(length = 20)
    private String periodId;

    @Column(nullable = false)
    private LocalDate periodStart;

    @Column(nullable = false)
    private LocalDate periodEnd;

    @Builder.Default
    @Column(nullable = false)
    private String periodType = "fortnightly";

    @Builder.Default
    private boolean hasTimesheet = false;

    @Builder.Default
    private boolean hasPayroll = false;

    @Builder.Default
    private boolean hasJournal = false;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PeriodStatus status = PeriodStatus.INCOMPLETE;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public boolean hasSource(SourceSystem source) {
        switch (source) {
            case TIMESHEET:
                return hasTimesheet;
            case PAYROLL:
                return hasPayroll;
            default:
                return hasJournal;
        }
    }

    public void markSource(SourceSystem source, boolean present) {
        switch (source) {
            case TIMESHEET:
                hasTimesheet = present;
                break;
            case PAYROLL:
                hasPayroll = present;
                break;
            default:
                hasJournal = present;
        }
        if (status == PeriodStatus.INCOMPLETE && isComplete()) {
            status = PeriodStatus.UPLOADED;
        }
    }

    public boolean isComplete() {
        return hasTimesheet && hasPayroll && hasJournal;
    }

    public List<SourceSystem> missingSources() {
        List<SourceSystem> missing = new ArrayList<>();
        for (SourceSystem source : SourceSystem.values()) {
            if (!hasSource(source)) {
                missing.add(source);
            }
        }
        return missing;
    }
}
