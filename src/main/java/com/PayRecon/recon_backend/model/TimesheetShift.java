package com.PayRecon.recon_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One worked shift from the timesheet export.
 */
@Entity
@Table(name = "timesheet_shifts", indexes = {
        @Index(name = "idx_shift_period_employee", columnList = "pay_period_id, employee_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimesheetShift {

    private static final Map<String, String> LEAVE_KEYWORDS = new LinkedHashMap<>();

    static {
        LEAVE_KEYWORDS.put("AnnualLeave", "Annual Leave");
        LEAVE_KEYWORDS.put("SickLeave", "Sick Leave");
        LEAVE_KEYWORDS.put("PHTIL", "Public Holiday Time in Lieu");
        LEAVE_KEYWORDS.put("TIL", "Time in Lieu");
        LEAVE_KEYWORDS.put("LSL", "Long Service Leave");
    }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pay_period_id", nullable = false)
    private PayPeriod payPeriod;

    @Column(name = "employee_id", nullable = false, length = 50)
    private String employeeId;

    private String employeeName;

    private String employmentType;

    private String locationName;

    private String teamName;

    private String awardExportName;

    @Column(length = 50)
    private String glCode;

    private LocalDate shiftDate;

    @Builder.Default
    @Column(precision = 10, scale = 4, nullable = false)
    private BigDecimal hours = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 12, scale = 4, nullable = false)
    private BigDecimal cost = BigDecimal.ZERO;

    @Builder.Default
    private boolean leave = false;

    private String leaveType;

    @PrePersist
    @PreUpdate
    public void detectLeave() {
        if (awardExportName == null) {
            return;
        }
        for (Map.Entry<String, String> keyword : LEAVE_KEYWORDS.entrySet()) {
            if (awardExportName.contains(keyword.getKey())) {
                leave = true;
                leaveType = keyword.getValue();
                return;
            }
        }
    }

    /**
     * Location key used by the location mapping, {@code "<location> - <team>"}.
     */
    public String getLocationKey() {
        String location = locationName != null ? locationName.trim() : "";
        String team = teamName != null ? teamName.trim() : "";
        return location + " - " + team;
    }
}
