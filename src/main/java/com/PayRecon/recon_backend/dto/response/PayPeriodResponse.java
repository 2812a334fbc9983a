package com.PayRecon.recon_backend.dto.response;

import com.PayRecon.recon_backend.enums.PeriodStatus;
import com.PayRecon.recon_backend.enums.SourceSystem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayPeriodResponse {
    private String periodId;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private String periodType;
    private boolean hasTimesheet;
    private boolean hasPayroll;
    private boolean hasJournal;
    private PeriodStatus status;
    private List<SourceSystem> missingSources;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
