package com.PayRecon.recon_backend.dto.response;

import com.PayRecon.recon_backend.enums.ExceptionStatus;
import com.PayRecon.recon_backend.enums.ReconType;
import com.PayRecon.recon_backend.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationItemResponse {
    private UUID id;
    private UUID runId;
    private ReconType reconType;
    private Severity severity;
    private String employeeId;
    private String employeeName;
    private String costCenter;
    private BigDecimal expectedValue;
    private BigDecimal actualValue;
    private BigDecimal variance;
    private BigDecimal variancePct;
    private String description;
    private ExceptionStatus status;
    private String resolutionNotes;
    private String resolvedBy;
    private LocalDateTime resolvedAt;
    private LocalDateTime createdAt;
}
