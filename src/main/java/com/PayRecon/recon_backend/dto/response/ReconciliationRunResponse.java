package com.PayRecon.recon_backend.dto.response;

import com.PayRecon.recon_backend.enums.RunStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReconciliationRunResponse {
    private UUID id;
    private String periodId;
    private RunStatus status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private int totalChecks;
    private int checksPassed;
    private int checksFailed;
    private int criticalExceptions;
    private int warnings;
    private BigDecimal journalTotalCost;
    private int unmappedDescriptions;
    private String errorMessage;

    // Only populated on the detailed view of a single run
    private Integer employeeCount;
    private List<ReconciliationItemResponse> exceptions;
    private List<CostCenterReconciliationResponse> costCenters;
    private List<JournalReconciliationResponse> journal;
}
