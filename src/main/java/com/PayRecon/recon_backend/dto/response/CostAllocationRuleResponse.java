package com.PayRecon.recon_backend.dto.response;

import com.PayRecon.recon_backend.enums.AllocationSource;
import com.PayRecon.recon_backend.model.AllocationEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostAllocationRuleResponse {
    private UUID id;
    private String periodId;
    private String employeeCode;
    private String employeeName;
    private AllocationSource source;
    private Map<String, AllocationEntry> allocations;
    private BigDecimal totalPercentage;
    private boolean valid;
    private List<String> validationErrors;
    private String updatedBy;
    private LocalDateTime updatedAt;
}
