package com.PayRecon.recon_backend.dto.response;

import com.PayRecon.recon_backend.enums.AllocationSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationBuildSummary {
    private String periodId;
    private AllocationSource source;
    private int rulesCreated;
    private int validRules;
    private int invalidRules;
    // Employees keeping a rule this build may not replace
    private List<String> preservedEmployees;
    private int employeesWithoutAllocation;
    // Employee code -> unmapped timesheet location keys
    private Map<String, List<String>> mappingErrors;
}
