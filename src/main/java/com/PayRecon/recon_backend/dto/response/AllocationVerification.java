package com.PayRecon.recon_backend.dto.response;

import com.PayRecon.recon_backend.enums.AllocationSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Side by side view of the stored rule and both computed allocations per employee.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationVerification {
    private String periodId;
    private String departmentCode;
    private int employeeCount;
    private List<EmployeeAllocation> employees;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmployeeAllocation {
        private String employeeCode;
        private String employeeName;
        private AllocationSource currentSource;
        private Map<String, BigDecimal> currentPercentages;
        private boolean valid;
        private List<String> validationErrors;
        private Map<String, BigDecimal> defaultPercentages;
        private Map<String, BigDecimal> derivedPercentages;
        private List<String> unmappedLocations;
    }
}
