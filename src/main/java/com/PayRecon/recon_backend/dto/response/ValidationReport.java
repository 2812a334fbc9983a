package com.PayRecon.recon_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {
    private String periodId;
    private boolean passed;
    private int failedChecks;
    private List<Check> checks;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Check {
        private String name;
        private String description;
        private boolean passed;
        private int failureCount;
        // First examples only
        private List<String> examples;
    }
}
