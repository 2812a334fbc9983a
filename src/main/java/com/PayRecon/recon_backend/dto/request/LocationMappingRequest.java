package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LocationMappingRequest {

    @NotBlank(message = "Timesheet location is required")
    private String timesheetLocation;

    @NotBlank(message = "Cost account code is required")
    private String costAccountCode;

    private String departmentCode;
    private String departmentName;
    private Boolean active;
}
