package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimesheetShiftRequest {

    @NotBlank(message = "Employee ID is required")
    private String employeeId;

    private String employeeName;
    private String employmentType;
    private String locationName;
    private String teamName;
    private String awardExportName;
    private String glCode;
    private LocalDate shiftDate;

    @NotNull(message = "Hours are required")
    private BigDecimal hours;

    @NotNull(message = "Cost is required")
    private BigDecimal cost;
}
