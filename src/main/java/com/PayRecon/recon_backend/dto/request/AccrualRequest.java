package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccrualRequest {

    @NotNull(message = "Accrual start date is required")
    private LocalDate startDate;

    @NotNull(message = "Accrual end date is required")
    private LocalDate endDate;
}
