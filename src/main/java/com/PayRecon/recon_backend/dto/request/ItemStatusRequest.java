package com.PayRecon.recon_backend.dto.request;

import com.PayRecon.recon_backend.enums.ExceptionStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemStatusRequest {

    @NotNull(message = "Status is required")
    private ExceptionStatus status;

    private String notes;

    private String resolvedBy;
}
