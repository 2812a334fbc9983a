package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayrollUploadRequest {

    @NotNull(message = "Lines are required")
    @Valid
    private List<PayrollDetailLineRequest> lines;
}
