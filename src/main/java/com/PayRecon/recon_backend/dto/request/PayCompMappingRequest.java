package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PayCompMappingRequest {

    @NotBlank(message = "Pay component code is required")
    private String payCompCode;

    @NotBlank(message = "GL account is required")
    private String glAccount;

    private String glName;
}
