package com.PayRecon.recon_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class JournalMappingRequest {

    @NotBlank(message = "Description is required")
    private String description;

    private String glAccount;
    private boolean includeInTotalCost = true;
    private boolean active = true;
}
