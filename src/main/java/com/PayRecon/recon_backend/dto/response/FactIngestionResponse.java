package com.PayRecon.recon_backend.dto.response;

import com.PayRecon.recon_backend.enums.SourceSystem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactIngestionResponse {
    private String periodId;
    private SourceSystem source;
    private int rowsReplaced;
    private int rowsIngested;
    private PayPeriodResponse period;
}
