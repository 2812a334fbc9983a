package com.PayRecon.recon_backend.controller;

import com.PayRecon.recon_backend.dto.request.JournalUploadRequest;
import com.PayRecon.recon_backend.dto.request.PayPeriodRequest;
import com.PayRecon.recon_backend.dto.request.PayrollUploadRequest;
import com.PayRecon.recon_backend.dto.request.TimesheetUploadRequest;
import com.PayRecon.recon_backend.dto.response.ApiResponse;
import com.PayRecon.recon_backend.dto.response.FactIngestionResponse;
import com.PayRecon.recon_backend.dto.response.PaginatedResponse;
import com.PayRecon.recon_backend.dto.response.PayPeriodResponse;
import com.PayRecon.recon_backend.dto.response.ValidationReport;
import com.PayRecon.recon_backend.enums.PeriodStatus;
import com.PayRecon.recon_backend.service.DataValidationService;
import com.PayRecon.recon_backend.service.PayPeriodService;
import com.PayRecon.recon_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/periods")
@RequiredArgsConstructor
public class PayPeriodController {

    private final PayPeriodService payPeriodService;
    private final DataValidationService dataValidationService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<PayPeriodResponse>>> getPeriods(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) PeriodStatus status) {

        PaginatedResponse<PayPeriodResponse> periods = payPeriodService.getPeriods(
                Math.max(page, 1), Math.min(Math.max(limit, 1), Constants.MAX_PAGE_SIZE), status);
        return ResponseEntity.ok(ApiResponse.success(periods));
    }

    @GetMapping("/{periodId}")
    public ResponseEntity<ApiResponse<PayPeriodResponse>> getPeriod(@PathVariable String periodId) {
        return ResponseEntity.ok(ApiResponse.success(payPeriodService.getPeriod(periodId)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<PayPeriodResponse>> savePeriod(@Valid @RequestBody PayPeriodRequest request) {
        PayPeriodResponse period = payPeriodService.savePeriod(request);
        return ResponseEntity.ok(ApiResponse.success(period, "Pay period saved successfully"));
    }

    @PutMapping("/{periodId}/timesheet")
    public ResponseEntity<ApiResponse<FactIngestionResponse>> ingestTimesheet(
            @PathVariable String periodId,
            @Valid @RequestBody TimesheetUploadRequest request) {

        FactIngestionResponse response = payPeriodService.ingestTimesheet(periodId, request.getShifts());
        return ResponseEntity.ok(ApiResponse.success(response, "Timesheet data ingested successfully"));
    }

    @PutMapping("/{periodId}/payroll")
    public ResponseEntity<ApiResponse<FactIngestionResponse>> ingestPayroll(
            @PathVariable String periodId,
            @Valid @RequestBody PayrollUploadRequest request) {

        FactIngestionResponse response = payPeriodService.ingestPayroll(periodId, request.getLines());
        return ResponseEntity.ok(ApiResponse.success(response, "Payroll data ingested successfully"));
    }

    @PutMapping("/{periodId}/journal")
    public ResponseEntity<ApiResponse<FactIngestionResponse>> ingestJournal(
            @PathVariable String periodId,
            @Valid @RequestBody JournalUploadRequest request) {

        FactIngestionResponse response = payPeriodService.ingestJournal(periodId, request.getLines());
        return ResponseEntity.ok(ApiResponse.success(response, "Journal data ingested successfully"));
    }

    @GetMapping("/{periodId}/validation")
    public ResponseEntity<ApiResponse<ValidationReport>> validatePeriod(@PathVariable String periodId) {
        return ResponseEntity.ok(ApiResponse.success(dataValidationService.validatePeriod(periodId)));
    }
}
