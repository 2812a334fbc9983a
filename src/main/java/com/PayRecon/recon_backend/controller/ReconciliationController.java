package com.PayRecon.recon_backend.controller;

import com.PayRecon.recon_backend.dto.request.ItemStatusRequest;
import com.PayRecon.recon_backend.dto.response.ApiResponse;
import com.PayRecon.recon_backend.dto.response.EmployeeReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.PaginatedResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationItemResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationRunResponse;
import com.PayRecon.recon_backend.enums.ExceptionStatus;
import com.PayRecon.recon_backend.enums.ReconType;
import com.PayRecon.recon_backend.enums.RunStatus;
import com.PayRecon.recon_backend.enums.Severity;
import com.PayRecon.recon_backend.service.ReconciliationItemService;
import com.PayRecon.recon_backend.service.ReconciliationService;
import com.PayRecon.recon_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/reconciliation")
@RequiredArgsConstructor
@Slf4j
public class ReconciliationController {

    private static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final ReconciliationService reconciliationService;
    private final ReconciliationItemService reconciliationItemService;

    /**
     * A failed run is still a 200: the body carries the FAILED run and its error message.
     */
    @PostMapping("/periods/{periodId}/runs")
    public ResponseEntity<ApiResponse<ReconciliationRunResponse>> runReconciliation(@PathVariable String periodId) {
        ReconciliationRunResponse run = reconciliationService.runReconciliation(periodId);
        String message = run.getStatus() == RunStatus.FAILED
                ? "Reconciliation failed: " + run.getErrorMessage()
                : "Reconciliation completed";
        return ResponseEntity.ok(ApiResponse.success(run, message));
    }

    @GetMapping("/periods/{periodId}/runs")
    public ResponseEntity<ApiResponse<PaginatedResponse<ReconciliationRunResponse>>> getRuns(
            @PathVariable String periodId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {

        PaginatedResponse<ReconciliationRunResponse> runs = reconciliationService.getRuns(
                periodId, Math.max(page, 1), Math.min(Math.max(limit, 1), Constants.MAX_PAGE_SIZE));
        return ResponseEntity.ok(ApiResponse.success(runs));
    }

    @GetMapping("/periods/{periodId}/employees")
    public ResponseEntity<ApiResponse<List<EmployeeReconciliationResponse>>> getEmployeeReconciliations(
            @PathVariable String periodId,
            @RequestParam(defaultValue = "false") boolean issuesOnly) {

        return ResponseEntity.ok(ApiResponse.success(
                reconciliationService.getEmployeeReconciliations(periodId, issuesOnly)));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<ApiResponse<ReconciliationRunResponse>> getRun(@PathVariable UUID runId) {
        return ResponseEntity.ok(ApiResponse.success(reconciliationService.getRun(runId)));
    }

    @GetMapping("/runs/{runId}/items")
    public ResponseEntity<ApiResponse<PaginatedResponse<ReconciliationItemResponse>>> getItems(
            @PathVariable UUID runId,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) ExceptionStatus status,
            @RequestParam(required = false) ReconType reconType,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit) {

        PaginatedResponse<ReconciliationItemResponse> items = reconciliationItemService.getItems(
                runId, severity, status, reconType,
                Math.max(page, 1), Math.min(Math.max(limit, 1), Constants.MAX_PAGE_SIZE));
        return ResponseEntity.ok(ApiResponse.success(items));
    }

    @GetMapping("/runs/{runId}/export")
    public ResponseEntity<ByteArrayResource> exportRun(@PathVariable UUID runId) {
        byte[] report = reconciliationService.exportRun(runId);
        String filename = "reconciliation-" + runId + ".xlsx";
        log.debug("Sending {} ({} bytes)", filename, report.length);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(XLSX)
                .contentLength(report.length)
                .body(new ByteArrayResource(report));
    }

    @PatchMapping("/items/{itemId}/status")
    public ResponseEntity<ApiResponse<ReconciliationItemResponse>> updateItemStatus(
            @PathVariable UUID itemId,
            @Valid @RequestBody ItemStatusRequest request) {

        ReconciliationItemResponse item = reconciliationItemService.updateStatus(itemId, request);
        return ResponseEntity.ok(ApiResponse.success(item, Constants.SUCCESS_UPDATED));
    }
}
