package com.PayRecon.recon_backend.controller;

import com.PayRecon.recon_backend.dto.request.JournalMappingRequest;
import com.PayRecon.recon_backend.dto.request.LocationMappingRequest;
import com.PayRecon.recon_backend.dto.request.PayCompMappingRequest;
import com.PayRecon.recon_backend.dto.request.SplitExpansionRequest;
import com.PayRecon.recon_backend.dto.request.SplitTargetsRequest;
import com.PayRecon.recon_backend.dto.request.TransactionTypeRequest;
import com.PayRecon.recon_backend.dto.response.ApiResponse;
import com.PayRecon.recon_backend.model.CostCenterSplit;
import com.PayRecon.recon_backend.model.JournalDescriptionMapping;
import com.PayRecon.recon_backend.model.LocationMapping;
import com.PayRecon.recon_backend.model.PayCompCodeMapping;
import com.PayRecon.recon_backend.model.TransactionTypeConfig;
import com.PayRecon.recon_backend.service.MappingService;
import com.PayRecon.recon_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/mappings")
@RequiredArgsConstructor
public class MappingController {

    private final MappingService mappingService;

    @GetMapping("/locations")
    public ResponseEntity<ApiResponse<List<LocationMapping>>> getLocationMappings(
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.getLocationMappings(activeOnly)));
    }

    @PostMapping("/locations")
    public ResponseEntity<ApiResponse<LocationMapping>> saveLocationMapping(
            @Valid @RequestBody LocationMappingRequest request) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.saveLocationMapping(request), Constants.SUCCESS_UPDATED));
    }

    @DeleteMapping("/locations/{id}")
    public ResponseEntity<ApiResponse<LocationMapping>> deactivateLocationMapping(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.setLocationMappingActive(id, false),
                "Location mapping deactivated successfully"));
    }

    @PatchMapping("/locations/{id}/activate")
    public ResponseEntity<ApiResponse<LocationMapping>> activateLocationMapping(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.setLocationMappingActive(id, true),
                "Location mapping activated successfully"));
    }

    @GetMapping("/splits")
    public ResponseEntity<ApiResponse<Map<String, List<CostCenterSplit>>>> getSplits() {
        return ResponseEntity.ok(ApiResponse.success(mappingService.getSplits()));
    }

    @GetMapping("/splits/{sourceAccount}")
    public ResponseEntity<ApiResponse<List<CostCenterSplit>>> getSplitTargets(@PathVariable String sourceAccount) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.getSplitTargets(sourceAccount)));
    }

    @PutMapping("/splits/{sourceAccount}")
    public ResponseEntity<ApiResponse<List<CostCenterSplit>>> replaceSplitTargets(
            @PathVariable String sourceAccount,
            @Valid @RequestBody SplitTargetsRequest request) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.replaceSplitTargets(sourceAccount, request),
                Constants.SUCCESS_UPDATED));
    }

    @PostMapping("/splits/expand")
    public ResponseEntity<ApiResponse<Map<String, BigDecimal>>> expand(@Valid @RequestBody SplitExpansionRequest request) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.expand(request)));
    }

    @GetMapping("/journal-descriptions")
    public ResponseEntity<ApiResponse<List<JournalDescriptionMapping>>> getJournalMappings() {
        return ResponseEntity.ok(ApiResponse.success(mappingService.getJournalMappings()));
    }

    @PostMapping("/journal-descriptions")
    public ResponseEntity<ApiResponse<JournalDescriptionMapping>> saveJournalMapping(
            @Valid @RequestBody JournalMappingRequest request) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.saveJournalMapping(request), Constants.SUCCESS_UPDATED));
    }

    @GetMapping("/transaction-types")
    public ResponseEntity<ApiResponse<List<TransactionTypeConfig>>> getTransactionTypes() {
        return ResponseEntity.ok(ApiResponse.success(mappingService.getTransactionTypes()));
    }

    @PostMapping("/transaction-types")
    public ResponseEntity<ApiResponse<TransactionTypeConfig>> saveTransactionType(
            @Valid @RequestBody TransactionTypeRequest request) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.saveTransactionType(request), Constants.SUCCESS_UPDATED));
    }

    @GetMapping("/pay-components")
    public ResponseEntity<ApiResponse<List<PayCompCodeMapping>>> getPayCompMappings() {
        return ResponseEntity.ok(ApiResponse.success(mappingService.getPayCompMappings()));
    }

    @PostMapping("/pay-components")
    public ResponseEntity<ApiResponse<PayCompCodeMapping>> savePayCompMapping(
            @Valid @RequestBody PayCompMappingRequest request) {
        return ResponseEntity.ok(ApiResponse.success(mappingService.savePayCompMapping(request), Constants.SUCCESS_UPDATED));
    }
}
