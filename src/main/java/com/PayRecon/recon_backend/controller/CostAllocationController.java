package com.PayRecon.recon_backend.controller;

import com.PayRecon.recon_backend.dto.request.AllocationOverrideRequest;
import com.PayRecon.recon_backend.dto.response.AllocationBuildSummary;
import com.PayRecon.recon_backend.dto.response.AllocationVerification;
import com.PayRecon.recon_backend.dto.response.ApiResponse;
import com.PayRecon.recon_backend.dto.response.CostAllocationRuleResponse;
import com.PayRecon.recon_backend.enums.AllocationSource;
import com.PayRecon.recon_backend.exception.ApiException;
import com.PayRecon.recon_backend.service.CostAllocationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/allocations")
@RequiredArgsConstructor
public class CostAllocationController {

    private final CostAllocationService costAllocationService;

    @PostMapping("/periods/{periodId}/build")
    public ResponseEntity<ApiResponse<AllocationBuildSummary>> buildAllocations(
            @PathVariable String periodId,
            @RequestParam String source) {

        AllocationBuildSummary summary = costAllocationService.buildAllocations(periodId, parseSource(source));
        return ResponseEntity.ok(ApiResponse.success(summary, "Allocations built successfully"));
    }

    @PutMapping("/periods/{periodId}/employees/{employeeCode}/override")
    public ResponseEntity<ApiResponse<CostAllocationRuleResponse>> applyOverride(
            @PathVariable String periodId,
            @PathVariable String employeeCode,
            @Valid @RequestBody AllocationOverrideRequest request) {

        CostAllocationRuleResponse rule = costAllocationService.applyOverride(periodId, employeeCode, request);
        return ResponseEntity.ok(ApiResponse.success(rule, "Allocation override saved"));
    }

    @GetMapping("/periods/{periodId}")
    public ResponseEntity<ApiResponse<List<CostAllocationRuleResponse>>> getRules(
            @PathVariable String periodId,
            @RequestParam(required = false) String source) {

        AllocationSource filter = parseSource(source);
        return ResponseEntity.ok(ApiResponse.success(costAllocationService.getRules(periodId, filter)));
    }

    @GetMapping("/periods/{periodId}/employees/{employeeCode}")
    public ResponseEntity<ApiResponse<CostAllocationRuleResponse>> getRule(
            @PathVariable String periodId,
            @PathVariable String employeeCode) {

        return ResponseEntity.ok(ApiResponse.success(costAllocationService.getRule(periodId, employeeCode)));
    }

    @GetMapping("/periods/{periodId}/verification")
    public ResponseEntity<ApiResponse<AllocationVerification>> getVerification(
            @PathVariable String periodId,
            @RequestParam(required = false) String department) {

        return ResponseEntity.ok(ApiResponse.success(costAllocationService.getVerification(periodId, department)));
    }

    private static AllocationSource parseSource(String source) {
        try {
            return AllocationSource.fromString(source);
        } catch (IllegalArgumentException e) {
            throw new ApiException(e.getMessage(), HttpStatus.BAD_REQUEST, "INVALID_ALLOCATION_SOURCE", e);
        }
    }
}
