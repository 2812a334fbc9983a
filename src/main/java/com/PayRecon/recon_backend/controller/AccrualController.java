package com.PayRecon.recon_backend.controller;

import com.PayRecon.recon_backend.dto.request.AccrualRequest;
import com.PayRecon.recon_backend.dto.response.AccrualResultResponse;
import com.PayRecon.recon_backend.dto.response.AccrualSummary;
import com.PayRecon.recon_backend.dto.response.ApiResponse;
import com.PayRecon.recon_backend.service.AccrualService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/accruals")
@RequiredArgsConstructor
public class AccrualController {

    private final AccrualService accrualService;

    @PostMapping("/periods/{periodId}")
    public ResponseEntity<ApiResponse<AccrualSummary>> processAccruals(
            @PathVariable String periodId,
            @Valid @RequestBody AccrualRequest request) {

        AccrualSummary summary = accrualService.processAccruals(periodId, request);
        return ResponseEntity.ok(ApiResponse.success(summary, "Accruals processed successfully"));
    }

    @GetMapping("/periods/{periodId}")
    public ResponseEntity<ApiResponse<List<AccrualResultResponse>>> getAccruals(@PathVariable String periodId) {
        return ResponseEntity.ok(ApiResponse.success(accrualService.getAccruals(periodId)));
    }
}
