package com.PayRecon.recon_backend.controller;

import com.PayRecon.recon_backend.dto.request.EmployeeRequest;
import com.PayRecon.recon_backend.dto.response.ApiResponse;
import com.PayRecon.recon_backend.dto.response.EmployeeResponse;
import com.PayRecon.recon_backend.dto.response.PaginatedResponse;
import com.PayRecon.recon_backend.service.EmployeeService;
import com.PayRecon.recon_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/employees")
@RequiredArgsConstructor
public class EmployeeController {

    private final EmployeeService employeeService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<EmployeeResponse>>> getAllEmployees(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String employmentType) {

        PaginatedResponse<EmployeeResponse> employees = employeeService.getAllEmployees(
                Math.max(page, 1), Math.min(Math.max(limit, 1), Constants.MAX_PAGE_SIZE), search, employmentType);
        return ResponseEntity.ok(ApiResponse.success(employees));
    }

    @GetMapping("/{code}")
    public ResponseEntity<ApiResponse<EmployeeResponse>> getEmployee(@PathVariable String code) {
        return ResponseEntity.ok(ApiResponse.success(employeeService.getEmployee(code)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<EmployeeResponse>> saveEmployee(@Valid @RequestBody EmployeeRequest request) {
        EmployeeResponse employee = employeeService.saveEmployee(request);
        return ResponseEntity.ok(ApiResponse.success(employee, "Employee saved successfully"));
    }

    @PutMapping("/bulk")
    public ResponseEntity<ApiResponse<List<EmployeeResponse>>> saveEmployees(
            @RequestBody List<EmployeeRequest> requests) {

        List<EmployeeResponse> employees = employeeService.saveEmployees(requests);
        return ResponseEntity.ok(ApiResponse.success(employees, employees.size() + " employees saved successfully"));
    }
}
