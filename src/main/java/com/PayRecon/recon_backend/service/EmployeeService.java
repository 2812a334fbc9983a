package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.dto.request.EmployeeRequest;
import com.PayRecon.recon_backend.dto.response.EmployeeResponse;
import com.PayRecon.recon_backend.dto.response.PaginatedResponse;
import com.PayRecon.recon_backend.exception.ResourceNotFoundException;
import com.PayRecon.recon_backend.exception.ValidationException;
import com.PayRecon.recon_backend.model.Employee;
import com.PayRecon.recon_backend.repository.EmployeeRepository;
import com.PayRecon.recon_backend.service.snapshot.EmployeeDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.FieldError;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeService {

    private final EmployeeRepository employeeRepository;
    private final ModelMapper modelMapper;

    public EmployeeResponse getEmployee(String code) {
        Employee employee = employeeRepository.findById(code)
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "code", code));
        return mapToEmployeeResponse(employee);
    }

    public PaginatedResponse<EmployeeResponse> getAllEmployees(int page, int limit, String search, String employmentType) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("code").ascending());

        Page<Employee> employeesPage = employeeRepository.searchEmployees(search, employmentType, pageable);
        return PaginatedResponse.from(employeesPage, this::mapToEmployeeResponse);
    }

    @Transactional
    public EmployeeResponse saveEmployee(EmployeeRequest request) {
        Employee savedEmployee = employeeRepository.save(applyRequest(request));
        log.info("Employee master record saved: {}", savedEmployee.getCode());
        return mapToEmployeeResponse(savedEmployee);
    }

    /**
     * Upserts a batch of master records, keyed by employee code.
     */
    @Transactional
    public List<EmployeeResponse> saveEmployees(List<EmployeeRequest> requests) {
        List<FieldError> errors = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            String code = requests.get(i).getCode();
            if (code == null || code.isBlank()) {
                errors.add(new FieldError("employees", "[" + i + "].code", "Employee code is required"));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid employee records", errors);
        }

        List<Employee> employees = requests.stream()
                .map(this::applyRequest)
                .collect(Collectors.toList());

        List<Employee> savedEmployees = employeeRepository.saveAll(employees);
        log.info("Employee master import: {} records saved", savedEmployees.size());

        return savedEmployees.stream()
                .map(this::mapToEmployeeResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public EmployeeDirectory loadDirectory() {
        return EmployeeDirectory.of(employeeRepository.findAll());
    }

    private Employee applyRequest(EmployeeRequest request) {
        String code = request.getCode().trim();
        Employee employee = employeeRepository.findById(code)
                .orElseGet(() -> Employee.builder().code(code).build());

        employee.setFirstName(request.getFirstName());
        employee.setSurname(request.getSurname());
        employee.setEmploymentType(request.getEmploymentType());
        employee.setTerminationDate(request.getTerminationDate());
        employee.setAutoPay(request.isAutoPay());
        employee.setAutoPayAmount(request.getAutoPayAmount());
        employee.setDefaultCostAccount(request.getDefaultCostAccount());
        return employee;
    }

    private EmployeeResponse mapToEmployeeResponse(Employee employee) {
        EmployeeResponse response = modelMapper.map(employee, EmployeeResponse.class);
        response.setFullName(employee.getFullName());
        response.setSalaried(employee.isSalaried());
        return response;
    }
}
