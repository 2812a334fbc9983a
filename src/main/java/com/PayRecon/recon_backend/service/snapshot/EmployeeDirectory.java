package com.PayRecon.recon_backend.service.snapshot;

import com.PayRecon.recon_backend.model.Employee;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Employee master records keyed by employee code, loaded once per operation.
 */
public class EmployeeDirectory {

    private final Map<String, Employee> employeesByCode;

    private EmployeeDirectory(Map<String, Employee> employeesByCode) {
        this.employeesByCode = Collections.unmodifiableMap(employeesByCode);
    }

    public static EmployeeDirectory of(Collection<Employee> employees) {
        Map<String, Employee> byCode = new TreeMap<>();
        if (employees != null) {
            for (Employee employee : employees) {
                byCode.put(employee.getCode(), employee);
            }
        }
        return new EmployeeDirectory(byCode);
    }

    public static EmployeeDirectory empty() {
        return of(Collections.emptyList());
    }

    public Optional<Employee> find(String code) {
        return Optional.ofNullable(employeesByCode.get(code));
    }

    public boolean contains(String code) {
        return employeesByCode.containsKey(code);
    }

    /**
     * Employees paid a fixed auto-pay amount, in code order.
     */
    public List<Employee> autoPayEmployees() {
        return employeesByCode.values().stream()
                .filter(Employee::hasAutoPayAmount)
                .collect(Collectors.toList());
    }

    public int size() {
        return employeesByCode.size();
    }
}
