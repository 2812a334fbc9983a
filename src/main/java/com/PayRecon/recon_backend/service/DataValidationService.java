package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.dto.response.ValidationReport;
import com.PayRecon.recon_backend.exception.ResourceNotFoundException;
import com.PayRecon.recon_backend.model.CostCenterSplit;
import com.PayRecon.recon_backend.model.PayrollDetailLine;
import com.PayRecon.recon_backend.model.TimesheetShift;
import com.PayRecon.recon_backend.repository.CostCenterSplitRepository;
import com.PayRecon.recon_backend.repository.PayPeriodRepository;
import com.PayRecon.recon_backend.repository.PayrollDetailLineRepository;
import com.PayRecon.recon_backend.repository.TimesheetShiftRepository;
import com.PayRecon.recon_backend.service.snapshot.EmployeeDirectory;
import com.PayRecon.recon_backend.service.snapshot.MappingSnapshot;
import com.PayRecon.recon_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks a period's facts against the reference data before reconciling.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataValidationService {

    private final PayPeriodRepository payPeriodRepository;
    private final PayrollDetailLineRepository payrollDetailLineRepository;
    private final TimesheetShiftRepository timesheetShiftRepository;
    private final CostCenterSplitRepository costCenterSplitRepository;
    private final MappingRegistryService mappingRegistryService;
    private final EmployeeService employeeService;
    private final AllocationValidator allocationValidator;
    private final SplitExpander splitExpander;

    @Transactional(readOnly = true)
    public ValidationReport validatePeriod(String periodId) {
        if (!payPeriodRepository.existsById(periodId)) {
            throw new ResourceNotFoundException("PayPeriod", "periodId", periodId);
        }

        MappingSnapshot snapshot = mappingRegistryService.loadSnapshot();
        EmployeeDirectory directory = employeeService.loadDirectory();
        List<PayrollDetailLine> lines = payrollDetailLineRepository.findByPeriodId(periodId);
        List<TimesheetShift> shifts = timesheetShiftRepository.findByPeriodId(periodId);

        Set<String> paidAccounts = distinct(lines.stream().map(PayrollDetailLine::getCostAccountCode));

        List<ValidationReport.Check> checks = new ArrayList<>();
        checks.add(check("cost-account-format",
                "Paid cost accounts have the location-department format",
                paidAccounts, account -> !allocationValidator.isValidCostAccount(account)));
        checks.add(check("cost-account-known",
                "Paid cost accounts are known in the location mappings or the split table",
                paidAccounts, account -> !snapshot.isKnownCostAccount(account)));
        checks.add(check("split-targets",
                "Split targets are valid, non-virtual cost accounts",
                distinct(costCenterSplitRepository.findByActiveTrue().stream().map(CostCenterSplit::getTargetAccount)),
                account -> splitExpander.isVirtual(account) || !allocationValidator.isValidCostAccount(account)));
        checks.add(check("pay-comp-codes",
                "Pay component codes are mapped to a GL account",
                distinct(lines.stream().map(PayrollDetailLine::getPayCompCode)),
                code -> snapshot.findPayComp(code).isEmpty()));
        checks.add(check("payroll-employees",
                "Paid employees exist in the employee master",
                distinct(lines.stream().map(PayrollDetailLine::getEmployeeCode)),
                code -> !directory.contains(code)));
        checks.add(check("timesheet-employees",
                "Timesheet employees exist in the employee master",
                distinct(shifts.stream().map(TimesheetShift::getEmployeeId)),
                code -> !directory.contains(code)));
        checks.add(check("timesheet-locations",
                "Timesheet location and team combinations are mapped to a cost account",
                distinct(shifts.stream().map(TimesheetShift::getLocationKey)),
                key -> snapshot.findLocation(key).isEmpty()));

        int failed = (int) checks.stream().filter(check -> !check.isPassed()).count();
        log.info("Reference data validation for period {}: {} of {} checks failed", periodId, failed, checks.size());

        return ValidationReport.builder()
                .periodId(periodId)
                .passed(failed == 0)
                .failedChecks(failed)
                .checks(checks)
                .build();
    }

    private static ValidationReport.Check check(String name, String description, Set<String> values,
                                                Predicate<String> failing) {
        List<String> failures = values.stream().filter(failing).collect(Collectors.toList());
        return ValidationReport.Check.builder()
                .name(name)
                .description(description)
                .passed(failures.isEmpty())
                .failureCount(failures.size())
                .examples(failures.stream().limit(Constants.MAX_VALIDATION_EXAMPLES).collect(Collectors.toList()))
                .build();
    }

    private static Set<String> distinct(Stream<String> values) {
        return values.filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
