package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.dto.request.AllocationOverrideRequest;
import com.PayRecon.recon_backend.dto.response.AllocationBuildSummary;
import com.PayRecon.recon_backend.dto.response.AllocationVerification;
import com.PayRecon.recon_backend.dto.response.CostAllocationRuleResponse;
import com.PayRecon.recon_backend.enums.AllocationSource;
import com.PayRecon.recon_backend.enums.SourceSystem;
import com.PayRecon.recon_backend.exception.ApiException;
import com.PayRecon.recon_backend.exception.DataUnavailableException;
import com.PayRecon.recon_backend.exception.ResourceNotFoundException;
import com.PayRecon.recon_backend.exception.ValidationException;
import com.PayRecon.recon_backend.model.AllocationEntry;
import com.PayRecon.recon_backend.model.CostAllocationRule;
import com.PayRecon.recon_backend.model.PayPeriod;
import com.PayRecon.recon_backend.model.PayrollDetailLine;
import com.PayRecon.recon_backend.model.TimesheetShift;
import com.PayRecon.recon_backend.repository.CostAllocationRuleRepository;
import com.PayRecon.recon_backend.repository.PayPeriodRepository;
import com.PayRecon.recon_backend.repository.PayrollDetailLineRepository;
import com.PayRecon.recon_backend.repository.TimesheetShiftRepository;
import com.PayRecon.recon_backend.service.snapshot.MappingSnapshot;
import com.PayRecon.recon_backend.util.CostAccountCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.FieldError;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CostAllocationService {

    private static final String SYSTEM_USER = "system";

    private final CostAllocationRuleRepository costAllocationRuleRepository;
    private final PayPeriodRepository payPeriodRepository;
    private final PayrollDetailLineRepository payrollDetailLineRepository;
    private final TimesheetShiftRepository timesheetShiftRepository;
    private final MappingRegistryService mappingRegistryService;
    private final AllocationCalculator allocationCalculator;
    private final AllocationValidator allocationValidator;
    private final PeriodLockService periodLockService;
    private final TransactionTemplate transactionTemplate;

    /**
     * Rebuilds every rule of one built source for the period. Existing rules of that source are
     * deleted first; rules the source may not replace are kept and reported.
     */
    public AllocationBuildSummary buildAllocations(String periodId, AllocationSource source) {
        if (source == null || !source.isBuilt()) {
            throw new ApiException("Only DEFAULT or DERIVED allocations can be built, overrides are set per employee",
                    HttpStatus.BAD_REQUEST, "INVALID_ALLOCATION_SOURCE");
        }
        return periodLockService.executeWithLock(periodId,
                () -> transactionTemplate.execute(status -> doBuild(periodId, source)));
    }

    private AllocationBuildSummary doBuild(String periodId, AllocationSource source) {
        findPeriod(periodId);

        Map<String, Map<String, AllocationEntry>> computed = new TreeMap<>();
        Map<String, String> names = new TreeMap<>();
        Map<String, List<String>> mappingErrors = new TreeMap<>();
        int withoutAllocation;

        if (source == AllocationSource.DEFAULT) {
            List<PayrollDetailLine> lines = payrollDetailLineRepository.findByPeriodId(periodId);
            if (lines.isEmpty()) {
                throw new DataUnavailableException(periodId, SourceSystem.PAYROLL);
            }
            Map<String, List<PayrollDetailLine>> byEmployee = groupBy(lines, PayrollDetailLine::getEmployeeCode);
            byEmployee.forEach((code, employeeLines) -> {
                names.put(code, employeeLines.get(0).getEmployeeName());
                allocationCalculator.fromPayroll(employeeLines).ifPresent(allocations -> computed.put(code, allocations));
            });
            withoutAllocation = byEmployee.size() - computed.size();
        } else {
            List<TimesheetShift> shifts = timesheetShiftRepository.findByPeriodId(periodId);
            if (shifts.isEmpty()) {
                throw new DataUnavailableException(periodId, SourceSystem.TIMESHEET);
            }
            MappingSnapshot snapshot = mappingRegistryService.loadSnapshot();
            Map<String, List<TimesheetShift>> byEmployee = groupBy(shifts, TimesheetShift::getEmployeeId);
            byEmployee.forEach((code, employeeShifts) -> {
                names.put(code, employeeShifts.get(0).getEmployeeName());
                AllocationCalculator.DerivedAllocation derived = allocationCalculator.fromShifts(employeeShifts, snapshot);
                if (!derived.getUnmappedLocations().isEmpty()) {
                    mappingErrors.put(code, derived.getUnmappedLocations());
                }
                if (!derived.isEmpty()) {
                    computed.put(code, derived.getAllocations());
                }
            });
            withoutAllocation = byEmployee.size() - computed.size();
        }

        int deleted = costAllocationRuleRepository.deleteByPeriodIdAndSource(periodId, source);
        Map<String, CostAllocationRule> existing = costAllocationRuleRepository.findByPeriodId(periodId, null)
                .stream()
                .collect(Collectors.toMap(CostAllocationRule::getEmployeeCode, Function.identity()));
        PayPeriod period = findPeriod(periodId);

        List<String> preserved = new ArrayList<>();
        List<CostAllocationRule> rules = new ArrayList<>();
        for (Map.Entry<String, Map<String, AllocationEntry>> entry : computed.entrySet()) {
            String code = entry.getKey();
            CostAllocationRule rule = existing.get(code);
            if (rule != null && !source.canReplace(rule.getSource())) {
                preserved.add(code);
                continue;
            }
            if (rule == null) {
                rule = CostAllocationRule.builder().payPeriod(period).employeeCode(code).build();
            }
            rule.setEmployeeName(names.get(code));
            rule.setSource(source);
            rule.setAllocations(entry.getValue());
            rule.setUpdatedBy(SYSTEM_USER);
            allocationValidator.validate(rule);
            rules.add(rule);
        }
        List<CostAllocationRule> savedRules = costAllocationRuleRepository.saveAll(rules);

        int valid = (int) savedRules.stream().filter(CostAllocationRule::isValid).count();
        log.info("Built {} {} allocation rules for period {} ({} valid, {} replaced, {} preserved, {} with mapping errors)",
                savedRules.size(), source, periodId, valid, deleted, preserved.size(), mappingErrors.size());

        return AllocationBuildSummary.builder()
                .periodId(periodId)
                .source(source)
                .rulesCreated(savedRules.size())
                .validRules(valid)
                .invalidRules(savedRules.size() - valid)
                .preservedEmployees(preserved)
                .employeesWithoutAllocation(withoutAllocation)
                .mappingErrors(mappingErrors)
                .build();
    }

    /**
     * Stores a user supplied allocation for one employee. Overrides replace a rule of any source.
     */
    public CostAllocationRuleResponse applyOverride(String periodId, String employeeCode, AllocationOverrideRequest request) {
        validateOverride(request);
        return periodLockService.executeWithLock(periodId,
                () -> transactionTemplate.execute(status -> doOverride(periodId, employeeCode, request)));
    }

    private CostAllocationRuleResponse doOverride(String periodId, String employeeCode, AllocationOverrideRequest request) {
        PayPeriod period = findPeriod(periodId);
        List<PayrollDetailLine> lines = payrollDetailLineRepository.findByPeriodId(periodId).stream()
                .filter(line -> employeeCode.equals(line.getEmployeeCode()))
                .collect(Collectors.toList());
        BigDecimal paidTotal = allocationCalculator.allocatableTotal(lines);

        Optional<CostAllocationRule> existing = costAllocationRuleRepository.findByPeriodIdAndEmployeeCode(periodId, employeeCode);
        CostAllocationRule rule = existing.orElseGet(() -> CostAllocationRule.builder()
                .payPeriod(period)
                .employeeCode(employeeCode)
                .build());

        if (rule.getEmployeeName() == null && !lines.isEmpty()) {
            rule.setEmployeeName(lines.get(0).getEmployeeName());
        }
        if (!AllocationSource.OVERRIDE.canReplace(rule.getSource())) {
            throw new ApiException("Existing allocation cannot be replaced", HttpStatus.CONFLICT);
        }
        rule.setSource(AllocationSource.OVERRIDE);
        rule.setAllocations(allocationCalculator.fromOverride(request.getAllocations(), paidTotal));
        rule.setUpdatedBy(request.getUpdatedBy() != null && !request.getUpdatedBy().isBlank()
                ? request.getUpdatedBy() : SYSTEM_USER);
        allocationValidator.validate(rule);

        CostAllocationRule savedRule = costAllocationRuleRepository.save(rule);
        log.info("Allocation override saved for employee {} in period {} by {} (valid: {})",
                employeeCode, periodId, savedRule.getUpdatedBy(), savedRule.isValid());
        if (!savedRule.isValid()) {
            log.warn("Override for {} is invalid: {}", employeeCode, savedRule.getValidationErrors());
        }
        return mapToRuleResponse(savedRule, periodId);
    }

    @Transactional(readOnly = true)
    public List<CostAllocationRuleResponse> getRules(String periodId, AllocationSource source) {
        findPeriod(periodId);
        return costAllocationRuleRepository.findByPeriodId(periodId, source)
                .stream()
                .map(rule -> mapToRuleResponse(rule, periodId))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CostAllocationRuleResponse getRule(String periodId, String employeeCode) {
        CostAllocationRule rule = costAllocationRuleRepository.findByPeriodIdAndEmployeeCode(periodId, employeeCode)
                .orElseThrow(() -> new ResourceNotFoundException("CostAllocationRule", "employeeCode", employeeCode));
        return mapToRuleResponse(rule, periodId);
    }

    /**
     * Compares each employee's stored rule with freshly computed default and derived allocations,
     * optionally limited to employees touching one department.
     */
    @Transactional(readOnly = true)
    public AllocationVerification getVerification(String periodId, String departmentCode) {
        findPeriod(periodId);
        MappingSnapshot snapshot = mappingRegistryService.loadSnapshot();

        Map<String, CostAllocationRule> rules = costAllocationRuleRepository.findByPeriodId(periodId, null)
                .stream()
                .collect(Collectors.toMap(CostAllocationRule::getEmployeeCode, Function.identity()));
        Map<String, List<PayrollDetailLine>> linesByEmployee =
                groupBy(payrollDetailLineRepository.findByPeriodId(periodId), PayrollDetailLine::getEmployeeCode);
        Map<String, List<TimesheetShift>> shiftsByEmployee =
                groupBy(timesheetShiftRepository.findByPeriodId(periodId), TimesheetShift::getEmployeeId);

        TreeSet<String> codes = new TreeSet<>(rules.keySet());
        codes.addAll(linesByEmployee.keySet());
        codes.addAll(shiftsByEmployee.keySet());

        List<AllocationVerification.EmployeeAllocation> employees = new ArrayList<>();
        for (String code : codes) {
            CostAllocationRule rule = rules.get(code);
            List<PayrollDetailLine> lines = linesByEmployee.getOrDefault(code, Collections.emptyList());
            List<TimesheetShift> shifts = shiftsByEmployee.getOrDefault(code, Collections.emptyList());

            Map<String, BigDecimal> defaultPercentages = allocationCalculator.fromPayroll(lines)
                    .map(AllocationCalculator::percentages)
                    .orElseGet(TreeMap::new);
            AllocationCalculator.DerivedAllocation derived = allocationCalculator.fromShifts(shifts, snapshot);
            Map<String, BigDecimal> derivedPercentages = AllocationCalculator.percentages(derived.getAllocations());
            Map<String, BigDecimal> currentPercentages = rule != null
                    ? AllocationCalculator.percentages(rule.getAllocations())
                    : new TreeMap<>();

            if (departmentCode != null && !departmentCode.isBlank()
                    && !touchesDepartment(departmentCode, currentPercentages, defaultPercentages, derivedPercentages)) {
                continue;
            }

            employees.add(AllocationVerification.EmployeeAllocation.builder()
                    .employeeCode(code)
                    .employeeName(employeeName(rule, lines, shifts))
                    .currentSource(rule != null ? rule.getSource() : null)
                    .currentPercentages(currentPercentages)
                    .valid(rule != null && rule.isValid())
                    .validationErrors(rule != null ? rule.getValidationErrors() : Collections.emptyList())
                    .defaultPercentages(defaultPercentages)
                    .derivedPercentages(derivedPercentages)
                    .unmappedLocations(derived.getUnmappedLocations())
                    .build());
        }

        return AllocationVerification.builder()
                .periodId(periodId)
                .departmentCode(departmentCode)
                .employeeCount(employees.size())
                .employees(employees)
                .build();
    }

    private void validateOverride(AllocationOverrideRequest request) {
        List<FieldError> errors = new ArrayList<>();
        request.getAllocations().forEach((account, percentage) -> {
            if (account == null || account.isBlank()) {
                errors.add(new FieldError("allocationOverride", "allocations", "Cost account must not be blank"));
            } else if (percentage == null || percentage.signum() < 0) {
                errors.add(new FieldError("allocationOverride", "allocations[" + account + "]",
                        "Percentage must be zero or more"));
            }
        });
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid allocation override", errors);
        }
    }

    @SafeVarargs
    private static boolean touchesDepartment(String departmentCode, Map<String, BigDecimal>... allocations) {
        for (Map<String, BigDecimal> allocation : allocations) {
            for (String account : allocation.keySet()) {
                if (CostAccountCodes.departmentCode(account).filter(departmentCode::equals).isPresent()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String employeeName(CostAllocationRule rule, List<PayrollDetailLine> lines, List<TimesheetShift> shifts) {
        if (rule != null && rule.getEmployeeName() != null) {
            return rule.getEmployeeName();
        }
        if (!lines.isEmpty()) {
            return lines.get(0).getEmployeeName();
        }
        return shifts.isEmpty() ? null : shifts.get(0).getEmployeeName();
    }

    private static <T> Map<String, List<T>> groupBy(List<T> rows, Function<T, String> key) {
        return rows.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.toList()));
    }

    private PayPeriod findPeriod(String periodId) {
        return payPeriodRepository.findById(periodId)
                .orElseThrow(() -> new ResourceNotFoundException("PayPeriod", "periodId", periodId));
    }

    private CostAllocationRuleResponse mapToRuleResponse(CostAllocationRule rule, String periodId) {
        return CostAllocationRuleResponse.builder()
                .id(rule.getId())
                .periodId(periodId)
                .employeeCode(rule.getEmployeeCode())
                .employeeName(rule.getEmployeeName())
                .source(rule.getSource())
                .allocations(new TreeMap<>(rule.getAllocations()))
                .totalPercentage(rule.getTotalPercentage())
                .valid(rule.isValid())
                .validationErrors(new ArrayList<>(rule.getValidationErrors()))
                .updatedBy(rule.getUpdatedBy())
                .updatedAt(rule.getUpdatedAt())
                .build();
    }
}
