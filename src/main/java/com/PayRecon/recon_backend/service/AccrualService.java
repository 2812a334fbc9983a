package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.dto.request.AccrualRequest;
import com.PayRecon.recon_backend.dto.response.AccrualResultResponse;
import com.PayRecon.recon_backend.dto.response.AccrualSummary;
import com.PayRecon.recon_backend.enums.AccrualAllocationSource;
import com.PayRecon.recon_backend.exception.ApiException;
import com.PayRecon.recon_backend.exception.ResourceNotFoundException;
import com.PayRecon.recon_backend.model.AccrualResult;
import com.PayRecon.recon_backend.model.Employee;
import com.PayRecon.recon_backend.model.PayPeriod;
import com.PayRecon.recon_backend.model.TimesheetShift;
import com.PayRecon.recon_backend.repository.AccrualResultRepository;
import com.PayRecon.recon_backend.repository.PayPeriodRepository;
import com.PayRecon.recon_backend.repository.TimesheetShiftRepository;
import com.PayRecon.recon_backend.service.snapshot.EmployeeDirectory;
import com.PayRecon.recon_backend.service.snapshot.MappingSnapshot;
import com.PayRecon.recon_backend.util.DateUtil;
import com.PayRecon.recon_backend.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Accrued wages and on-costs for the part of a pay period that falls before month end.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccrualService {

    private final AccrualResultRepository accrualResultRepository;
    private final PayPeriodRepository payPeriodRepository;
    private final TimesheetShiftRepository timesheetShiftRepository;
    private final EmployeeService employeeService;
    private final MappingRegistryService mappingRegistryService;
    private final AccrualCalculator accrualCalculator;
    private final AllocationCalculator allocationCalculator;
    private final SplitExpander splitExpander;
    private final PeriodLockService periodLockService;
    private final TransactionTemplate transactionTemplate;

    public AccrualSummary processAccruals(String periodId, AccrualRequest request) {
        if (request.getStartDate().isAfter(request.getEndDate())) {
            throw new ApiException("Accrual start date must not be after end date", HttpStatus.BAD_REQUEST);
        }
        return periodLockService.executeWithLock(periodId,
                () -> transactionTemplate.execute(status -> doProcess(periodId, request.getStartDate(), request.getEndDate())));
    }

    private AccrualSummary doProcess(String periodId, LocalDate start, LocalDate end) {
        PayPeriod period = findPeriod(periodId);
        EmployeeDirectory directory = employeeService.loadDirectory();
        MappingSnapshot snapshot = mappingRegistryService.loadSnapshot();

        Map<String, AccrualResult> existing = accrualResultRepository.findByPeriodId(periodId)
                .stream()
                .collect(Collectors.toMap(AccrualResult::getEmployeeCode, Function.identity()));
        Map<String, List<TimesheetShift>> shiftsByEmployee = timesheetShiftRepository.findByPeriodId(periodId)
                .stream()
                .collect(Collectors.groupingBy(TimesheetShift::getEmployeeId, TreeMap::new, Collectors.toList()));

        List<AccrualResult> results = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        List<String> terminated = new ArrayList<>();
        List<String> autoPayOnly = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        // Pass 1: everyone with worked facts
        for (Map.Entry<String, List<TimesheetShift>> entry : shiftsByEmployee.entrySet()) {
            String code = entry.getKey();
            seen.add(code);
            Employee employee = directory.find(code).orElse(null);
            if (employee == null) {
                log.warn("Accrual skipped for {}: not in the employee master", code);
                notFound.add(code);
                continue;
            }
            try {
                if (isExcluded(employee, start, terminated)) {
                    continue;
                }
                BigDecimal shiftCost = entry.getValue().stream()
                        .map(TimesheetShift::getCost)
                        .map(MoneyUtil::nullToZero)
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
                AccrualCalculator.Accrual accrual = accrualCalculator.calculate(employee, shiftCost, start, end);

                Map<String, BigDecimal> allocation = AllocationCalculator.percentages(
                        allocationCalculator.fromShifts(entry.getValue(), snapshot).getAllocations());
                AccrualAllocationSource allocationSource = AccrualAllocationSource.TIMESHEET;
                if (allocation.isEmpty()) {
                    allocation = defaultAllocation(employee, snapshot);
                    allocationSource = allocation.isEmpty()
                            ? AccrualAllocationSource.NONE : AccrualAllocationSource.DEFAULT_COST_CENTER;
                }

                results.add(toResult(existing.get(code), period, employee, accrual, start, end, allocation, allocationSource));
            } catch (RuntimeException e) {
                log.error("Accrual failed for employee {} in period {}", code, periodId, e);
                errors.add(code + ": " + e.getMessage());
            }
        }

        // Pass 2: auto-pay employees without worked facts
        for (Employee employee : directory.autoPayEmployees()) {
            String code = employee.getCode();
            if (seen.contains(code)) {
                continue;
            }
            try {
                if (isExcluded(employee, start, terminated)) {
                    continue;
                }
                AccrualCalculator.Accrual accrual = accrualCalculator.calculate(employee, BigDecimal.ZERO, start, end);
                Map<String, BigDecimal> allocation = defaultAllocation(employee, snapshot);
                AccrualAllocationSource allocationSource = allocation.isEmpty()
                        ? AccrualAllocationSource.NONE : AccrualAllocationSource.DEFAULT_COST_CENTER;

                results.add(toResult(existing.get(code), period, employee, accrual, start, end, allocation, allocationSource));
                autoPayOnly.add(code);
            } catch (RuntimeException e) {
                log.error("Accrual failed for auto-pay employee {} in period {}", code, periodId, e);
                errors.add(code + ": " + e.getMessage());
            }
        }

        List<AccrualResult> savedResults = accrualResultRepository.saveAll(results);
        BigDecimal totalAccrued = savedResults.stream()
                .map(AccrualResult::getTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        log.info("Accruals for period {} ({} to {}): {} processed, {} not found, {} terminated, {} errors, total {}",
                periodId, start, end, savedResults.size(), notFound.size(), terminated.size(), errors.size(),
                MoneyUtil.formatCurrency(totalAccrued));

        return AccrualSummary.builder()
                .periodId(periodId)
                .startDate(start)
                .endDate(end)
                .daysInPeriod(DateUtil.inclusiveDays(start, end))
                .processed(savedResults.size())
                .skipped(notFound.size() + terminated.size() + errors.size())
                .employeesNotFound(notFound)
                .terminatedEmployees(terminated)
                .autoPayOnlyEmployees(autoPayOnly)
                .errors(errors)
                .totalAccrued(MoneyUtil.round(totalAccrued))
                .build();
    }

    @Transactional(readOnly = true)
    public List<AccrualResultResponse> getAccruals(String periodId) {
        findPeriod(periodId);
        return accrualResultRepository.findByPeriodId(periodId)
                .stream()
                .map(result -> mapToAccrualResponse(result, periodId))
                .collect(Collectors.toList());
    }

    private boolean isExcluded(Employee employee, LocalDate start, List<String> terminated) {
        return accrualCalculator.exclusionReason(employee, start)
                .map(reason -> {
                    log.info("Accrual skipped for {}: {}", employee.getCode(), reason);
                    terminated.add(employee.getCode());
                    return true;
                })
                .orElse(false);
    }

    /**
     * The employee's default cost account at 100%, expanded when it is a virtual split account.
     */
    private Map<String, BigDecimal> defaultAllocation(Employee employee, MappingSnapshot snapshot) {
        String account = employee.getDefaultCostAccount();
        if (account == null || account.isBlank()) {
            return new TreeMap<>();
        }
        Map<String, BigDecimal> allocation = new TreeMap<>();
        allocation.put(account.trim(), MoneyUtil.ONE_HUNDRED);
        return splitExpander.expand(allocation, snapshot).entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> MoneyUtil.round(e.getValue()),
                        (a, b) -> a, TreeMap::new));
    }

    private AccrualResult toResult(AccrualResult existing, PayPeriod period, Employee employee,
                                   AccrualCalculator.Accrual accrual, LocalDate start, LocalDate end,
                                   Map<String, BigDecimal> allocation, AccrualAllocationSource allocationSource) {
        AccrualResult result = existing != null ? existing : AccrualResult.builder()
                .payPeriod(period)
                .employeeCode(employee.getCode())
                .build();

        AccrualCalculator.OnCosts onCosts = accrual.getOnCosts();
        result.setEmployeeName(employee.getFullName());
        result.setEmploymentType(accrual.getEmploymentType());
        result.setAccrualStart(start);
        result.setAccrualEnd(end);
        result.setDaysInPeriod(accrual.getDaysInPeriod());
        result.setBaseWage(accrual.getBaseWage());
        result.setSuperannuation(onCosts.getSuperannuation());
        result.setAnnualLeave(onCosts.getAnnualLeave());
        result.setPayrollTax(onCosts.getPayrollTax());
        result.setWorkcover(onCosts.getWorkcover());
        result.setTotalOnCosts(onCosts.getTotal());
        result.setTotal(accrual.getTotal());
        result.setWageSource(accrual.getWageSource());
        result.setAllocationSource(allocationSource);
        result.setCostAllocation(allocation);
        return result;
    }

    private PayPeriod findPeriod(String periodId) {
        return payPeriodRepository.findById(periodId)
                .orElseThrow(() -> new ResourceNotFoundException("PayPeriod", "periodId", periodId));
    }

    private AccrualResultResponse mapToAccrualResponse(AccrualResult result, String periodId) {
        return AccrualResultResponse.builder()
                .id(result.getId())
                .periodId(periodId)
                .employeeCode(result.getEmployeeCode())
                .employeeName(result.getEmployeeName())
                .employmentType(result.getEmploymentType())
                .accrualStart(result.getAccrualStart())
                .accrualEnd(result.getAccrualEnd())
                .daysInPeriod(result.getDaysInPeriod())
                .baseWage(result.getBaseWage())
                .superannuation(result.getSuperannuation())
                .annualLeave(result.getAnnualLeave())
                .payrollTax(result.getPayrollTax())
                .workcover(result.getWorkcover())
                .totalOnCosts(result.getTotalOnCosts())
                .total(result.getTotal())
                .wageSource(result.getWageSource())
                .allocationSource(result.getAllocationSource())
                .costAllocation(new TreeMap<>(result.getCostAllocation()))
                .calculatedAt(result.getCalculatedAt())
                .build();
    }
}
