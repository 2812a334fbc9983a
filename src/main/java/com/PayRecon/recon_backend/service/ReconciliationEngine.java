package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.enums.ReconType;
import com.PayRecon.recon_backend.enums.Severity;
import com.PayRecon.recon_backend.enums.SourceSystem;
import com.PayRecon.recon_backend.model.CostCenterReconciliation;
import com.PayRecon.recon_backend.model.Employee;
import com.PayRecon.recon_backend.model.EmployeeReconciliation;
import com.PayRecon.recon_backend.model.JournalDescriptionMapping;
import com.PayRecon.recon_backend.model.JournalLine;
import com.PayRecon.recon_backend.model.JournalReconciliation;
import com.PayRecon.recon_backend.model.PayrollDetailLine;
import com.PayRecon.recon_backend.model.ReconciliationItem;
import com.PayRecon.recon_backend.model.TimesheetShift;
import com.PayRecon.recon_backend.service.snapshot.EmployeeDirectory;
import com.PayRecon.recon_backend.service.snapshot.MappingSnapshot;
import com.PayRecon.recon_backend.util.Constants;
import com.PayRecon.recon_backend.util.MoneyUtil;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Compares worked, paid and journal facts of one period. Pure computation: the caller loads the
 * facts and persists the outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationEngine {

    private final ReconciliationProperties properties;
    private final SplitExpander splitExpander;

    @Value
    @Builder
    public static class Input {
        String periodId;
        @Builder.Default
        List<TimesheetShift> shifts = Collections.emptyList();
        @Builder.Default
        List<PayrollDetailLine> payrollLines = Collections.emptyList();
        @Builder.Default
        List<JournalLine> journalLines = Collections.emptyList();
        MappingSnapshot mappings;
        EmployeeDirectory employees;

        public boolean has(SourceSystem source) {
            switch (source) {
                case TIMESHEET:
                    return !shifts.isEmpty();
                case PAYROLL:
                    return !payrollLines.isEmpty();
                default:
                    return !journalLines.isEmpty();
            }
        }
    }

    @Value
    @Builder
    public static class Outcome {
        List<EmployeeReconciliation> employees;
        List<ReconciliationItem> items;
        List<CostCenterReconciliation> costCenters;
        List<JournalReconciliation> journal;
        BigDecimal journalTotalCost;
        int unmappedDescriptions;

        public int getTotalChecks() {
            return items.size();
        }

        public int getCriticalCount() {
            return countBySeverity(Severity.CRITICAL);
        }

        public int getWarningCount() {
            return countBySeverity(Severity.WARNING);
        }

        public int getChecksFailed() {
            return getCriticalCount() + getWarningCount();
        }

        public int getChecksPassed() {
            return getTotalChecks() - getChecksFailed();
        }

        public boolean needsReview() {
            return getChecksFailed() > 0;
        }

        private int countBySeverity(Severity severity) {
            return (int) items.stream().filter(item -> item.getSeverity() == severity).count();
        }
    }

    public Outcome reconcile(Input input) {
        List<EmployeeReconciliation> employees = new ArrayList<>();
        List<ReconciliationItem> items = new ArrayList<>();

        // Employee level checks need both sides, absent data is never treated as zero
        if (input.has(SourceSystem.TIMESHEET) && input.has(SourceSystem.PAYROLL)) {
            employees = buildEmployeeReconciliations(input);
            for (EmployeeReconciliation employee : employees) {
                items.addAll(checkEmployee(employee));
            }
        }

        List<CostCenterReconciliation> costCenters = new ArrayList<>();
        if (input.has(SourceSystem.PAYROLL) && input.has(SourceSystem.JOURNAL)) {
            costCenters = reconcileCostCenters(input, items);
        }

        checkCompleteness(input).ifPresent(items::add);

        List<JournalReconciliation> journal = reconcileJournal(input);
        BigDecimal journalTotalCost = journal.stream()
                .filter(JournalReconciliation::isIncludeInTotalCost)
                .map(JournalReconciliation::getJournalNet)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        int unmapped = (int) journal.stream().filter(row -> !row.isMapped()).count();

        Outcome outcome = Outcome.builder()
                .employees(employees)
                .items(items)
                .costCenters(costCenters)
                .journal(journal)
                .journalTotalCost(MoneyUtil.round(journalTotalCost))
                .unmappedDescriptions(unmapped)
                .build();

        log.info("Reconciled period {}: {} employees, {} checks, {} critical, {} warnings",
                input.getPeriodId(), employees.size(), outcome.getTotalChecks(),
                outcome.getCriticalCount(), outcome.getWarningCount());
        return outcome;
    }

    List<EmployeeReconciliation> buildEmployeeReconciliations(Input input) {
        Map<String, List<TimesheetShift>> shiftsByEmployee = input.getShifts().stream()
                .collect(Collectors.groupingBy(TimesheetShift::getEmployeeId, TreeMap::new, Collectors.toList()));
        Map<String, List<PayrollDetailLine>> linesByEmployee = input.getPayrollLines().stream()
                .collect(Collectors.groupingBy(PayrollDetailLine::getEmployeeCode, TreeMap::new, Collectors.toList()));

        TreeSet<String> employeeCodes = new TreeSet<>(shiftsByEmployee.keySet());
        employeeCodes.addAll(linesByEmployee.keySet());

        List<EmployeeReconciliation> rows = new ArrayList<>();
        for (String code : employeeCodes) {
            EmployeeReconciliation row = EmployeeReconciliation.builder().employeeId(code).build();
            applyWorked(row, shiftsByEmployee.getOrDefault(code, Collections.emptyList()));
            applyPaid(row, linesByEmployee.getOrDefault(code, Collections.emptyList()),
                    input.getMappings(), input.getEmployees());
            applyVariances(row);
            rows.add(row);
        }
        return rows;
    }

    private void applyWorked(EmployeeReconciliation row, List<TimesheetShift> shifts) {
        if (shifts.isEmpty()) {
            return;
        }
        TimesheetShift first = shifts.get(0);
        row.setEmployeeName(first.getEmployeeName());
        row.setEmploymentType(first.getEmploymentType());

        BigDecimal normalHours = BigDecimal.ZERO;
        BigDecimal leaveHours = BigDecimal.ZERO;
        Map<String, BigDecimal> leaveBreakdown = new TreeMap<>();
        TreeSet<String> locations = new TreeSet<>();
        for (TimesheetShift shift : shifts) {
            BigDecimal hours = MoneyUtil.nullToZero(shift.getHours());
            if (shift.isLeave()) {
                leaveHours = leaveHours.add(hours);
                if (shift.getLeaveType() != null) {
                    leaveBreakdown.merge(shift.getLeaveType(), hours, BigDecimal::add);
                }
            } else {
                normalHours = normalHours.add(hours);
            }
            if (shift.getLocationName() != null && !shift.getLocationName().isBlank()) {
                locations.add(shift.getLocationName());
            }
        }
        leaveBreakdown.replaceAll((type, hours) -> MoneyUtil.round(hours));

        row.setWorkedHours(MoneyUtil.round(sum(shifts, TimesheetShift::getHours)));
        row.setWorkedCost(MoneyUtil.round(sum(shifts, TimesheetShift::getCost)));
        row.setShiftCount(shifts.size());
        row.setWorkedNormalHours(MoneyUtil.round(normalHours));
        row.setWorkedLeaveHours(MoneyUtil.round(leaveHours));
        row.setLeaveBreakdown(leaveBreakdown);
        row.setLocations(new ArrayList<>(locations));
    }

    private void applyPaid(EmployeeReconciliation row, List<PayrollDetailLine> lines,
                           MappingSnapshot mappings, EmployeeDirectory directory) {
        if (lines.isEmpty()) {
            return;
        }
        PayrollDetailLine first = lines.get(0);
        if (row.getEmployeeName() == null) {
            row.setEmployeeName(first.getEmployeeName());
        }
        if (row.getEmploymentType() == null) {
            row.setEmploymentType(first.getEmploymentType());
        }

        Optional<Employee> master = directory.find(row.getEmployeeId());
        if (master.isPresent()) {
            Employee employee = master.get();
            row.setSalaried(employee.isSalaried());
            row.setAutoPayAmount(employee.getAutoPayAmount());
            if (employee.getEmploymentType() != null && !employee.getEmploymentType().isBlank()) {
                row.setEmploymentType(employee.getEmploymentType());
            }
        }

        Predicate<PayrollDetailLine> normal = line -> Constants.TX_HOURS_BY_RATE.equals(line.getTransactionType())
                && Constants.PAY_COMP_NORMAL.equalsIgnoreCase(line.getPayCompCode());
        Predicate<PayrollDetailLine> overtime = line -> Constants.TX_HOURS_BY_RATE.equals(line.getTransactionType())
                && !Constants.PAY_COMP_NORMAL.equalsIgnoreCase(line.getPayCompCode());
        Predicate<PayrollDetailLine> annualLeave = ofType(Constants.TX_ANNUAL_LEAVE);
        Predicate<PayrollDetailLine> sickLeave = ofType(Constants.TX_SICK_LEAVE);
        Predicate<PayrollDetailLine> otherLeave = line -> Constants.TX_OTHER_LEAVE.contains(line.getTransactionType());

        row.setPaidHours(MoneyUtil.round(sumWhere(lines, line -> mappings.includesHours(line.getTransactionType()),
                PayrollDetailLine::getHours)));
        row.setPaidGross(MoneyUtil.round(sumWhere(lines,
                line -> mappings.includesCost(line.getTransactionType())
                        && !Constants.TX_SUPER.equals(line.getTransactionType()),
                PayrollDetailLine::getAmount)));
        row.setPaidSuperannuation(MoneyUtil.round(sumWhere(lines, ofType(Constants.TX_SUPER), PayrollDetailLine::getAmount)));
        row.setPaidNormalHours(MoneyUtil.round(sumWhere(lines, normal, PayrollDetailLine::getHours)));
        row.setPaidNormalPay(MoneyUtil.round(sumWhere(lines, normal, PayrollDetailLine::getAmount)));
        row.setPaidOvertimeHours(MoneyUtil.round(sumWhere(lines, overtime, PayrollDetailLine::getHours)));
        row.setPaidOvertimePay(MoneyUtil.round(sumWhere(lines, overtime, PayrollDetailLine::getAmount)));
        row.setPaidAnnualLeaveHours(MoneyUtil.round(sumWhere(lines, annualLeave, PayrollDetailLine::getHours)));
        row.setPaidAnnualLeavePay(MoneyUtil.round(sumWhere(lines, annualLeave, PayrollDetailLine::getAmount)));
        row.setPaidSickLeaveHours(MoneyUtil.round(sumWhere(lines, sickLeave, PayrollDetailLine::getHours)));
        row.setPaidSickLeavePay(MoneyUtil.round(sumWhere(lines, sickLeave, PayrollDetailLine::getAmount)));
        row.setPaidOtherLeaveHours(MoneyUtil.round(sumWhere(lines, otherLeave, PayrollDetailLine::getHours)));
        row.setPaidOtherLeavePay(MoneyUtil.round(sumWhere(lines, otherLeave, PayrollDetailLine::getAmount)));
        row.setCostCenters(lines.stream()
                .map(PayrollDetailLine::getCostAccountCode)
                .filter(code -> code != null && !code.isBlank())
                .distinct()
                .sorted()
                .collect(Collectors.toList()));
    }

    private void applyVariances(EmployeeReconciliation row) {
        ReconciliationProperties.Tolerance tolerance = properties.getTolerance();

        row.setHoursVariance(MoneyUtil.round(MoneyUtil.absoluteDifference(row.getWorkedHours(), row.getPaidHours())));
        row.setHoursVariancePct(MoneyUtil.percentOf(row.getHoursVariance(), row.getWorkedHours()));
        row.setHoursMatch(row.getHoursVariance().compareTo(tolerance.getHours()) <= 0);

        BigDecimal expected = row.isSalaried() ? MoneyUtil.nullToZero(row.getAutoPayAmount()) : row.getWorkedCost();
        row.setExpectedCost(MoneyUtil.round(expected));
        row.setCostVariance(MoneyUtil.round(MoneyUtil.absoluteDifference(row.getExpectedCost(), row.getPaidGross())));
        row.setCostVariancePct(MoneyUtil.percentOf(row.getCostVariance(), row.getExpectedCost()));
        row.setCostMatch(row.getCostVariance().compareTo(tolerance.getCostAbsolute()) <= 0
                || row.getCostVariancePct().compareTo(tolerance.getCostPercent()) <= 0);

        List<String> issues = new ArrayList<>();
        if (!row.isHoursMatch()) {
            issues.add("Hours variance: " + MoneyUtil.formatHours(row.getHoursVariance()) + " hrs");
        }
        if (!row.isCostMatch()) {
            issues.add("Cost variance: " + MoneyUtil.formatCurrency(row.getCostVariance()));
        }
        row.setHasIssues(!issues.isEmpty());
        row.setIssueDescription(issues.isEmpty() ? null : String.join("; ", issues));
    }

    List<ReconciliationItem> checkEmployee(EmployeeReconciliation row) {
        ReconciliationProperties.Tolerance tolerance = properties.getTolerance();
        List<ReconciliationItem> items = new ArrayList<>();
        String name = row.getEmployeeName() != null ? row.getEmployeeName() : row.getEmployeeId();

        boolean workedHours = row.getWorkedHours().signum() > 0;
        boolean paidHours = row.getPaidHours().signum() > 0;
        boolean hoursOneSided = workedHours != paidHours;

        if (!workedHours && paidHours) {
            items.add(employeeItem(row, ReconType.HOURS, Severity.CRITICAL,
                    row.getWorkedHours(), row.getPaidHours(), row.getHoursVariance(), row.getHoursVariancePct(),
                    String.format("Employee %s has %s hours in %s but NO timesheet in %s. Missing timesheet?",
                            name, MoneyUtil.formatHours(row.getPaidHours()),
                            Constants.PAID_SOURCE_NAME, Constants.WORKED_SOURCE_NAME)));
        } else if (workedHours && !paidHours) {
            items.add(employeeItem(row, ReconType.HOURS, Severity.CRITICAL,
                    row.getWorkedHours(), row.getPaidHours(), row.getHoursVariance(), row.getHoursVariancePct(),
                    String.format("Employee %s worked %s hours in %s but has NO records in %s. Not paid?",
                            name, MoneyUtil.formatHours(row.getWorkedHours()),
                            Constants.WORKED_SOURCE_NAME, Constants.PAID_SOURCE_NAME)));
        } else if (!row.isHoursMatch()) {
            Severity severity = row.getHoursVariance().compareTo(tolerance.getHoursCritical()) > 0
                    ? Severity.CRITICAL : Severity.WARNING;
            items.add(employeeItem(row, ReconType.HOURS, severity,
                    row.getWorkedHours(), row.getPaidHours(), row.getHoursVariance(), row.getHoursVariancePct(),
                    String.format("Hours mismatch for %s: %s worked in %s vs %s paid in %s (variance %s hrs)",
                            name, MoneyUtil.formatHours(row.getWorkedHours()), Constants.WORKED_SOURCE_NAME,
                            MoneyUtil.formatHours(row.getPaidHours()), Constants.PAID_SOURCE_NAME,
                            MoneyUtil.formatHours(row.getHoursVariance()))));
        }

        boolean expectedCost = row.getExpectedCost().signum() > 0;
        boolean paidCost = row.getPaidGross().signum() > 0;

        if (!hoursOneSided && expectedCost != paidCost) {
            items.add(employeeItem(row, ReconType.COST, Severity.CRITICAL,
                    row.getExpectedCost(), row.getPaidGross(), row.getCostVariance(), row.getCostVariancePct(),
                    expectedCost
                            ? String.format("Employee %s has expected cost %s but NO pay in %s. Not paid?",
                            name, MoneyUtil.formatCurrency(row.getExpectedCost()), Constants.PAID_SOURCE_NAME)
                            : String.format("Employee %s was paid %s in %s but has NO cost in %s. Missing cost?",
                            name, MoneyUtil.formatCurrency(row.getPaidGross()), Constants.PAID_SOURCE_NAME,
                            Constants.WORKED_SOURCE_NAME)));
        } else if (!hoursOneSided && !row.isCostMatch() && expectedCost && paidCost) {
            // One-sided employees already carry a critical hours item; auto-pay gives them an expected cost
            Severity severity = row.getCostVariancePct().compareTo(tolerance.getCostCriticalPercent()) > 0
                    ? Severity.CRITICAL : Severity.WARNING;
            items.add(employeeItem(row, ReconType.COST, severity,
                    row.getExpectedCost(), row.getPaidGross(), row.getCostVariance(), row.getCostVariancePct(),
                    String.format("Cost mismatch for %s: expected %s%s vs paid %s in %s (variance %s, %s%%)",
                            name, MoneyUtil.formatCurrency(row.getExpectedCost()),
                            row.isSalaried() ? " (auto pay)" : "",
                            MoneyUtil.formatCurrency(row.getPaidGross()), Constants.PAID_SOURCE_NAME,
                            MoneyUtil.formatCurrency(row.getCostVariance()),
                            row.getCostVariancePct().toPlainString())));
        }
        return items;
    }

    List<CostCenterReconciliation> reconcileCostCenters(Input input, List<ReconciliationItem> items) {
        ReconciliationProperties.Tolerance tolerance = properties.getTolerance();
        MappingSnapshot mappings = input.getMappings();

        Map<String, BigDecimal> paidByAccount = new TreeMap<>();
        for (PayrollDetailLine line : input.getPayrollLines()) {
            if (mappings.includesCost(line.getTransactionType())
                    && line.getCostAccountCode() != null && !line.getCostAccountCode().isBlank()) {
                paidByAccount.merge(line.getCostAccountCode(), MoneyUtil.nullToZero(line.getAmount()), BigDecimal::add);
            }
        }
        Map<String, BigDecimal> expandedPaid = splitExpander.expand(paidByAccount, mappings);

        Map<String, BigDecimal> journalByAccount = new TreeMap<>();
        for (JournalLine line : input.getJournalLines()) {
            if (properties.getLabourLedgerAccount().equals(line.getLedgerAccount()) && line.getCostAccount() != null) {
                journalByAccount.merge(line.getCostAccount(), MoneyUtil.nullToZero(line.getDebit()), BigDecimal::add);
            }
        }

        List<CostCenterReconciliation> rows = new ArrayList<>();
        for (Map.Entry<String, BigDecimal> entry : expandedPaid.entrySet()) {
            String costCenter = entry.getKey();
            BigDecimal paid = MoneyUtil.round(entry.getValue());
            BigDecimal journal = MoneyUtil.round(journalByAccount.get(costCenter));
            BigDecimal variance = MoneyUtil.round(MoneyUtil.absoluteDifference(paid, journal));
            BigDecimal variancePct = MoneyUtil.percentOf(variance, paid);

            boolean flagged = false;
            if (paid.signum() > 0 && journal.signum() == 0) {
                flagged = true;
                items.add(costCenterItem(costCenter, Severity.CRITICAL, paid, journal, variance, variancePct,
                        String.format("Cost center %s has %s paid in %s but NO journal posting. Missing GL posting?",
                                costCenter, MoneyUtil.formatCurrency(paid), Constants.PAID_SOURCE_NAME)));
            } else if (variance.compareTo(tolerance.getCostCenterAbsolute()) > 0
                    && variancePct.compareTo(tolerance.getCostCenterPercent()) > 0) {
                flagged = true;
                Severity severity = variancePct.compareTo(tolerance.getCostCenterCriticalPercent()) > 0
                        ? Severity.CRITICAL : Severity.WARNING;
                items.add(costCenterItem(costCenter, severity, paid, journal, variance, variancePct,
                        String.format("Cost center %s: %s paid in %s vs %s posted to the journal (variance %s, %s%%)",
                                costCenter, MoneyUtil.formatCurrency(paid), Constants.PAID_SOURCE_NAME,
                                MoneyUtil.formatCurrency(journal), MoneyUtil.formatCurrency(variance),
                                variancePct.toPlainString())));
            }

            rows.add(CostCenterReconciliation.builder()
                    .costCenter(costCenter)
                    .paidAmount(paid)
                    .journalAmount(journal)
                    .variance(variance)
                    .variancePct(variancePct)
                    .flagged(flagged)
                    .build());
        }
        return rows;
    }

    Optional<ReconciliationItem> checkCompleteness(Input input) {
        List<String> missing = new ArrayList<>();
        for (SourceSystem source : SourceSystem.values()) {
            if (!input.has(source)) {
                missing.add(source.getDisplayName());
            }
        }
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        log.warn("Period {} is missing {}", input.getPeriodId(), missing);
        return Optional.of(ReconciliationItem.builder()
                .reconType(ReconType.COMPLETENESS)
                .severity(Severity.CRITICAL)
                .description("Incomplete data: Missing " + String.join(", ", missing))
                .build());
    }

    List<JournalReconciliation> reconcileJournal(Input input) {
        Map<String, BigDecimal[]> totals = new TreeMap<>();
        for (JournalLine line : input.getJournalLines()) {
            String description = line.getDescription() != null ? line.getDescription().trim() : "";
            BigDecimal[] sums = totals.computeIfAbsent(description, k -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            sums[0] = sums[0].add(MoneyUtil.nullToZero(line.getDebit()));
            sums[1] = sums[1].add(MoneyUtil.nullToZero(line.getCredit()));
        }

        List<JournalReconciliation> rows = new ArrayList<>();
        for (Map.Entry<String, BigDecimal[]> entry : totals.entrySet()) {
            BigDecimal debit = MoneyUtil.round(entry.getValue()[0]);
            BigDecimal credit = MoneyUtil.round(entry.getValue()[1]);
            Optional<JournalDescriptionMapping> mapping = input.getMappings().findJournalMapping(entry.getKey());
            if (mapping.isEmpty()) {
                log.warn("Journal description '{}' has no mapping", entry.getKey());
            }
            rows.add(JournalReconciliation.builder()
                    .description(entry.getKey())
                    .glAccount(mapping.map(JournalDescriptionMapping::getGlAccount).orElse(""))
                    .includeInTotalCost(mapping.map(JournalDescriptionMapping::isIncludeInTotalCost).orElse(false))
                    .mapped(mapping.isPresent())
                    .journalDebit(debit)
                    .journalCredit(credit)
                    .journalNet(debit.subtract(credit))
                    .build());
        }
        return rows;
    }

    private ReconciliationItem employeeItem(EmployeeReconciliation row, ReconType type, Severity severity,
                                            BigDecimal expected, BigDecimal actual, BigDecimal variance,
                                            BigDecimal variancePct, String description) {
        return ReconciliationItem.builder()
                .reconType(type)
                .severity(severity)
                .employeeId(row.getEmployeeId())
                .employeeName(row.getEmployeeName())
                .expectedValue(expected)
                .actualValue(actual)
                .variance(variance)
                .variancePct(variancePct)
                .description(description)
                .build();
    }

    private ReconciliationItem costCenterItem(String costCenter, Severity severity, BigDecimal paid,
                                              BigDecimal journal, BigDecimal variance, BigDecimal variancePct,
                                              String description) {
        return ReconciliationItem.builder()
                .reconType(ReconType.COST)
                .severity(severity)
                .costCenter(costCenter)
                .expectedValue(paid)
                .actualValue(journal)
                .variance(variance)
                .variancePct(variancePct)
                .description(description)
                .build();
    }

    private static Predicate<PayrollDetailLine> ofType(String transactionType) {
        return line -> transactionType.equals(line.getTransactionType());
    }

    private static <T> BigDecimal sum(List<T> rows, Function<T, BigDecimal> value) {
        return rows.stream().map(value).map(MoneyUtil::nullToZero).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal sumWhere(List<PayrollDetailLine> lines, Predicate<PayrollDetailLine> filter,
                                       Function<PayrollDetailLine, BigDecimal> value) {
        return sum(lines.stream().filter(filter).collect(Collectors.toList()), value);
    }
}
