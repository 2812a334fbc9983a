package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.enums.AllocationSource;
import com.PayRecon.recon_backend.model.AllocationEntry;
import com.PayRecon.recon_backend.model.LocationMapping;
import com.PayRecon.recon_backend.model.PayrollDetailLine;
import com.PayRecon.recon_backend.model.TimesheetShift;
import com.PayRecon.recon_backend.service.snapshot.MappingSnapshot;
import com.PayRecon.recon_backend.util.MoneyUtil;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes per-employee cost center allocations from payroll lines, timesheet shifts or user input.
 */
@Component
@RequiredArgsConstructor
public class AllocationCalculator {

    private final ReconciliationProperties properties;

    @Value
    @Builder
    public static class DerivedAllocation {
        Map<String, AllocationEntry> allocations;
        List<String> unmappedLocations;
        BigDecimal totalCost;

        public boolean isEmpty() {
            return allocations.isEmpty();
        }
    }

    public boolean isAllocatable(PayrollDetailLine line) {
        return !properties.getAllocation().getExcludedTransactionTypes().contains(line.getTransactionType());
    }

    /**
     * Paid total used as the base of default and override allocations.
     */
    public BigDecimal allocatableTotal(Collection<PayrollDetailLine> lines) {
        return lines.stream()
                .filter(this::isAllocatable)
                .map(line -> MoneyUtil.nullToZero(line.getAmount()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Allocation by cost account of the employee's payroll lines. Empty when the paid total is zero.
     */
    public Optional<Map<String, AllocationEntry>> fromPayroll(Collection<PayrollDetailLine> lines) {
        Map<String, BigDecimal> amounts = new TreeMap<>();
        Map<String, BigDecimal> hours = new TreeMap<>();
        for (PayrollDetailLine line : lines) {
            if (!isAllocatable(line) || line.getCostAccountCode() == null || line.getCostAccountCode().isBlank()) {
                continue;
            }
            amounts.merge(line.getCostAccountCode(), MoneyUtil.nullToZero(line.getAmount()), BigDecimal::add);
            hours.merge(line.getCostAccountCode(), MoneyUtil.nullToZero(line.getHours()), BigDecimal::add);
        }

        BigDecimal total = amounts.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.signum() == 0) {
            return Optional.empty();
        }

        Map<String, AllocationEntry> allocations = new TreeMap<>();
        for (Map.Entry<String, BigDecimal> entry : amounts.entrySet()) {
            allocations.put(entry.getKey(), AllocationEntry.builder()
                    .percentage(MoneyUtil.percentOf(entry.getValue(), total))
                    .amount(MoneyUtil.round(entry.getValue()))
                    .hours(MoneyUtil.round(hours.get(entry.getKey())))
                    .source(AllocationSource.DEFAULT)
                    .build());
        }
        return Optional.of(allocations);
    }

    /**
     * Allocation by mapped timesheet location. Unmapped location keys are reported and left out of
     * the percentage base; keys resolving to the same account are summed.
     */
    public DerivedAllocation fromShifts(Collection<TimesheetShift> shifts, MappingSnapshot snapshot) {
        Map<String, BigDecimal> costByLocation = new TreeMap<>();
        Map<String, BigDecimal> hoursByLocation = new TreeMap<>();
        for (TimesheetShift shift : shifts) {
            costByLocation.merge(shift.getLocationKey(), MoneyUtil.nullToZero(shift.getCost()), BigDecimal::add);
            hoursByLocation.merge(shift.getLocationKey(), MoneyUtil.nullToZero(shift.getHours()), BigDecimal::add);
        }

        Map<String, BigDecimal> costByAccount = new TreeMap<>();
        Map<String, BigDecimal> hoursByAccount = new TreeMap<>();
        TreeSet<String> unmapped = new TreeSet<>();
        for (Map.Entry<String, BigDecimal> entry : costByLocation.entrySet()) {
            Optional<LocationMapping> mapping = snapshot.findLocation(entry.getKey());
            if (mapping.isEmpty()) {
                unmapped.add(entry.getKey());
                continue;
            }
            String account = mapping.get().getCostAccountCode();
            costByAccount.merge(account, entry.getValue(), BigDecimal::add);
            hoursByAccount.merge(account, hoursByLocation.get(entry.getKey()), BigDecimal::add);
        }

        BigDecimal total = costByAccount.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        Map<String, AllocationEntry> allocations = new TreeMap<>();
        if (total.signum() != 0) {
            for (Map.Entry<String, BigDecimal> entry : costByAccount.entrySet()) {
                allocations.put(entry.getKey(), AllocationEntry.builder()
                        .percentage(MoneyUtil.percentOf(entry.getValue(), total))
                        .amount(MoneyUtil.round(entry.getValue()))
                        .hours(MoneyUtil.round(hoursByAccount.get(entry.getKey())))
                        .source(AllocationSource.DERIVED)
                        .build());
            }
        }

        return DerivedAllocation.builder()
                .allocations(allocations)
                .unmappedLocations(new ArrayList<>(unmapped))
                .totalCost(MoneyUtil.round(total))
                .build();
    }

    /**
     * User supplied percentages, with amounts taken from the employee's paid total.
     */
    public Map<String, AllocationEntry> fromOverride(Map<String, BigDecimal> percentages, BigDecimal paidTotal) {
        Map<String, AllocationEntry> allocations = new TreeMap<>();
        BigDecimal base = MoneyUtil.nullToZero(paidTotal);
        for (Map.Entry<String, BigDecimal> entry : percentages.entrySet()) {
            BigDecimal percentage = MoneyUtil.nullToZero(entry.getValue());
            allocations.put(entry.getKey().trim(), AllocationEntry.builder()
                    .percentage(percentage.setScale(2, RoundingMode.HALF_UP))
                    .amount(percentage.multiply(base).divide(MoneyUtil.ONE_HUNDRED, 2, RoundingMode.HALF_UP))
                    .source(AllocationSource.OVERRIDE)
                    .build());
        }
        return allocations;
    }

    /**
     * Percentages only, keyed by cost account.
     */
    public static Map<String, BigDecimal> percentages(Map<String, AllocationEntry> allocations) {
        Map<String, BigDecimal> percentages = new TreeMap<>();
        allocations.forEach((account, entry) -> percentages.put(account, entry.getPercentage()));
        return percentages;
    }
}
