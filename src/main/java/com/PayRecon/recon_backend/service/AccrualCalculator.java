package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.OnCostRates;
import com.PayRecon.recon_backend.enums.WageSource;
import com.PayRecon.recon_backend.model.Employee;
import com.PayRecon.recon_backend.util.DateUtil;
import com.PayRecon.recon_backend.util.MoneyUtil;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Accrued wages and statutory on-costs for part of a pay period.
 * Every component is rounded half-up to cents on its own.
 */
@Component
@RequiredArgsConstructor
public class AccrualCalculator {

    private final OnCostRates rates;

    @Value
    @Builder
    public static class OnCosts {
        BigDecimal superannuation;
        BigDecimal annualLeave;
        BigDecimal payrollTax;
        BigDecimal workcover;

        public BigDecimal getTotal() {
            return superannuation.add(annualLeave).add(payrollTax).add(workcover);
        }
    }

    @Value
    @Builder
    public static class Accrual {
        BigDecimal baseWage;
        OnCosts onCosts;
        WageSource wageSource;
        int daysInPeriod;
        String employmentType;

        public BigDecimal getTotal() {
            return baseWage.add(onCosts.getTotal());
        }
    }

    /**
     * Fortnightly auto-pay amount scaled to the number of days accrued.
     */
    public BigDecimal proRatedAutoPay(BigDecimal autoPayAmount, LocalDate start, LocalDate end) {
        int days = DateUtil.inclusiveDays(start, end);
        return MoneyUtil.nullToZero(autoPayAmount)
                .multiply(BigDecimal.valueOf(days))
                .divide(BigDecimal.valueOf(rates.getFortnightDays()), 2, RoundingMode.HALF_UP);
    }

    public OnCosts onCosts(BigDecimal baseWage, String employmentType) {
        BigDecimal base = MoneyUtil.nullToZero(baseWage);
        boolean casual = employmentType != null && employmentType.toLowerCase().contains("casual");
        return OnCosts.builder()
                .superannuation(cents(base.multiply(rates.getSuperannuationRate())))
                .annualLeave(casual ? BigDecimal.ZERO.setScale(2) : cents(base.multiply(rates.getAnnualLeaveRate())))
                .payrollTax(cents(base.multiply(rates.getPayrollTaxRate())))
                .workcover(cents(base.multiply(rates.getWorkcoverRate())))
                .build();
    }

    /**
     * Auto-pay employees accrue their pro-rated amount, everyone else their timesheet cost.
     */
    public Accrual calculate(Employee employee, BigDecimal shiftCost, LocalDate start, LocalDate end) {
        BigDecimal baseWage;
        WageSource wageSource;
        if (employee.hasAutoPayAmount()) {
            baseWage = proRatedAutoPay(employee.getAutoPayAmount(), start, end);
            wageSource = WageSource.PRO_RATED_AUTO_PAY;
        } else {
            baseWage = MoneyUtil.round(shiftCost);
            wageSource = WageSource.TIMESHEET_COST;
        }

        String employmentType = employee.getEmploymentType() != null ? employee.getEmploymentType() : "";
        return Accrual.builder()
                .baseWage(baseWage)
                .onCosts(onCosts(baseWage, employmentType))
                .wageSource(wageSource)
                .daysInPeriod(DateUtil.inclusiveDays(start, end))
                .employmentType(employmentType)
                .build();
    }

    /**
     * Reason to leave the employee out of the accrual, if any.
     */
    public Optional<String> exclusionReason(Employee employee, LocalDate start) {
        if (employee.isTerminatedBefore(start)) {
            return Optional.of("Terminated before start period (" + DateUtil.formatDate(employee.getTerminationDate()) + ")");
        }
        return Optional.empty();
    }

    private static BigDecimal cents(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
