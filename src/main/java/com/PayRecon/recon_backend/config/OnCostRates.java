package com.PayRecon.recon_backend.config;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Statutory on-cost rates applied to accrued wages.
 */
@Value
@Builder
public class OnCostRates {
    BigDecimal superannuationRate;
    BigDecimal annualLeaveRate;
    BigDecimal payrollTaxRate;
    BigDecimal workcoverRate;
    int fortnightDays;

    public static OnCostRates defaults() {
        return from(new ReconciliationProperties.Accrual());
    }

    public static OnCostRates from(ReconciliationProperties.Accrual accrual) {
        return OnCostRates.builder()
                .superannuationRate(accrual.getSuperannuationRate())
                .annualLeaveRate(accrual.getAnnualLeaveRate())
                .payrollTaxRate(accrual.getPayrollTaxRate())
                .workcoverRate(accrual.getWorkcoverRate())
                .fortnightDays(accrual.getFortnightDays())
                .build();
    }
}
