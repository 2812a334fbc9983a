package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.model.AllocationEntry;
import com.PayRecon.recon_backend.model.CostAllocationRule;
import com.PayRecon.recon_backend.util.MoneyUtil;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates allocation rules on every write. Failures are recorded on the rule, never thrown.
 */
@Component
public class AllocationValidator {

    private final ReconciliationProperties properties;
    private final Pattern costAccountPattern;

    public AllocationValidator(ReconciliationProperties properties) {
        this.properties = properties;
        this.costAccountPattern = Pattern.compile(properties.getCostAccountPattern());
    }

    public void validate(CostAllocationRule rule) {
        Map<String, AllocationEntry> allocations = rule.getAllocations();
        List<String> errors = new ArrayList<>();

        BigDecimal total = allocations.values().stream()
                .map(entry -> MoneyUtil.nullToZero(entry.getPercentage()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        if (allocations.isEmpty()) {
            errors.add("No allocations defined");
        } else {
            BigDecimal deviation = total.subtract(MoneyUtil.ONE_HUNDRED).abs();
            if (deviation.compareTo(properties.getAllocation().getPercentageTolerance()) > 0) {
                errors.add(String.format("Allocations sum to %s%%, not 100%%", MoneyUtil.round(total).toPlainString()));
            }
        }

        for (String costAccount : allocations.keySet()) {
            if (!isValidCostAccount(costAccount)) {
                errors.add("Invalid cost account format: " + costAccount);
            }
        }

        rule.setTotalPercentage(MoneyUtil.round(total));
        rule.setValidationErrors(errors);
        rule.setValid(errors.isEmpty());
    }

    public boolean isValidCostAccount(String costAccount) {
        if (costAccount == null) {
            return false;
        }
        return costAccount.startsWith(properties.getVirtualSplitPrefix())
                || costAccountPattern.matcher(costAccount).matches();
    }
}
