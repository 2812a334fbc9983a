package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.model.CostCenterSplit;
import com.PayRecon.recon_backend.service.snapshot.MappingSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Rewrites virtual split accounts into their weighted real targets.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SplitExpander {

    private final ReconciliationProperties properties;

    public boolean isVirtual(String costAccount) {
        return costAccount != null && costAccount.startsWith(properties.getVirtualSplitPrefix());
    }

    /**
     * Expands a cost center to value map. Values of a virtual account are spread over its active
     * targets as {@code value * weight} and added to whatever those targets already hold. A virtual
     * account with no active targets is kept as is. Values are not rounded, so an account whose
     * weights sum to 1 keeps its total exactly.
     */
    public Map<String, BigDecimal> expand(Map<String, BigDecimal> values, MappingSnapshot snapshot) {
        Map<String, BigDecimal> expanded = new TreeMap<>();
        if (values == null) {
            return expanded;
        }

        for (Map.Entry<String, BigDecimal> entry : values.entrySet()) {
            String account = entry.getKey();
            BigDecimal value = entry.getValue() != null ? entry.getValue() : BigDecimal.ZERO;

            Optional<List<CostCenterSplit>> targets = isVirtual(account)
                    ? snapshot.findSplitTargets(account)
                    : Optional.empty();

            if (targets.isEmpty()) {
                if (isVirtual(account)) {
                    log.warn("Split account {} has no active targets, left unexpanded", account);
                }
                expanded.merge(account, value, BigDecimal::add);
                continue;
            }

            for (CostCenterSplit target : targets.get()) {
                expanded.merge(target.getTargetAccount(), value.multiply(target.getPercentage()), BigDecimal::add);
            }
        }
        return expanded;
    }
}
