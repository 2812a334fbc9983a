package com.PayRecon.recon_backend.service.snapshot;

import com.PayRecon.recon_backend.model.CostCenterSplit;
import com.PayRecon.recon_backend.model.JournalDescriptionMapping;
import com.PayRecon.recon_backend.model.LocationMapping;
import com.PayRecon.recon_backend.model.PayCompCodeMapping;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the reference tables, taken once at the start of an operation.
 * Inactive rows are dropped on construction.
 */
public class MappingSnapshot {

    private final Map<String, LocationMapping> locationsByKey;
    private final Map<String, List<CostCenterSplit>> splitsBySource;
    private final Map<String, JournalDescriptionMapping> journalByDescription;
    private final Map<String, PayCompCodeMapping> payCompsByCode;
    private final Set<String> hoursTransactionTypes;
    private final Set<String> costTransactionTypes;
    private final Set<String> knownCostAccounts;

    @Builder
    private MappingSnapshot(Collection<LocationMapping> locationMappings,
                            Collection<CostCenterSplit> splits,
                            Collection<JournalDescriptionMapping> journalMappings,
                            Collection<PayCompCodeMapping> payCompMappings,
                            Collection<String> hoursTransactionTypes,
                            Collection<String> costTransactionTypes) {
        Map<String, LocationMapping> locations = new HashMap<>();
        Set<String> accounts = new HashSet<>();
        for (LocationMapping mapping : orEmpty(locationMappings)) {
            if (mapping.isActive()) {
                locations.put(mapping.getTimesheetLocation(), mapping);
                accounts.add(mapping.getCostAccountCode());
            }
        }

        Map<String, List<CostCenterSplit>> splitMap = new LinkedHashMap<>();
        for (CostCenterSplit split : orEmpty(splits)) {
            if (split.isActive()) {
                splitMap.computeIfAbsent(split.getSourceAccount(), k -> new ArrayList<>()).add(split);
                accounts.add(split.getSourceAccount());
            }
        }
        splitMap.replaceAll((source, targets) -> Collections.unmodifiableList(targets));

        Map<String, JournalDescriptionMapping> journal = new HashMap<>();
        for (JournalDescriptionMapping mapping : orEmpty(journalMappings)) {
            if (mapping.isActive()) {
                journal.put(mapping.getDescription(), mapping);
            }
        }

        Map<String, PayCompCodeMapping> payComps = new HashMap<>();
        for (PayCompCodeMapping mapping : orEmpty(payCompMappings)) {
            payComps.put(mapping.getPayCompCode(), mapping);
        }

        this.locationsByKey = Collections.unmodifiableMap(locations);
        this.splitsBySource = Collections.unmodifiableMap(splitMap);
        this.journalByDescription = Collections.unmodifiableMap(journal);
        this.payCompsByCode = Collections.unmodifiableMap(payComps);
        this.hoursTransactionTypes = Set.copyOf(orEmpty(hoursTransactionTypes));
        this.costTransactionTypes = Set.copyOf(orEmpty(costTransactionTypes));
        this.knownCostAccounts = Collections.unmodifiableSet(accounts);
    }

    public static MappingSnapshot empty() {
        return MappingSnapshot.builder().build();
    }

    public Optional<LocationMapping> findLocation(String locationKey) {
        return Optional.ofNullable(locationsByKey.get(locationKey));
    }

    /**
     * Active targets of a split account, empty when the account has none.
     */
    public Optional<List<CostCenterSplit>> findSplitTargets(String sourceAccount) {
        List<CostCenterSplit> targets = splitsBySource.get(sourceAccount);
        return targets == null || targets.isEmpty() ? Optional.empty() : Optional.of(targets);
    }

    public Optional<JournalDescriptionMapping> findJournalMapping(String description) {
        return Optional.ofNullable(journalByDescription.get(description));
    }

    public Optional<PayCompCodeMapping> findPayComp(String payCompCode) {
        return Optional.ofNullable(payCompsByCode.get(payCompCode));
    }

    public boolean includesHours(String transactionType) {
        return transactionType != null && hoursTransactionTypes.contains(transactionType);
    }

    public boolean includesCost(String transactionType) {
        return transactionType != null && costTransactionTypes.contains(transactionType);
    }

    public boolean isKnownCostAccount(String costAccount) {
        return knownCostAccounts.contains(costAccount);
    }

    public Set<String> getHoursTransactionTypes() {
        return hoursTransactionTypes;
    }

    public Set<String> getCostTransactionTypes() {
        return costTransactionTypes;
    }

    private static <T> Collection<T> orEmpty(Collection<T> values) {
        return values != null ? values : Collections.emptyList();
    }
}
