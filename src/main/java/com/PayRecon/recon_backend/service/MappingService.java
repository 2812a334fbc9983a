package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.dto.request.JournalMappingRequest;
import com.PayRecon.recon_backend.dto.request.LocationMappingRequest;
import com.PayRecon.recon_backend.dto.request.PayCompMappingRequest;
import com.PayRecon.recon_backend.dto.request.SplitExpansionRequest;
import com.PayRecon.recon_backend.dto.request.SplitTargetsRequest;
import com.PayRecon.recon_backend.dto.request.TransactionTypeRequest;
import com.PayRecon.recon_backend.exception.ApiException;
import com.PayRecon.recon_backend.exception.ResourceNotFoundException;
import com.PayRecon.recon_backend.exception.ValidationException;
import com.PayRecon.recon_backend.model.CostCenterSplit;
import com.PayRecon.recon_backend.model.JournalDescriptionMapping;
import com.PayRecon.recon_backend.model.LocationMapping;
import com.PayRecon.recon_backend.model.PayCompCodeMapping;
import com.PayRecon.recon_backend.model.TransactionTypeConfig;
import com.PayRecon.recon_backend.repository.CostCenterSplitRepository;
import com.PayRecon.recon_backend.repository.JournalDescriptionMappingRepository;
import com.PayRecon.recon_backend.repository.LocationMappingRepository;
import com.PayRecon.recon_backend.repository.PayCompCodeMappingRepository;
import com.PayRecon.recon_backend.repository.TransactionTypeConfigRepository;
import com.PayRecon.recon_backend.util.CostAccountCodes;
import com.PayRecon.recon_backend.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.FieldError;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maintenance of the reference tables read by reconciliation, allocation and accruals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MappingService {

    private static final BigDecimal SPLIT_WEIGHT_TOLERANCE = new BigDecimal("0.0001");

    private final LocationMappingRepository locationMappingRepository;
    private final CostCenterSplitRepository costCenterSplitRepository;
    private final JournalDescriptionMappingRepository journalDescriptionMappingRepository;
    private final TransactionTypeConfigRepository transactionTypeConfigRepository;
    private final PayCompCodeMappingRepository payCompCodeMappingRepository;
    private final MappingRegistryService mappingRegistryService;
    private final SplitExpander splitExpander;

    // Location mappings

    @Transactional(readOnly = true)
    public List<LocationMapping> getLocationMappings(boolean activeOnly) {
        return activeOnly
                ? locationMappingRepository.findByActiveTrueOrderByTimesheetLocationAsc()
                : locationMappingRepository.findAllByOrderByTimesheetLocationAsc();
    }

    @Transactional
    public LocationMapping saveLocationMapping(LocationMappingRequest request) {
        String location = request.getTimesheetLocation().trim();
        LocationMapping mapping = locationMappingRepository.findByTimesheetLocation(location)
                .orElseGet(() -> LocationMapping.builder().timesheetLocation(location).build());

        String account = request.getCostAccountCode().trim();
        mapping.setCostAccountCode(account);
        mapping.setDepartmentCode(request.getDepartmentCode() != null && !request.getDepartmentCode().isBlank()
                ? request.getDepartmentCode()
                : CostAccountCodes.departmentCode(account).orElse(null));
        mapping.setDepartmentName(request.getDepartmentName());
        if (request.getActive() != null) {
            mapping.setActive(request.getActive());
        }

        LocationMapping savedMapping = locationMappingRepository.save(mapping);
        log.info("Location mapping saved: {} -> {}", savedMapping.getTimesheetLocation(), savedMapping.getCostAccountCode());
        return savedMapping;
    }

    /**
     * Soft disable or re-enable. Inactive mappings are ignored by every lookup.
     */
    @Transactional
    public LocationMapping setLocationMappingActive(UUID id, boolean active) {
        LocationMapping mapping = locationMappingRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("LocationMapping", "id", id));
        mapping.setActive(active);
        LocationMapping savedMapping = locationMappingRepository.save(mapping);
        log.info("Location mapping {} {}", savedMapping.getTimesheetLocation(), active ? "activated" : "deactivated");
        return savedMapping;
    }

    // Cost center splits

    @Transactional(readOnly = true)
    public Map<String, List<CostCenterSplit>> getSplits() {
        return costCenterSplitRepository.findAllByOrderBySourceAccountAscTargetAccountAsc()
                .stream()
                .collect(Collectors.groupingBy(CostCenterSplit::getSourceAccount, TreeMap::new, Collectors.toList()));
    }

    @Transactional(readOnly = true)
    public List<CostCenterSplit> getSplitTargets(String sourceAccount) {
        List<CostCenterSplit> targets = costCenterSplitRepository.findBySourceAccountOrderByTargetAccountAsc(sourceAccount);
        if (targets.isEmpty()) {
            throw new ResourceNotFoundException("CostCenterSplit", "sourceAccount", sourceAccount);
        }
        return targets;
    }

    /**
     * Replaces every target of a virtual account. Weights are redistribution fractions and are
     * stored as given, even when they do not add up to one.
     */
    @Transactional
    public List<CostCenterSplit> replaceSplitTargets(String sourceAccount, SplitTargetsRequest request) {
        if (!splitExpander.isVirtual(sourceAccount)) {
            throw new ApiException("Split source " + sourceAccount + " is not a virtual split account",
                    HttpStatus.BAD_REQUEST, "INVALID_SPLIT_SOURCE");
        }

        Set<String> targetAccounts = new HashSet<>();
        BigDecimal totalWeight = BigDecimal.ZERO;
        for (SplitTargetsRequest.Target target : request.getTargets()) {
            if (!targetAccounts.add(target.getTargetAccount().trim())) {
                throw new ValidationException("Duplicate split target",
                        List.of(new FieldError("splitTargets", "targets", "Duplicate target " + target.getTargetAccount())));
            }
            totalWeight = totalWeight.add(target.getPercentage());
        }
        if (totalWeight.subtract(BigDecimal.ONE).abs().compareTo(SPLIT_WEIGHT_TOLERANCE) > 0) {
            log.warn("Split {} weights add up to {}, expansion will not conserve the source amount",
                    sourceAccount, totalWeight.toPlainString());
        }

        int removed = costCenterSplitRepository.deleteBySource(sourceAccount);
        List<CostCenterSplit> splits = request.getTargets().stream()
                .map(target -> CostCenterSplit.builder()
                        .sourceAccount(sourceAccount)
                        .targetAccount(target.getTargetAccount().trim())
                        .percentage(target.getPercentage())
                        .notes(request.getNotes())
                        .build())
                .collect(Collectors.toList());

        List<CostCenterSplit> savedSplits = costCenterSplitRepository.saveAll(splits);
        log.info("Split {} now has {} targets (replaced {})", sourceAccount, savedSplits.size(), removed);
        return savedSplits;
    }

    /**
     * Ad-hoc expansion of virtual accounts against the active split table.
     */
    public Map<String, BigDecimal> expand(SplitExpansionRequest request) {
        return splitExpander.expand(request.getAmounts(), mappingRegistryService.loadSnapshot())
                .entrySet()
                .stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> MoneyUtil.round(entry.getValue()),
                        (a, b) -> a, TreeMap::new));
    }

    // Journal descriptions

    @Transactional(readOnly = true)
    public List<JournalDescriptionMapping> getJournalMappings() {
        return journalDescriptionMappingRepository.findAll(Sort.by("description"));
    }

    @Transactional
    public JournalDescriptionMapping saveJournalMapping(JournalMappingRequest request) {
        String description = request.getDescription().trim();
        JournalDescriptionMapping mapping = journalDescriptionMappingRepository.findByDescription(description)
                .orElseGet(() -> JournalDescriptionMapping.builder().description(description).build());
        mapping.setGlAccount(request.getGlAccount());
        mapping.setIncludeInTotalCost(request.isIncludeInTotalCost());
        mapping.setActive(request.isActive());

        JournalDescriptionMapping savedMapping = journalDescriptionMappingRepository.save(mapping);
        log.info("Journal description mapping saved: {} -> {}", description, savedMapping.getGlAccount());
        return savedMapping;
    }

    // Transaction types

    @Transactional(readOnly = true)
    public List<TransactionTypeConfig> getTransactionTypes() {
        return transactionTypeConfigRepository.findAll(Sort.by("transactionType"));
    }

    @Transactional
    public TransactionTypeConfig saveTransactionType(TransactionTypeRequest request) {
        String type = request.getTransactionType().trim();
        TransactionTypeConfig config = transactionTypeConfigRepository.findByTransactionType(type)
                .orElseGet(() -> TransactionTypeConfig.builder().transactionType(type).build());
        config.setIncludeInHours(request.isIncludeInHours());
        config.setIncludeInCosts(request.isIncludeInCosts());
        config.setNotes(request.getNotes());
        config.setActive(request.isActive());

        TransactionTypeConfig savedConfig = transactionTypeConfigRepository.save(config);
        log.info("Transaction type {} saved (hours: {}, costs: {})", type,
                savedConfig.isIncludeInHours(), savedConfig.isIncludeInCosts());
        return savedConfig;
    }

    // Pay component codes

    @Transactional(readOnly = true)
    public List<PayCompCodeMapping> getPayCompMappings() {
        return payCompCodeMappingRepository.findAll(Sort.by("payCompCode"));
    }

    @Transactional
    public PayCompCodeMapping savePayCompMapping(PayCompMappingRequest request) {
        PayCompCodeMapping mapping = payCompCodeMappingRepository.save(PayCompCodeMapping.builder()
                .payCompCode(request.getPayCompCode().trim())
                .glAccount(request.getGlAccount().trim())
                .glName(request.getGlName())
                .build());
        log.info("Pay component {} mapped to {}", mapping.getPayCompCode(), mapping.getGlAccount());
        return mapping;
    }
}
