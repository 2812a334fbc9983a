package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.model.TransactionTypeConfig;
import com.PayRecon.recon_backend.repository.CostCenterSplitRepository;
import com.PayRecon.recon_backend.repository.JournalDescriptionMappingRepository;
import com.PayRecon.recon_backend.repository.LocationMappingRepository;
import com.PayRecon.recon_backend.repository.PayCompCodeMappingRepository;
import com.PayRecon.recon_backend.repository.TransactionTypeConfigRepository;
import com.PayRecon.recon_backend.service.snapshot.MappingSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class MappingRegistryService {

    private final LocationMappingRepository locationMappingRepository;
    private final CostCenterSplitRepository costCenterSplitRepository;
    private final JournalDescriptionMappingRepository journalDescriptionMappingRepository;
    private final TransactionTypeConfigRepository transactionTypeConfigRepository;
    private final PayCompCodeMappingRepository payCompCodeMappingRepository;
    private final ReconciliationProperties properties;

    /**
     * Loads every reference table into one immutable snapshot.
     * Falls back to the configured transaction type lists while the table is empty.
     */
    @Transactional(readOnly = true)
    public MappingSnapshot loadSnapshot() {
        List<TransactionTypeConfig> transactionTypes = transactionTypeConfigRepository.findByActiveTrue();

        List<String> hoursTypes;
        List<String> costTypes;
        if (transactionTypes.isEmpty()) {
            log.debug("Transaction type table empty, using configured defaults");
            hoursTypes = properties.getTransactionTypes().getHours();
            costTypes = properties.getTransactionTypes().getCosts();
        } else {
            hoursTypes = transactionTypes.stream()
                    .filter(TransactionTypeConfig::isIncludeInHours)
                    .map(TransactionTypeConfig::getTransactionType)
                    .collect(Collectors.toList());
            costTypes = transactionTypes.stream()
                    .filter(TransactionTypeConfig::isIncludeInCosts)
                    .map(TransactionTypeConfig::getTransactionType)
                    .collect(Collectors.toList());
        }

        MappingSnapshot snapshot = MappingSnapshot.builder()
                .locationMappings(locationMappingRepository.findByActiveTrueOrderByTimesheetLocationAsc())
                .splits(costCenterSplitRepository.findByActiveTrue())
                .journalMappings(journalDescriptionMappingRepository.findByActiveTrue())
                .payCompMappings(payCompCodeMappingRepository.findAll())
                .hoursTransactionTypes(hoursTypes)
                .costTransactionTypes(costTypes)
                .build();

        log.debug("Loaded mapping snapshot: {} hours types, {} cost types", hoursTypes.size(), costTypes.size());
        return snapshot;
    }
}
