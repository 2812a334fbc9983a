package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.dto.response.CostCenterReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.EmployeeReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.JournalReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.PaginatedResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationItemResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationRunResponse;
import com.PayRecon.recon_backend.enums.PeriodStatus;
import com.PayRecon.recon_backend.enums.RunStatus;
import com.PayRecon.recon_backend.exception.ResourceNotFoundException;
import com.PayRecon.recon_backend.model.EmployeeReconciliation;
import com.PayRecon.recon_backend.model.PayPeriod;
import com.PayRecon.recon_backend.model.ReconciliationItem;
import com.PayRecon.recon_backend.model.ReconciliationRun;
import com.PayRecon.recon_backend.repository.CostCenterReconciliationRepository;
import com.PayRecon.recon_backend.repository.EmployeeReconciliationRepository;
import com.PayRecon.recon_backend.repository.JournalLineRepository;
import com.PayRecon.recon_backend.repository.JournalReconciliationRepository;
import com.PayRecon.recon_backend.repository.PayPeriodRepository;
import com.PayRecon.recon_backend.repository.PayrollDetailLineRepository;
import com.PayRecon.recon_backend.repository.ReconciliationItemRepository;
import com.PayRecon.recon_backend.repository.ReconciliationRunRepository;
import com.PayRecon.recon_backend.repository.TimesheetShiftRepository;
import com.PayRecon.recon_backend.util.ReconciliationReportGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs the reconciliation of a period and serves the stored results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final ReconciliationRunRepository reconciliationRunRepository;
    private final ReconciliationItemRepository reconciliationItemRepository;
    private final EmployeeReconciliationRepository employeeReconciliationRepository;
    private final CostCenterReconciliationRepository costCenterReconciliationRepository;
    private final JournalReconciliationRepository journalReconciliationRepository;
    private final PayPeriodRepository payPeriodRepository;
    private final TimesheetShiftRepository timesheetShiftRepository;
    private final PayrollDetailLineRepository payrollDetailLineRepository;
    private final JournalLineRepository journalLineRepository;
    private final MappingRegistryService mappingRegistryService;
    private final EmployeeService employeeService;
    private final ReconciliationEngine reconciliationEngine;
    private final PeriodLockService periodLockService;
    private final TransactionTemplate transactionTemplate;
    private final ModelMapper modelMapper;

    /**
     * Reconciles the period under its lock. The run row is committed first; everything else is
     * written in one transaction, so a failure leaves the previous results untouched and returns
     * the run as FAILED.
     */
    public ReconciliationRunResponse runReconciliation(String periodId) {
        return periodLockService.executeWithLock(periodId, () -> {
            PayPeriod period = transactionTemplate.execute(status -> findPeriod(periodId));
            PeriodStatus previousStatus = period.getStatus();
            UUID runId = transactionTemplate.execute(status -> startRun(periodId));

            try {
                return transactionTemplate.execute(status -> executeRun(periodId, runId));
            } catch (RuntimeException e) {
                log.error("Reconciliation run {} for period {} failed", runId, periodId, e);
                return transactionTemplate.execute(status -> failRun(periodId, runId, previousStatus, e));
            }
        });
    }

    private UUID startRun(String periodId) {
        PayPeriod period = findPeriod(periodId);
        period.setStatus(PeriodStatus.RECONCILING);
        payPeriodRepository.save(period);

        ReconciliationRun run = reconciliationRunRepository.save(ReconciliationRun.builder()
                .payPeriod(period)
                .build());
        log.info("Reconciliation run {} started for period {}", run.getId(), periodId);
        return run.getId();
    }

    private ReconciliationRunResponse executeRun(String periodId, UUID runId) {
        ReconciliationEngine.Input input = ReconciliationEngine.Input.builder()
                .periodId(periodId)
                .shifts(timesheetShiftRepository.findByPeriodId(periodId))
                .payrollLines(payrollDetailLineRepository.findByPeriodId(periodId))
                .journalLines(journalLineRepository.findByPeriodId(periodId))
                .mappings(mappingRegistryService.loadSnapshot())
                .employees(employeeService.loadDirectory())
                .build();

        ReconciliationEngine.Outcome outcome = reconciliationEngine.reconcile(input);

        // Clears the persistence context, so the run and period are reloaded afterwards
        int replaced = employeeReconciliationRepository.deleteByPeriodId(periodId);

        ReconciliationRun run = findRun(runId);
        PayPeriod period = findPeriod(periodId);

        outcome.getEmployees().forEach(employee -> {
            employee.setPayPeriod(period);
            employee.setRun(run);
        });
        outcome.getItems().forEach(item -> item.setRun(run));
        outcome.getCostCenters().forEach(costCenter -> costCenter.setRun(run));
        outcome.getJournal().forEach(journal -> journal.setRun(run));

        employeeReconciliationRepository.saveAll(outcome.getEmployees());
        reconciliationItemRepository.saveAll(outcome.getItems());
        costCenterReconciliationRepository.saveAll(outcome.getCostCenters());
        journalReconciliationRepository.saveAll(outcome.getJournal());

        run.setStatus(RunStatus.COMPLETED);
        run.setCompletedAt(LocalDateTime.now());
        run.setTotalChecks(outcome.getTotalChecks());
        run.setChecksPassed(outcome.getChecksPassed());
        run.setChecksFailed(outcome.getChecksFailed());
        run.setCriticalExceptions(outcome.getCriticalCount());
        run.setWarnings(outcome.getWarningCount());
        run.setJournalTotalCost(outcome.getJournalTotalCost());
        run.setUnmappedDescriptions(outcome.getUnmappedDescriptions());
        ReconciliationRun savedRun = reconciliationRunRepository.save(run);

        period.setStatus(outcome.needsReview() ? PeriodStatus.REVIEW : PeriodStatus.UPLOADED);
        payPeriodRepository.save(period);

        log.info("Reconciliation run {} completed for period {}: {} employee rows (replaced {}), {} passed, {} failed",
                runId, periodId, outcome.getEmployees().size(), replaced,
                outcome.getChecksPassed(), outcome.getChecksFailed());

        return mapToRunResponse(savedRun, periodId);
    }

    private ReconciliationRunResponse failRun(String periodId, UUID runId, PeriodStatus previousStatus, RuntimeException cause) {
        ReconciliationRun run = findRun(runId);
        run.setStatus(RunStatus.FAILED);
        run.setCompletedAt(LocalDateTime.now());
        run.setErrorMessage(truncate(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName()));
        ReconciliationRun savedRun = reconciliationRunRepository.save(run);

        PayPeriod period = findPeriod(periodId);
        period.setStatus(previousStatus);
        payPeriodRepository.save(period);

        return mapToRunResponse(savedRun, periodId);
    }

    @Transactional(readOnly = true)
    public ReconciliationRunResponse getRun(UUID runId) {
        ReconciliationRun run = findRun(runId);
        ReconciliationRunResponse response = mapToRunResponse(run, run.getPayPeriod().getPeriodId());

        response.setEmployeeCount(employeeReconciliationRepository.findByRunId(runId).size());
        response.setExceptions(reconciliationItemRepository.findByRunId(runId)
                .stream()
                .map(this::mapToItemResponse)
                .collect(Collectors.toList()));
        response.setCostCenters(costCenterReconciliationRepository.findByRunId(runId)
                .stream()
                .map(costCenter -> modelMapper.map(costCenter, CostCenterReconciliationResponse.class))
                .collect(Collectors.toList()));
        response.setJournal(journalReconciliationRepository.findByRunId(runId)
                .stream()
                .map(journal -> modelMapper.map(journal, JournalReconciliationResponse.class))
                .collect(Collectors.toList()));
        return response;
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<ReconciliationRunResponse> getRuns(String periodId, int page, int limit) {
        findPeriod(periodId);
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("startedAt").descending());
        Page<ReconciliationRun> runsPage = reconciliationRunRepository.findByPeriodId(periodId, pageable);
        return PaginatedResponse.from(runsPage, run -> mapToRunResponse(run, periodId));
    }

    @Transactional(readOnly = true)
    public List<EmployeeReconciliationResponse> getEmployeeReconciliations(String periodId, boolean issuesOnly) {
        findPeriod(periodId);
        return employeeReconciliationRepository.findByPeriodId(periodId, issuesOnly)
                .stream()
                .map(employee -> mapToEmployeeResponse(employee, periodId))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public byte[] exportRun(UUID runId) {
        ReconciliationRunResponse run = getRun(runId);
        List<EmployeeReconciliationResponse> employees = employeeReconciliationRepository.findByRunId(runId)
                .stream()
                .map(employee -> mapToEmployeeResponse(employee, run.getPeriodId()))
                .collect(Collectors.toList());

        log.info("Exporting reconciliation run {} ({} employees, {} exceptions)",
                runId, employees.size(), run.getExceptions().size());
        return ReconciliationReportGenerator.generateRunReportExcel(run, employees);
    }

    private PayPeriod findPeriod(String periodId) {
        return payPeriodRepository.findById(periodId)
                .orElseThrow(() -> new ResourceNotFoundException("PayPeriod", "periodId", periodId));
    }

    private ReconciliationRun findRun(UUID runId) {
        return reconciliationRunRepository.findById(runId)
                .orElseThrow(() -> new ResourceNotFoundException("ReconciliationRun", "id", runId));
    }

    private static String truncate(String message) {
        return message.length() > 4000 ? message.substring(0, 4000) : message;
    }

    private ReconciliationRunResponse mapToRunResponse(ReconciliationRun run, String periodId) {
        ReconciliationRunResponse response = modelMapper.map(run, ReconciliationRunResponse.class);
        response.setPeriodId(periodId);
        return response;
    }

    ReconciliationItemResponse mapToItemResponse(ReconciliationItem item) {
        ReconciliationItemResponse response = modelMapper.map(item, ReconciliationItemResponse.class);
        response.setRunId(item.getRun().getId());
        return response;
    }

    private EmployeeReconciliationResponse mapToEmployeeResponse(EmployeeReconciliation employee, String periodId) {
        EmployeeReconciliationResponse response = modelMapper.map(employee, EmployeeReconciliationResponse.class);
        response.setPeriodId(periodId);
        response.setRunId(employee.getRun().getId());
        return response;
    }
}
