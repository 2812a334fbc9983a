package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.dto.request.JournalLineRequest;
import com.PayRecon.recon_backend.dto.request.PayPeriodRequest;
import com.PayRecon.recon_backend.dto.request.PayrollDetailLineRequest;
import com.PayRecon.recon_backend.dto.request.TimesheetShiftRequest;
import com.PayRecon.recon_backend.dto.response.FactIngestionResponse;
import com.PayRecon.recon_backend.dto.response.PaginatedResponse;
import com.PayRecon.recon_backend.dto.response.PayPeriodResponse;
import com.PayRecon.recon_backend.enums.PeriodStatus;
import com.PayRecon.recon_backend.enums.SourceSystem;
import com.PayRecon.recon_backend.exception.ApiException;
import com.PayRecon.recon_backend.exception.ResourceNotFoundException;
import com.PayRecon.recon_backend.model.JournalLine;
import com.PayRecon.recon_backend.model.PayPeriod;
import com.PayRecon.recon_backend.model.PayrollDetailLine;
import com.PayRecon.recon_backend.model.TimesheetShift;
import com.PayRecon.recon_backend.repository.JournalLineRepository;
import com.PayRecon.recon_backend.repository.PayPeriodRepository;
import com.PayRecon.recon_backend.repository.PayrollDetailLineRepository;
import com.PayRecon.recon_backend.repository.TimesheetShiftRepository;
import com.PayRecon.recon_backend.util.DateUtil;
import com.PayRecon.recon_backend.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pay periods and their fact sets. Ingesting a fact set replaces that source's rows wholesale.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayPeriodService {

    private final PayPeriodRepository payPeriodRepository;
    private final TimesheetShiftRepository timesheetShiftRepository;
    private final PayrollDetailLineRepository payrollDetailLineRepository;
    private final JournalLineRepository journalLineRepository;
    private final PeriodLockService periodLockService;
    private final TransactionTemplate transactionTemplate;
    private final ModelMapper modelMapper;

    public PayPeriodResponse getPeriod(String periodId) {
        return mapToPayPeriodResponse(findPeriod(periodId));
    }

    public PaginatedResponse<PayPeriodResponse> getPeriods(int page, int limit, PeriodStatus status) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("periodEnd").descending());
        Page<PayPeriod> periodsPage = payPeriodRepository.findByCriteria(status, pageable);
        return PaginatedResponse.from(periodsPage, this::mapToPayPeriodResponse);
    }

    @Transactional
    public PayPeriodResponse savePeriod(PayPeriodRequest request) {
        if (request.getPeriodStart().isAfter(request.getPeriodEnd())) {
            throw new ApiException("Period start must not be after period end", HttpStatus.BAD_REQUEST);
        }

        PayPeriod period = payPeriodRepository.findById(request.getPeriodId())
                .orElseGet(() -> PayPeriod.builder().periodId(request.getPeriodId()).build());
        period.setPeriodStart(request.getPeriodStart());
        period.setPeriodEnd(request.getPeriodEnd());
        if (request.getPeriodType() != null && !request.getPeriodType().isBlank()) {
            period.setPeriodType(request.getPeriodType());
        }

        PayPeriod savedPeriod = payPeriodRepository.save(period);
        log.info("Pay period saved: {}", savedPeriod.getPeriodId());
        return mapToPayPeriodResponse(savedPeriod);
    }

    public FactIngestionResponse ingestTimesheet(String periodId, List<TimesheetShiftRequest> shifts) {
        return ingest(periodId, SourceSystem.TIMESHEET, shifts,
                timesheetShiftRepository::deleteByPeriodId,
                period -> timesheetShiftRepository.saveAll(shifts.stream()
                        .map(request -> toShift(period, request))
                        .collect(Collectors.toList())).size());
    }

    public FactIngestionResponse ingestPayroll(String periodId, List<PayrollDetailLineRequest> lines) {
        return ingest(periodId, SourceSystem.PAYROLL, lines,
                payrollDetailLineRepository::deleteByPeriodId,
                period -> payrollDetailLineRepository.saveAll(lines.stream()
                        .map(request -> toPayrollLine(period, request))
                        .collect(Collectors.toList())).size());
    }

    public FactIngestionResponse ingestJournal(String periodId, List<JournalLineRequest> lines) {
        return ingest(periodId, SourceSystem.JOURNAL, lines,
                journalLineRepository::deleteByPeriodId,
                period -> journalLineRepository.saveAll(lines.stream()
                        .map(request -> toJournalLine(period, request))
                        .collect(Collectors.toList())).size());
    }

    private FactIngestionResponse ingest(String periodId, SourceSystem source, List<?> rows,
                                         Function<String, Integer> deleteExisting,
                                         Function<PayPeriod, Integer> insertRows) {
        return periodLockService.executeWithLock(periodId, () -> transactionTemplate.execute(status -> {
            int replaced = deleteExisting.apply(periodId);
            PayPeriod period = getOrCreatePeriod(periodId);

            int ingested = insertRows.apply(period);
            period.markSource(source, !rows.isEmpty());
            PayPeriod savedPeriod = payPeriodRepository.save(period);

            log.info("Ingested {} {} rows for period {} (replaced {})",
                    ingested, source.getDisplayName(), periodId, replaced);

            return FactIngestionResponse.builder()
                    .periodId(periodId)
                    .source(source)
                    .rowsReplaced(replaced)
                    .rowsIngested(ingested)
                    .period(mapToPayPeriodResponse(savedPeriod))
                    .build();
        }));
    }

    PayPeriod findPeriod(String periodId) {
        return payPeriodRepository.findById(periodId)
                .orElseThrow(() -> new ResourceNotFoundException("PayPeriod", "periodId", periodId));
    }

    /**
     * Periods are created with the first fact set. The id is the fortnight's end date.
     */
    private PayPeriod getOrCreatePeriod(String periodId) {
        return payPeriodRepository.findById(periodId).orElseGet(() -> {
            LocalDate periodEnd = DateUtil.parsePeriodEnd(periodId)
                    .orElseThrow(() -> new ApiException(
                            "Unknown period " + periodId + " and its id is not a yyyy-MM-dd end date",
                            HttpStatus.BAD_REQUEST));
            log.info("Creating pay period {}", periodId);
            return payPeriodRepository.save(PayPeriod.builder()
                    .periodId(periodId)
                    .periodStart(DateUtil.fortnightStart(periodEnd))
                    .periodEnd(periodEnd)
                    .build());
        });
    }

    private TimesheetShift toShift(PayPeriod period, TimesheetShiftRequest request) {
        return TimesheetShift.builder()
                .payPeriod(period)
                .employeeId(request.getEmployeeId().trim())
                .employeeName(request.getEmployeeName())
                .employmentType(request.getEmploymentType())
                .locationName(request.getLocationName())
                .teamName(request.getTeamName())
                .awardExportName(request.getAwardExportName())
                .glCode(request.getGlCode())
                .shiftDate(request.getShiftDate())
                .hours(MoneyUtil.nullToZero(request.getHours()))
                .cost(MoneyUtil.nullToZero(request.getCost()))
                .build();
    }

    private PayrollDetailLine toPayrollLine(PayPeriod period, PayrollDetailLineRequest request) {
        return PayrollDetailLine.builder()
                .payPeriod(period)
                .employeeCode(request.getEmployeeCode().trim())
                .employeeName(request.getEmployeeName())
                .employmentType(request.getEmploymentType())
                .costAccountCode(request.getCostAccountCode())
                .payCompCode(request.getPayCompCode())
                .transactionType(request.getTransactionType().trim())
                .hours(MoneyUtil.nullToZero(request.getHours()))
                .amount(MoneyUtil.nullToZero(request.getAmount()))
                .build();
    }

    private JournalLine toJournalLine(PayPeriod period, JournalLineRequest request) {
        return JournalLine.builder()
                .payPeriod(period)
                .ledgerAccount(request.getLedgerAccount())
                .costAccount(request.getCostAccount())
                .description(request.getDescription())
                .debit(MoneyUtil.nullToZero(request.getDebit()))
                .credit(MoneyUtil.nullToZero(request.getCredit()))
                .build();
    }

    PayPeriodResponse mapToPayPeriodResponse(PayPeriod period) {
        PayPeriodResponse response = modelMapper.map(period, PayPeriodResponse.class);
        response.setMissingSources(period.missingSources());
        return response;
    }
}
