package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.dto.request.JournalLineRequest;
import com.PayRecon.recon_backend.dto.request.PayrollDetailLineRequest;
import com.PayRecon.recon_backend.dto.request.TimesheetShiftRequest;
import com.PayRecon.recon_backend.dto.response.EmployeeReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationRunResponse;
import com.PayRecon.recon_backend.enums.PeriodStatus;
import com.PayRecon.recon_backend.enums.RunStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Reconciliation runs")
class ReconciliationIntegrationTest {

    @Autowired
    private PayPeriodService payPeriodService;

    @Autowired
    private ReconciliationService reconciliationService;

    @SpyBean
    private ReconciliationEngine reconciliationEngine;

    private void ingestPeriod(String periodId) {
        payPeriodService.ingestTimesheet(periodId, List.of(
                TimesheetShiftRequest.builder()
                        .employeeId("E1").employeeName("Alex Chen").employmentType("Full Time")
                        .locationName("Brisbane").teamName("Kitchen")
                        .hours(new BigDecimal("80")).cost(new BigDecimal("2000"))
                        .build(),
                TimesheetShiftRequest.builder()
                        .employeeId("E3").employeeName("Sam Lee").employmentType("Casual")
                        .locationName("Brisbane").teamName("Bar")
                        .hours(new BigDecimal("20")).cost(new BigDecimal("600"))
                        .build()));
        payPeriodService.ingestPayroll(periodId, List.of(
                PayrollDetailLineRequest.builder()
                        .employeeCode("E1").employeeName("Alex Chen").costAccountCode("458-50")
                        .payCompCode("Normal").transactionType("Hours By Rate")
                        .hours(new BigDecimal("80")).amount(new BigDecimal("2000"))
                        .build(),
                PayrollDetailLineRequest.builder()
                        .employeeCode("E2").employeeName("Jo Park").costAccountCode("458-50")
                        .payCompCode("Normal").transactionType("Hours By Rate")
                        .hours(new BigDecimal("38")).amount(new BigDecimal("950"))
                        .build(),
                PayrollDetailLineRequest.builder()
                        .employeeCode("E3").employeeName("Sam Lee").costAccountCode("470-60")
                        .payCompCode("Normal").transactionType("Hours By Rate")
                        .hours(new BigDecimal("20")).amount(new BigDecimal("600"))
                        .build()));
        payPeriodService.ingestJournal(periodId, List.of(
                JournalLineRequest.builder()
                        .ledgerAccount("-6345").costAccount("458-50").description("Wages")
                        .debit(new BigDecimal("2950")).credit(BigDecimal.ZERO)
                        .build(),
                JournalLineRequest.builder()
                        .ledgerAccount("-6345").costAccount("470-60").description("Wages")
                        .debit(new BigDecimal("600")).credit(BigDecimal.ZERO)
                        .build()));
    }

    @Test
    @DisplayName("Should replace the period's results when run again")
    void shouldRerunIdempotently() {
        // Given
        String periodId = "2025-11-30";
        ingestPeriod(periodId);

        // When
        ReconciliationRunResponse first = reconciliationService.runReconciliation(periodId);
        ReconciliationRunResponse second = reconciliationService.runReconciliation(periodId);

        // Then
        assertThat(first.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(second.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(second.getCriticalExceptions()).isEqualTo(first.getCriticalExceptions()).isEqualTo(1);
        assertThat(second.getJournalTotalCost()).isEqualByComparingTo("0");

        List<EmployeeReconciliationResponse> employees = reconciliationService.getEmployeeReconciliations(periodId, false);
        assertThat(employees)
                .extracting(EmployeeReconciliationResponse::getEmployeeId)
                .containsExactly("E1", "E2", "E3");
        assertThat(employees).allMatch(employee -> second.getId().equals(employee.getRunId()));

        ReconciliationRunResponse detail = reconciliationService.getRun(second.getId());
        assertThat(detail.getEmployeeCount()).isEqualTo(3);
        assertThat(detail.getExceptions()).singleElement()
                .satisfies(item -> assertThat(item.getEmployeeId()).isEqualTo("E2"));
        assertThat(reconciliationService.getRuns(periodId, 1, 20).getPagination().getTotal()).isEqualTo(2);
        assertThat(payPeriodService.getPeriod(periodId).getStatus()).isEqualTo(PeriodStatus.REVIEW);
    }

    @Test
    @DisplayName("Should keep the previous results when a run fails")
    void shouldKeepPreviousResultsOnFailure() {
        // Given
        String periodId = "2025-12-14";
        ingestPeriod(periodId);
        ReconciliationRunResponse completed = reconciliationService.runReconciliation(periodId);
        PeriodStatus statusBefore = payPeriodService.getPeriod(periodId).getStatus();
        doThrow(new IllegalStateException("engine exploded")).when(reconciliationEngine).reconcile(any());

        // When
        ReconciliationRunResponse failed = reconciliationService.runReconciliation(periodId);

        // Then
        assertThat(failed.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("engine exploded");
        assertThat(failed.getCompletedAt()).isNotNull();
        assertThat(reconciliationService.getEmployeeReconciliations(periodId, false))
                .hasSize(3)
                .allMatch(employee -> completed.getId().equals(employee.getRunId()));
        assertThat(payPeriodService.getPeriod(periodId).getStatus()).isEqualTo(statusBefore);
    }
}
