package com.PayRecon.recon_backend.util;

import com.PayRecon.recon_backend.dto.response.CostCenterReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.EmployeeReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.JournalReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationItemResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationRunResponse;
import com.PayRecon.recon_backend.enums.ExceptionStatus;
import com.PayRecon.recon_backend.enums.ReconType;
import com.PayRecon.recon_backend.enums.RunStatus;
import com.PayRecon.recon_backend.enums.Severity;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReconciliationReportGenerator")
class ReconciliationReportGeneratorTest {

    @Test
    @DisplayName("Should write one sheet per result set")
    void shouldWriteAllSheets() throws Exception {
        // Given
        ReconciliationRunResponse run = ReconciliationRunResponse.builder()
                .id(UUID.randomUUID())
                .periodId("2025-11-30")
                .status(RunStatus.COMPLETED)
                .startedAt(LocalDateTime.of(2025, 12, 1, 9, 0))
                .completedAt(LocalDateTime.of(2025, 12, 1, 9, 1))
                .employeeCount(1)
                .totalChecks(1)
                .checksFailed(1)
                .criticalExceptions(1)
                .journalTotalCost(new BigDecimal("2950.00"))
                .exceptions(List.of(ReconciliationItemResponse.builder()
                        .reconType(ReconType.HOURS)
                        .severity(Severity.CRITICAL)
                        .employeeId("E2")
                        .expectedValue(BigDecimal.ZERO)
                        .actualValue(new BigDecimal("38.00"))
                        .variance(new BigDecimal("38.00"))
                        .variancePct(BigDecimal.ZERO)
                        .status(ExceptionStatus.OPEN)
                        .description("Employee E2 has 38.00 hours in IQB but NO timesheet in Tanda. Missing timesheet?")
                        .build()))
                .costCenters(List.of(CostCenterReconciliationResponse.builder()
                        .costCenter("458-50")
                        .paidAmount(new BigDecimal("2950.00"))
                        .journalAmount(new BigDecimal("2950.00"))
                        .variance(BigDecimal.ZERO)
                        .variancePct(BigDecimal.ZERO)
                        .build()))
                .journal(List.of(JournalReconciliationResponse.builder()
                        .description("Wages")
                        .journalDebit(new BigDecimal("2950.00"))
                        .journalCredit(BigDecimal.ZERO)
                        .journalNet(new BigDecimal("2950.00"))
                        .build()))
                .build();
        List<EmployeeReconciliationResponse> employees = List.of(EmployeeReconciliationResponse.builder()
                .employeeId("E1")
                .employeeName("Alex Chen")
                .workedHours(new BigDecimal("80.00"))
                .paidHours(new BigDecimal("80.00"))
                .costVariancePct(new BigDecimal("12.50"))
                .build());

        // When
        byte[] report = ReconciliationReportGenerator.generateRunReportExcel(run, employees);

        // Then
        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(report))) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(5);
            assertThat(workbook.getSheetName(0)).isEqualTo("Summary");
            assertThat(workbook.getSheetName(1)).isEqualTo("Employees");
            assertThat(workbook.getSheetName(2)).isEqualTo("Exceptions");
            assertThat(workbook.getSheetName(3)).isEqualTo("Cost Centers");
            assertThat(workbook.getSheetName(4)).isEqualTo("Journal");

            assertThat(workbook.getSheet("Summary").getRow(0).getCell(0).getStringCellValue())
                    .isEqualTo("Payroll Reconciliation 2025-11-30");

            Sheet employeeSheet = workbook.getSheet("Employees");
            assertThat(employeeSheet.getRow(1).getCell(0).getStringCellValue()).isEqualTo("E1");
            assertThat(employeeSheet.getRow(1).getCell(11).getNumericCellValue()).isEqualTo(0.125);

            Sheet exceptionSheet = workbook.getSheet("Exceptions");
            assertThat(exceptionSheet.getLastRowNum()).isEqualTo(1);
            assertThat(exceptionSheet.getRow(1).getCell(1).getStringCellValue()).isEqualTo("CRITICAL");
        }
    }
}
