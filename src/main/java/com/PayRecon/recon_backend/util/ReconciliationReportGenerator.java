package com.PayRecon.recon_backend.util;

import com.PayRecon.recon_backend.dto.response.CostCenterReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.EmployeeReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.JournalReconciliationResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationItemResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationRunResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

@Slf4j
public class ReconciliationReportGenerator {

    private static final String[] EMPLOYEE_HEADERS = {
            "Employee", "Name", "Type", "Worked Hours", "Paid Hours", "Hours Variance", "Hours Variance %",
            "Worked Cost", "Paid Gross", "Expected Cost", "Cost Variance", "Cost Variance %", "Issues"
    };
    private static final String[] EXCEPTION_HEADERS = {
            "Type", "Severity", "Employee", "Name", "Cost Center", "Expected", "Actual", "Variance",
            "Variance %", "Status", "Description"
    };
    private static final String[] COST_CENTER_HEADERS = {
            "Cost Center", "Paid", "Journal", "Variance", "Variance %", "Flagged"
    };
    private static final String[] JOURNAL_HEADERS = {
            "Description", "GL Account", "Mapped", "In Total Cost", "Debit", "Credit", "Net"
    };

    private ReconciliationReportGenerator() {
        // Utility class, no instantiation
    }

    public static byte[] generateRunReportExcel(ReconciliationRunResponse run, List<EmployeeReconciliationResponse> employees) {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle columnStyle = createColumnHeaderStyle(workbook);
            CellStyle currencyStyle = createCurrencyStyle(workbook);
            CellStyle percentageStyle = createPercentageStyle(workbook);

            writeSummarySheet(workbook.createSheet("Summary"), run, headerStyle, currencyStyle);

            Sheet employeeSheet = workbook.createSheet("Employees");
            int rowNum = writeColumnHeaders(employeeSheet, EMPLOYEE_HEADERS, columnStyle);
            for (EmployeeReconciliationResponse employee : employees) {
                Row row = employeeSheet.createRow(rowNum++);
                row.createCell(0).setCellValue(employee.getEmployeeId());
                row.createCell(1).setCellValue(nullToEmpty(employee.getEmployeeName()));
                row.createCell(2).setCellValue(nullToEmpty(employee.getEmploymentType()));
                setNumber(row, 3, employee.getWorkedHours(), null);
                setNumber(row, 4, employee.getPaidHours(), null);
                setNumber(row, 5, employee.getHoursVariance(), null);
                setPercentage(row, 6, employee.getHoursVariancePct(), percentageStyle);
                setNumber(row, 7, employee.getWorkedCost(), currencyStyle);
                setNumber(row, 8, employee.getPaidGross(), currencyStyle);
                setNumber(row, 9, employee.getExpectedCost(), currencyStyle);
                setNumber(row, 10, employee.getCostVariance(), currencyStyle);
                setPercentage(row, 11, employee.getCostVariancePct(), percentageStyle);
                row.createCell(12).setCellValue(nullToEmpty(employee.getIssueDescription()));
            }
            autoSize(employeeSheet, EMPLOYEE_HEADERS.length);

            Sheet exceptionSheet = workbook.createSheet("Exceptions");
            rowNum = writeColumnHeaders(exceptionSheet, EXCEPTION_HEADERS, columnStyle);
            for (ReconciliationItemResponse item : orEmpty(run.getExceptions())) {
                Row row = exceptionSheet.createRow(rowNum++);
                row.createCell(0).setCellValue(item.getReconType().name());
                row.createCell(1).setCellValue(item.getSeverity().name());
                row.createCell(2).setCellValue(nullToEmpty(item.getEmployeeId()));
                row.createCell(3).setCellValue(nullToEmpty(item.getEmployeeName()));
                row.createCell(4).setCellValue(nullToEmpty(item.getCostCenter()));
                setNumber(row, 5, item.getExpectedValue(), currencyStyle);
                setNumber(row, 6, item.getActualValue(), currencyStyle);
                setNumber(row, 7, item.getVariance(), currencyStyle);
                setPercentage(row, 8, item.getVariancePct(), percentageStyle);
                row.createCell(9).setCellValue(item.getStatus().name());
                row.createCell(10).setCellValue(item.getDescription());
            }
            autoSize(exceptionSheet, EXCEPTION_HEADERS.length);

            Sheet costCenterSheet = workbook.createSheet("Cost Centers");
            rowNum = writeColumnHeaders(costCenterSheet, COST_CENTER_HEADERS, columnStyle);
            for (CostCenterReconciliationResponse costCenter : orEmpty(run.getCostCenters())) {
                Row row = costCenterSheet.createRow(rowNum++);
                row.createCell(0).setCellValue(costCenter.getCostCenter());
                setNumber(row, 1, costCenter.getPaidAmount(), currencyStyle);
                setNumber(row, 2, costCenter.getJournalAmount(), currencyStyle);
                setNumber(row, 3, costCenter.getVariance(), currencyStyle);
                setPercentage(row, 4, costCenter.getVariancePct(), percentageStyle);
                row.createCell(5).setCellValue(costCenter.isFlagged() ? "Yes" : "No");
            }
            autoSize(costCenterSheet, COST_CENTER_HEADERS.length);

            Sheet journalSheet = workbook.createSheet("Journal");
            rowNum = writeColumnHeaders(journalSheet, JOURNAL_HEADERS, columnStyle);
            for (JournalReconciliationResponse journal : orEmpty(run.getJournal())) {
                Row row = journalSheet.createRow(rowNum++);
                row.createCell(0).setCellValue(journal.getDescription());
                row.createCell(1).setCellValue(nullToEmpty(journal.getGlAccount()));
                row.createCell(2).setCellValue(journal.isMapped() ? "Yes" : "No");
                row.createCell(3).setCellValue(journal.isIncludeInTotalCost() ? "Yes" : "No");
                setNumber(row, 4, journal.getJournalDebit(), currencyStyle);
                setNumber(row, 5, journal.getJournalCredit(), currencyStyle);
                setNumber(row, 6, journal.getJournalNet(), currencyStyle);
            }
            autoSize(journalSheet, JOURNAL_HEADERS.length);

            workbook.write(out);
            return out.toByteArray();

        } catch (IOException e) {
            log.error("Failed to generate reconciliation report Excel for run {}", run.getId(), e);
            throw new RuntimeException("Failed to generate report", e);
        }
    }

    private static void writeSummarySheet(Sheet sheet, ReconciliationRunResponse run,
                                          CellStyle headerStyle, CellStyle currencyStyle) {
        int rowNum = 0;
        Row headerRow = sheet.createRow(rowNum++);
        headerRow.createCell(0).setCellValue("Payroll Reconciliation " + run.getPeriodId());
        headerRow.getCell(0).setCellStyle(headerStyle);

        rowNum++; // Empty row

        rowNum = summaryRow(sheet, rowNum, "Run:", String.valueOf(run.getId()));
        rowNum = summaryRow(sheet, rowNum, "Status:", run.getStatus().name());
        rowNum = summaryRow(sheet, rowNum, "Started:", DateUtil.formatDateTime(run.getStartedAt()));
        rowNum = summaryRow(sheet, rowNum, "Completed:",
                run.getCompletedAt() != null ? DateUtil.formatDateTime(run.getCompletedAt()) : "");
        rowNum = summaryRow(sheet, rowNum, "Employees:", run.getEmployeeCount() != null ? run.getEmployeeCount() : 0);
        rowNum = summaryRow(sheet, rowNum, "Total Checks:", run.getTotalChecks());
        rowNum = summaryRow(sheet, rowNum, "Checks Passed:", run.getChecksPassed());
        rowNum = summaryRow(sheet, rowNum, "Checks Failed:", run.getChecksFailed());
        rowNum = summaryRow(sheet, rowNum, "Critical:", run.getCriticalExceptions());
        rowNum = summaryRow(sheet, rowNum, "Warnings:", run.getWarnings());

        Row costRow = sheet.createRow(rowNum++);
        costRow.createCell(0).setCellValue("Journal Total Cost:");
        setNumber(costRow, 1, run.getJournalTotalCost(), currencyStyle);

        summaryRow(sheet, rowNum, "Unmapped Descriptions:", run.getUnmappedDescriptions());

        sheet.autoSizeColumn(0);
        sheet.autoSizeColumn(1);
    }

    private static int summaryRow(Sheet sheet, int rowNum, String label, String value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
        return rowNum + 1;
    }

    private static int summaryRow(Sheet sheet, int rowNum, String label, int value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
        return rowNum + 1;
    }

    private static int writeColumnHeaders(Sheet sheet, String[] headers, CellStyle style) {
        Row row = sheet.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            Cell cell = row.createCell(i);
            cell.setCellValue(headers[i]);
            cell.setCellStyle(style);
        }
        sheet.createFreezePane(0, 1);
        return 1;
    }

    private static void setNumber(Row row, int column, BigDecimal value, CellStyle style) {
        Cell cell = row.createCell(column);
        if (value != null) {
            cell.setCellValue(value.doubleValue());
            if (style != null) {
                cell.setCellStyle(style);
            }
        }
    }

    // Stored percentages are whole numbers, Excel expects a fraction
    private static void setPercentage(Row row, int column, BigDecimal value, CellStyle style) {
        setNumber(row, column, value != null ? value.movePointLeft(2) : null, style);
    }

    private static void autoSize(Sheet sheet, int columns) {
        for (int i = 0; i < columns; i++) {
            sheet.autoSizeColumn(i);
        }
    }

    private static <T> List<T> orEmpty(List<T> rows) {
        return rows != null ? rows : Collections.emptyList();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints((short) 14);
        style.setFont(font);
        return style;
    }

    private static CellStyle createColumnHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setBorderBottom(BorderStyle.THIN);
        return style;
    }

    private static CellStyle createCurrencyStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        DataFormat format = workbook.createDataFormat();
        style.setDataFormat(format.getFormat("#,##0.00"));
        return style;
    }

    private static CellStyle createPercentageStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        DataFormat format = workbook.createDataFormat();
        style.setDataFormat(format.getFormat("0.00%"));
        return style;
    }
}
