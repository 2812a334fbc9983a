package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.dto.response.ValidationReport;
import com.PayRecon.recon_backend.exception.ResourceNotFoundException;
import com.PayRecon.recon_backend.model.PayCompCodeMapping;
import com.PayRecon.recon_backend.repository.CostCenterSplitRepository;
import com.PayRecon.recon_backend.repository.PayPeriodRepository;
import com.PayRecon.recon_backend.repository.PayrollDetailLineRepository;
import com.PayRecon.recon_backend.repository.TimesheetShiftRepository;
import com.PayRecon.recon_backend.service.snapshot.EmployeeDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.PayRecon.recon_backend.support.ReconTestData.employee;
import static com.PayRecon.recon_backend.support.ReconTestData.location;
import static com.PayRecon.recon_backend.support.ReconTestData.payLine;
import static com.PayRecon.recon_backend.support.ReconTestData.shift;
import static com.PayRecon.recon_backend.support.ReconTestData.snapshot;
import static com.PayRecon.recon_backend.support.ReconTestData.split;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DataValidationService")
class DataValidationServiceTest {

    private static final String PERIOD = "2025-11-30";

    @Mock
    private PayPeriodRepository payPeriodRepository;

    @Mock
    private PayrollDetailLineRepository payrollDetailLineRepository;

    @Mock
    private TimesheetShiftRepository timesheetShiftRepository;

    @Mock
    private CostCenterSplitRepository costCenterSplitRepository;

    @Mock
    private MappingRegistryService mappingRegistryService;

    @Mock
    private EmployeeService employeeService;

    private DataValidationService dataValidationService;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        dataValidationService = new DataValidationService(
                payPeriodRepository,
                payrollDetailLineRepository,
                timesheetShiftRepository,
                costCenterSplitRepository,
                mappingRegistryService,
                employeeService,
                new AllocationValidator(properties),
                new SplitExpander(properties));
    }

    @Test
    @DisplayName("Should pass a period whose facts match the reference data")
    void shouldPassCleanPeriod() {
        // Given
        when(payPeriodRepository.existsById(PERIOD)).thenReturn(true);
        when(mappingRegistryService.loadSnapshot()).thenReturn(snapshot()
                .locationMappings(List.of(location("Brisbane - Kitchen", "458-50")))
                .payCompMappings(List.of(PayCompCodeMapping.builder().payCompCode("Normal").glAccount("6345").build()))
                .build());
        when(employeeService.loadDirectory()).thenReturn(EmployeeDirectory.of(List.of(employee("E1", "Full Time"))));
        when(payrollDetailLineRepository.findByPeriodId(PERIOD))
                .thenReturn(List.of(payLine("E1", "458-50", "Hours By Rate", "38", "950")));
        when(timesheetShiftRepository.findByPeriodId(PERIOD))
                .thenReturn(List.of(shift("E1", "Brisbane", "Kitchen", "38", "950")));
        when(costCenterSplitRepository.findByActiveTrue()).thenReturn(List.of());

        // When
        ValidationReport report = dataValidationService.validatePeriod(PERIOD);

        // Then
        assertThat(report.isPassed()).isTrue();
        assertThat(report.getFailedChecks()).isZero();
        assertThat(report.getChecks()).hasSize(7).allMatch(ValidationReport.Check::isPassed);
    }

    @Test
    @DisplayName("Should list the values that fail each check")
    void shouldReportFailures() {
        when(payPeriodRepository.existsById(PERIOD)).thenReturn(true);
        when(mappingRegistryService.loadSnapshot()).thenReturn(snapshot()
                .locationMappings(List.of(location("Brisbane - Kitchen", "458-50")))
                .build());
        when(employeeService.loadDirectory()).thenReturn(EmployeeDirectory.of(List.of(employee("E1", "Full Time"))));
        when(payrollDetailLineRepository.findByPeriodId(PERIOD)).thenReturn(List.of(
                payLine("E1", "458-50", "Hours By Rate", "30", "750"),
                payLine("E2", "KITCHEN", "Hours By Rate", "8", "200")));
        when(timesheetShiftRepository.findByPeriodId(PERIOD))
                .thenReturn(List.of(shift("E3", "Cairns", "Floor", "8", "200")));
        when(costCenterSplitRepository.findByActiveTrue())
                .thenReturn(List.of(split("SPL-CHEF", "458-50", "0.5"), split("SPL-CHEF", "SPL-BAR", "0.5")));

        ValidationReport report = dataValidationService.validatePeriod(PERIOD);

        Map<String, ValidationReport.Check> checks = report.getChecks().stream()
                .collect(Collectors.toMap(ValidationReport.Check::getName, Function.identity()));
        assertThat(report.isPassed()).isFalse();
        assertThat(report.getFailedChecks()).isEqualTo(7);
        assertThat(checks.get("cost-account-format").getExamples()).containsExactly("KITCHEN");
        assertThat(checks.get("cost-account-known").getExamples()).containsExactly("KITCHEN");
        assertThat(checks.get("split-targets").getExamples()).containsExactly("SPL-BAR");
        assertThat(checks.get("pay-comp-codes").getExamples()).containsExactly("Normal");
        assertThat(checks.get("payroll-employees").getExamples()).containsExactly("E2");
        assertThat(checks.get("timesheet-employees").getExamples()).containsExactly("E3");
        assertThat(checks.get("timesheet-locations").getExamples()).containsExactly("Cairns - Floor");
    }

    @Test
    @DisplayName("Should fail for an unknown period")
    void shouldRejectUnknownPeriod() {
        when(payPeriodRepository.existsById("2099-01-01")).thenReturn(false);

        assertThatThrownBy(() -> dataValidationService.validatePeriod("2099-01-01"))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(mappingRegistryService, payrollDetailLineRepository);
    }
}
