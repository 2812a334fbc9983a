package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.dto.request.AllocationOverrideRequest;
import com.PayRecon.recon_backend.dto.response.AllocationBuildSummary;
import com.PayRecon.recon_backend.dto.response.CostAllocationRuleResponse;
import com.PayRecon.recon_backend.enums.AllocationSource;
import com.PayRecon.recon_backend.exception.ApiException;
import com.PayRecon.recon_backend.exception.DataUnavailableException;
import com.PayRecon.recon_backend.exception.ValidationException;
import com.PayRecon.recon_backend.model.CostAllocationRule;
import com.PayRecon.recon_backend.model.PayPeriod;
import com.PayRecon.recon_backend.repository.CostAllocationRuleRepository;
import com.PayRecon.recon_backend.repository.PayPeriodRepository;
import com.PayRecon.recon_backend.repository.PayrollDetailLineRepository;
import com.PayRecon.recon_backend.repository.TimesheetShiftRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.PayRecon.recon_backend.support.ReconTestData.location;
import static com.PayRecon.recon_backend.support.ReconTestData.payLine;
import static com.PayRecon.recon_backend.support.ReconTestData.shift;
import static com.PayRecon.recon_backend.support.ReconTestData.snapshotWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CostAllocationService")
class CostAllocationServiceTest {

    private static final String PERIOD = "2025-11-30";

    @Mock
    private CostAllocationRuleRepository costAllocationRuleRepository;

    @Mock
    private PayPeriodRepository payPeriodRepository;

    @Mock
    private PayrollDetailLineRepository payrollDetailLineRepository;

    @Mock
    private TimesheetShiftRepository timesheetShiftRepository;

    @Mock
    private MappingRegistryService mappingRegistryService;

    @Mock
    private TransactionTemplate transactionTemplate;

    @Captor
    private ArgumentCaptor<List<CostAllocationRule>> rulesCaptor;

    private CostAllocationService costAllocationService;
    private PayPeriod period;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        costAllocationService = new CostAllocationService(
                costAllocationRuleRepository,
                payPeriodRepository,
                payrollDetailLineRepository,
                timesheetShiftRepository,
                mappingRegistryService,
                new AllocationCalculator(properties),
                new AllocationValidator(properties),
                new PeriodLockService(properties),
                transactionTemplate);

        period = PayPeriod.builder()
                .periodId(PERIOD)
                .periodStart(LocalDate.of(2025, 11, 17))
                .periodEnd(LocalDate.of(2025, 11, 30))
                .build();
    }

    private void runTransactionsInline() {
        when(transactionTemplate.execute(any())).thenAnswer(invocation ->
                invocation.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
    }

    @Nested
    @DisplayName("buildAllocations")
    class BuildAllocations {

        @Test
        @DisplayName("Should rebuild default rules and keep existing overrides")
        void shouldBuildDefaultsAndPreserveOverrides() {
            // Given
            runTransactionsInline();
            when(payPeriodRepository.findById(PERIOD)).thenReturn(Optional.of(period));
            when(payrollDetailLineRepository.findByPeriodId(PERIOD)).thenReturn(List.of(
                    payLine("E1", "458-50", "Hours By Rate", "30", "750"),
                    payLine("E1", "470-60", "Hours By Rate", "10", "250"),
                    payLine("E2", "458-50", "Hours By Rate", "38", "950")));
            CostAllocationRule override = CostAllocationRule.builder()
                    .payPeriod(period)
                    .employeeCode("E2")
                    .source(AllocationSource.OVERRIDE)
                    .build();
            when(costAllocationRuleRepository.findByPeriodId(PERIOD, null)).thenReturn(List.of(override));
            when(costAllocationRuleRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            AllocationBuildSummary summary = costAllocationService.buildAllocations(PERIOD, AllocationSource.DEFAULT);

            // Then
            verify(costAllocationRuleRepository).deleteByPeriodIdAndSource(PERIOD, AllocationSource.DEFAULT);
            verify(costAllocationRuleRepository).saveAll(rulesCaptor.capture());
            assertThat(rulesCaptor.getValue()).singleElement()
                    .satisfies(rule -> {
                        assertThat(rule.getEmployeeCode()).isEqualTo("E1");
                        assertThat(rule.getSource()).isEqualTo(AllocationSource.DEFAULT);
                        assertThat(rule.isValid()).isTrue();
                        assertThat(rule.getAllocations().get("458-50").getPercentage()).isEqualByComparingTo("75.00");
                    });
            assertThat(summary.getRulesCreated()).isEqualTo(1);
            assertThat(summary.getValidRules()).isEqualTo(1);
            assertThat(summary.getPreservedEmployees()).containsExactly("E2");
        }

        @Test
        @DisplayName("Should report unmapped locations when deriving from timesheets")
        void shouldRecordMappingErrors() {
            runTransactionsInline();
            when(payPeriodRepository.findById(PERIOD)).thenReturn(Optional.of(period));
            when(timesheetShiftRepository.findByPeriodId(PERIOD)).thenReturn(List.of(
                    shift("E1", "Brisbane", "Kitchen", "20", "500"),
                    shift("E1", "Cairns", "Floor", "5", "125"),
                    shift("E3", "Cairns", "Floor", "8", "200")));
            when(mappingRegistryService.loadSnapshot())
                    .thenReturn(snapshotWith(List.of(location("Brisbane - Kitchen", "458-50")), List.of()));
            when(costAllocationRuleRepository.findByPeriodId(PERIOD, null)).thenReturn(List.of());
            when(costAllocationRuleRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

            AllocationBuildSummary summary = costAllocationService.buildAllocations(PERIOD, AllocationSource.DERIVED);

            assertThat(summary.getRulesCreated()).isEqualTo(1);
            assertThat(summary.getEmployeesWithoutAllocation()).isEqualTo(1);
            assertThat(summary.getMappingErrors())
                    .containsEntry("E1", List.of("Cairns - Floor"))
                    .containsEntry("E3", List.of("Cairns - Floor"));
        }

        @Test
        @DisplayName("Should refuse to build without payroll data and leave existing rules alone")
        void shouldFailWithoutPayroll() {
            runTransactionsInline();
            when(payPeriodRepository.findById(PERIOD)).thenReturn(Optional.of(period));
            when(payrollDetailLineRepository.findByPeriodId(PERIOD)).thenReturn(List.of());

            assertThatThrownBy(() -> costAllocationService.buildAllocations(PERIOD, AllocationSource.DEFAULT))
                    .isInstanceOf(DataUnavailableException.class)
                    .hasMessageContaining(PERIOD);
            verify(costAllocationRuleRepository, never()).deleteByPeriodIdAndSource(any(), any());
        }

        @Test
        @DisplayName("Should not build override rules")
        void shouldRejectOverrideSource() {
            assertThatThrownBy(() -> costAllocationService.buildAllocations(PERIOD, AllocationSource.OVERRIDE))
                    .isInstanceOf(ApiException.class)
                    .extracting(e -> ((ApiException) e).getErrorCode())
                    .isEqualTo("INVALID_ALLOCATION_SOURCE");
            verifyNoInteractions(transactionTemplate, costAllocationRuleRepository);
        }
    }

    @Nested
    @DisplayName("applyOverride")
    class ApplyOverride {

        @Test
        @DisplayName("Should replace a default rule and price the override from paid gross")
        void shouldReplaceDefaultRule() {
            runTransactionsInline();
            when(payPeriodRepository.findById(PERIOD)).thenReturn(Optional.of(period));
            when(payrollDetailLineRepository.findByPeriodId(PERIOD)).thenReturn(List.of(
                    payLine("E1", "458-50", "Hours By Rate", "40", "1500"),
                    payLine("E1", "458-50", "Tax", "0", "400"),
                    payLine("E2", "458-50", "Hours By Rate", "38", "950")));
            CostAllocationRule existing = CostAllocationRule.builder()
                    .payPeriod(period)
                    .employeeCode("E1")
                    .employeeName("Employee E1")
                    .source(AllocationSource.DEFAULT)
                    .build();
            when(costAllocationRuleRepository.findByPeriodIdAndEmployeeCode(PERIOD, "E1")).thenReturn(Optional.of(existing));
            when(costAllocationRuleRepository.save(any(CostAllocationRule.class))).thenAnswer(invocation -> invocation.getArgument(0));

            AllocationOverrideRequest request = new AllocationOverrideRequest(
                    Map.of("458-50", new BigDecimal("60"), "470-60", new BigDecimal("40")), null);

            CostAllocationRuleResponse response = costAllocationService.applyOverride(PERIOD, "E1", request);

            assertThat(response.getSource()).isEqualTo(AllocationSource.OVERRIDE);
            assertThat(response.isValid()).isTrue();
            assertThat(response.getUpdatedBy()).isEqualTo("system");
            assertThat(response.getAllocations().get("458-50").getAmount()).isEqualByComparingTo("900.00");
            assertThat(response.getAllocations().get("470-60").getAmount()).isEqualByComparingTo("600.00");
        }

        @Test
        @DisplayName("Should store an override that does not total 100% as invalid")
        void shouldFlagInvalidOverride() {
            runTransactionsInline();
            when(payPeriodRepository.findById(PERIOD)).thenReturn(Optional.of(period));
            when(payrollDetailLineRepository.findByPeriodId(PERIOD)).thenReturn(List.of());
            when(costAllocationRuleRepository.findByPeriodIdAndEmployeeCode(PERIOD, "E9")).thenReturn(Optional.empty());
            when(costAllocationRuleRepository.save(any(CostAllocationRule.class))).thenAnswer(invocation -> invocation.getArgument(0));

            AllocationOverrideRequest request = new AllocationOverrideRequest(
                    Map.of("458-50", new BigDecimal("50")), "payroll.officer");

            CostAllocationRuleResponse response = costAllocationService.applyOverride(PERIOD, "E9", request);

            assertThat(response.isValid()).isFalse();
            assertThat(response.getValidationErrors()).containsExactly("Allocations sum to 50.00%, not 100%");
            assertThat(response.getUpdatedBy()).isEqualTo("payroll.officer");
        }

        @Test
        @DisplayName("Should reject negative percentages before touching the period")
        void shouldRejectNegativePercentages() {
            AllocationOverrideRequest request = new AllocationOverrideRequest(
                    Map.of("458-50", new BigDecimal("120"), "470-60", new BigDecimal("-20")), null);

            assertThatThrownBy(() -> costAllocationService.applyOverride(PERIOD, "E1", request))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(transactionTemplate, costAllocationRuleRepository);
        }
    }
}
