package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.enums.AllocationSource;
import com.PayRecon.recon_backend.model.AllocationEntry;
import com.PayRecon.recon_backend.model.PayrollDetailLine;
import com.PayRecon.recon_backend.model.TimesheetShift;
import com.PayRecon.recon_backend.service.snapshot.MappingSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.PayRecon.recon_backend.support.ReconTestData.location;
import static com.PayRecon.recon_backend.support.ReconTestData.payLine;
import static com.PayRecon.recon_backend.support.ReconTestData.shift;
import static com.PayRecon.recon_backend.support.ReconTestData.snapshotWith;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AllocationCalculator")
class AllocationCalculatorTest {

    private AllocationCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new AllocationCalculator(new ReconciliationProperties());
    }

    @Nested
    @DisplayName("Default allocations from payroll")
    class FromPayroll {

        @Test
        @DisplayName("Should split by cost account and ignore tax and net pay")
        void shouldAllocateByCostAccount() {
            List<PayrollDetailLine> lines = List.of(
                    payLine("E1", "458-50", "Hours By Rate", "30", "750"),
                    payLine("E1", "470-60", "Hours By Rate", "10", "250"),
                    payLine("E1", "458-50", "Tax", "0", "300"),
                    payLine("E1", "458-50", "Net Pay", "0", "700"));

            Optional<Map<String, AllocationEntry>> allocations = calculator.fromPayroll(lines);

            assertThat(allocations).isPresent();
            assertThat(allocations.get()).containsOnlyKeys("458-50", "470-60");
            AllocationEntry kitchen = allocations.get().get("458-50");
            assertThat(kitchen.getPercentage()).isEqualByComparingTo("75.00");
            assertThat(kitchen.getAmount()).isEqualByComparingTo("750.00");
            assertThat(kitchen.getHours()).isEqualByComparingTo("30.00");
            assertThat(kitchen.getSource()).isEqualTo(AllocationSource.DEFAULT);
            assertThat(allocations.get().get("470-60").getPercentage()).isEqualByComparingTo("25.00");
        }

        @Test
        @DisplayName("Should produce nothing when the paid total is zero")
        void shouldSkipZeroTotal() {
            List<PayrollDetailLine> lines = List.of(payLine("E1", "458-50", "Tax", "0", "300"));

            assertThat(calculator.fromPayroll(lines)).isEmpty();
        }

        @Test
        @DisplayName("Should exclude tax and net pay from the allocatable total")
        void shouldComputeAllocatableTotal() {
            List<PayrollDetailLine> lines = List.of(
                    payLine("E1", "458-50", "Hours By Rate", "38", "950"),
                    payLine("E1", "458-50", "Super", "0", "114"),
                    payLine("E1", "458-50", "Tax", "0", "200"));

            assertThat(calculator.allocatableTotal(lines)).isEqualByComparingTo("1064");
        }
    }

    @Nested
    @DisplayName("Derived allocations from timesheets")
    class FromShifts {

        private final MappingSnapshot snapshot = snapshotWith(List.of(
                location("Brisbane - Kitchen", "458-50"),
                location("Brisbane - Kitchen Prep", "458-50"),
                location("Gold Coast - Bar", "470-60")), List.of());

        @Test
        @DisplayName("Should sum composites that resolve to the same account")
        void shouldMergeSameAccount() {
            List<TimesheetShift> shifts = List.of(
                    shift("E1", "Brisbane", "Kitchen", "20", "500"),
                    shift("E1", "Brisbane", "Kitchen Prep", "10", "250"),
                    shift("E1", "Gold Coast", "Bar", "10", "250"));

            AllocationCalculator.DerivedAllocation derived = calculator.fromShifts(shifts, snapshot);

            assertThat(derived.getUnmappedLocations()).isEmpty();
            assertThat(derived.getAllocations()).containsOnlyKeys("458-50", "470-60");
            AllocationEntry kitchen = derived.getAllocations().get("458-50");
            assertThat(kitchen.getPercentage()).isEqualByComparingTo("75.00");
            assertThat(kitchen.getAmount()).isEqualByComparingTo("750.00");
            assertThat(kitchen.getHours()).isEqualByComparingTo("30.00");
            assertThat(kitchen.getSource()).isEqualTo(AllocationSource.DERIVED);
        }

        @Test
        @DisplayName("Should report unmapped locations and leave them out of the base")
        void shouldExcludeUnmappedLocations() {
            List<TimesheetShift> shifts = List.of(
                    shift("E1", "Brisbane", "Kitchen", "20", "500"),
                    shift("E1", "Cairns", "Floor", "20", "500"));

            AllocationCalculator.DerivedAllocation derived = calculator.fromShifts(shifts, snapshot);

            assertThat(derived.getUnmappedLocations()).containsExactly("Cairns - Floor");
            assertThat(derived.getAllocations().get("458-50").getPercentage()).isEqualByComparingTo("100.00");
            assertThat(derived.getTotalCost()).isEqualByComparingTo("500.00");
        }

        @Test
        @DisplayName("Should be empty when nothing resolves")
        void shouldBeEmptyWhenNothingMaps() {
            AllocationCalculator.DerivedAllocation derived = calculator.fromShifts(
                    List.of(shift("E1", "Cairns", "Floor", "8", "200")), snapshot);

            assertThat(derived.isEmpty()).isTrue();
            assertThat(derived.getUnmappedLocations()).containsExactly("Cairns - Floor");
        }
    }

    @Test
    @DisplayName("Should price override percentages against the paid total")
    void shouldBuildOverrideAmounts() {
        Map<String, AllocationEntry> allocations = calculator.fromOverride(
                Map.of("458-50", new BigDecimal("60"), "470-60", new BigDecimal("40")), new BigDecimal("1500"));

        assertThat(allocations.get("458-50").getAmount()).isEqualByComparingTo("900.00");
        assertThat(allocations.get("470-60").getAmount()).isEqualByComparingTo("600.00");
        assertThat(allocations.values()).allMatch(entry -> entry.getSource() == AllocationSource.OVERRIDE);
        assertThat(AllocationCalculator.percentages(allocations))
                .containsEntry("458-50", new BigDecimal("60.00"))
                .containsEntry("470-60", new BigDecimal("40.00"));
    }
}
