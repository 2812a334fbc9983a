package com.PayRecon.recon_backend.repository;

import com.PayRecon.recon_backend.enums.AllocationSource;
import com.PayRecon.recon_backend.model.AllocationEntry;
import com.PayRecon.recon_backend.model.CostAllocationRule;
import com.PayRecon.recon_backend.model.PayPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("CostAllocationRuleRepository")
class CostAllocationRuleRepositoryTest {

    private static final String PERIOD = "2025-11-30";

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private CostAllocationRuleRepository costAllocationRuleRepository;

    private PayPeriod period;

    @BeforeEach
    void setUp() {
        period = entityManager.persist(PayPeriod.builder()
                .periodId(PERIOD)
                .periodStart(LocalDate.of(2025, 11, 17))
                .periodEnd(LocalDate.of(2025, 11, 30))
                .build());

        entityManager.persist(rule("E1", AllocationSource.DEFAULT, Map.of("458-50", "100")));
        entityManager.persist(rule("E2", AllocationSource.OVERRIDE, Map.of("458-50", "60", "470-60", "40")));
        entityManager.persist(rule("E3", AllocationSource.DERIVED, Map.of("470-60", "100")));
        entityManager.flush();
        entityManager.clear();
    }

    @Test
    @DisplayName("Should read allocations back from their JSON column")
    void shouldRoundTripAllocations() {
        CostAllocationRule rule = costAllocationRuleRepository.findByPeriodIdAndEmployeeCode(PERIOD, "E2").orElseThrow();

        assertThat(rule.getSource()).isEqualTo(AllocationSource.OVERRIDE);
        assertThat(rule.getAllocations()).containsOnlyKeys("458-50", "470-60");
        AllocationEntry kitchen = rule.getAllocations().get("458-50");
        assertThat(kitchen.getPercentage()).isEqualByComparingTo("60");
        assertThat(kitchen.getSource()).isEqualTo(AllocationSource.OVERRIDE);
        assertThat(rule.isValid()).isTrue();
        assertThat(rule.getValidationErrors()).isEmpty();
    }

    @Test
    @DisplayName("Should filter by source only when one is given")
    void shouldFilterBySource() {
        assertThat(costAllocationRuleRepository.findByPeriodId(PERIOD, null))
                .extracting(CostAllocationRule::getEmployeeCode)
                .containsExactly("E1", "E2", "E3");
        assertThat(costAllocationRuleRepository.findByPeriodId(PERIOD, AllocationSource.DERIVED))
                .extracting(CostAllocationRule::getEmployeeCode)
                .containsExactly("E3");
    }

    @Test
    @DisplayName("Should delete only the rules of the given source")
    void shouldDeleteBySource() {
        int deleted = costAllocationRuleRepository.deleteByPeriodIdAndSource(PERIOD, AllocationSource.DEFAULT);

        assertThat(deleted).isEqualTo(1);
        List<CostAllocationRule> remaining = costAllocationRuleRepository.findByPeriodId(PERIOD, null);
        assertThat(remaining)
                .extracting(CostAllocationRule::getSource)
                .containsExactly(AllocationSource.OVERRIDE, AllocationSource.DERIVED);
    }

    private CostAllocationRule rule(String employeeCode, AllocationSource source, Map<String, String> percentages) {
        Map<String, AllocationEntry> allocations = new TreeMap<>();
        percentages.forEach((account, percentage) -> allocations.put(account, AllocationEntry.builder()
                .percentage(new BigDecimal(percentage))
                .source(source)
                .build()));
        return CostAllocationRule.builder()
                .payPeriod(period)
                .employeeCode(employeeCode)
                .source(source)
                .allocations(allocations)
                .totalPercentage(new BigDecimal("100"))
                .valid(true)
                .build();
    }
}
