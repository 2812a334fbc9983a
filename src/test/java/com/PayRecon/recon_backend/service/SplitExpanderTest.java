package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.model.CostCenterSplit;
import com.PayRecon.recon_backend.service.snapshot.MappingSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.PayRecon.recon_backend.support.ReconTestData.snapshotWith;
import static com.PayRecon.recon_backend.support.ReconTestData.split;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SplitExpander")
class SplitExpanderTest {

    private SplitExpander splitExpander;
    private MappingSnapshot snapshot;

    @BeforeEach
    void setUp() {
        splitExpander = new SplitExpander(new ReconciliationProperties());
        snapshot = snapshotWith(List.of(), List.of(
                split("SPL-CHEF", "458-50", "0.6"),
                split("SPL-CHEF", "470-60", "0.4")));
    }

    @Test
    @DisplayName("Should spread a virtual account over its targets by weight")
    void shouldExpandVirtualAccount() {
        // Given
        Map<String, BigDecimal> paid = Map.of("SPL-CHEF", new BigDecimal("1000"));

        // When
        Map<String, BigDecimal> expanded = splitExpander.expand(paid, snapshot);

        // Then
        assertThat(expanded).containsOnlyKeys("458-50", "470-60");
        assertThat(expanded.get("458-50")).isEqualByComparingTo("600");
        assertThat(expanded.get("470-60")).isEqualByComparingTo("400");
    }

    @Test
    @DisplayName("Should add split shares to amounts already held by the target")
    void shouldMergeIntoExistingTargets() {
        Map<String, BigDecimal> paid = new TreeMap<>();
        paid.put("458-50", new BigDecimal("250.00"));
        paid.put("SPL-CHEF", new BigDecimal("1000"));

        Map<String, BigDecimal> expanded = splitExpander.expand(paid, snapshot);

        assertThat(expanded.get("458-50")).isEqualByComparingTo("850.00");
        assertThat(expanded.get("470-60")).isEqualByComparingTo("400");
    }

    @Test
    @DisplayName("Should keep a virtual account with no active targets")
    void shouldFailOpenForUnknownSplit() {
        Map<String, BigDecimal> paid = Map.of("SPL-BAR", new BigDecimal("300"), "458-50", new BigDecimal("100"));

        Map<String, BigDecimal> expanded = splitExpander.expand(paid, snapshot);

        assertThat(expanded).containsOnlyKeys("SPL-BAR", "458-50");
        assertThat(expanded.get("SPL-BAR")).isEqualByComparingTo("300");
    }

    @Test
    @DisplayName("Should ignore inactive split targets")
    void shouldIgnoreInactiveTargets() {
        CostCenterSplit inactive = split("SPL-BAR", "458-50", "1");
        inactive.setActive(false);
        MappingSnapshot withInactive = snapshotWith(List.of(), List.of(inactive));

        Map<String, BigDecimal> expanded = splitExpander.expand(Map.of("SPL-BAR", new BigDecimal("300")), withInactive);

        assertThat(expanded).containsOnlyKeys("SPL-BAR");
    }

    @Test
    @DisplayName("Should conserve the total when weights sum to one")
    void shouldConserveTotal() {
        Map<String, BigDecimal> paid = new TreeMap<>();
        paid.put("SPL-CHEF", new BigDecimal("1234.57"));
        paid.put("500-10", new BigDecimal("99.99"));

        Map<String, BigDecimal> expanded = splitExpander.expand(paid, snapshot);

        BigDecimal before = paid.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal after = expanded.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(after).isEqualByComparingTo(before);
    }

    @Test
    @DisplayName("Should leave an already expanded map unchanged")
    void shouldBeIdempotent() {
        Map<String, BigDecimal> once = splitExpander.expand(Map.of("SPL-CHEF", new BigDecimal("1000")), snapshot);

        Map<String, BigDecimal> twice = splitExpander.expand(once, snapshot);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    @DisplayName("Should recognise accounts by the configured prefix")
    void shouldDetectVirtualAccounts() {
        assertThat(splitExpander.isVirtual("SPL-CHEF")).isTrue();
        assertThat(splitExpander.isVirtual("458-50")).isFalse();
        assertThat(splitExpander.isVirtual(null)).isFalse();
    }
}
