package com.PayRecon.recon_backend.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AllocationSource")
class AllocationSourceTest {

    @Test
    @DisplayName("Should never let a built rule replace an override")
    void shouldProtectOverrides() {
        assertThat(AllocationSource.DEFAULT.canReplace(AllocationSource.OVERRIDE)).isFalse();
        assertThat(AllocationSource.DERIVED.canReplace(AllocationSource.OVERRIDE)).isFalse();
        assertThat(AllocationSource.OVERRIDE.canReplace(AllocationSource.OVERRIDE)).isTrue();
    }

    @Test
    @DisplayName("Should let built rules replace each other")
    void shouldReplaceBuiltRules() {
        assertThat(AllocationSource.DEFAULT.canReplace(AllocationSource.DERIVED)).isTrue();
        assertThat(AllocationSource.DERIVED.canReplace(AllocationSource.DEFAULT)).isTrue();
        assertThat(AllocationSource.DEFAULT.canReplace(null)).isTrue();
        assertThat(AllocationSource.OVERRIDE.canReplace(AllocationSource.DEFAULT)).isTrue();
    }

    @Test
    @DisplayName("Should parse tags and names in any case")
    void shouldParse() {
        assertThat(AllocationSource.fromString("derived")).isEqualTo(AllocationSource.DERIVED);
        assertThat(AllocationSource.fromString(" DEFAULT ")).isEqualTo(AllocationSource.DEFAULT);
        assertThat(AllocationSource.fromString("")).isNull();
        assertThatThrownBy(() -> AllocationSource.fromString("manual"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("manual");
    }
}
