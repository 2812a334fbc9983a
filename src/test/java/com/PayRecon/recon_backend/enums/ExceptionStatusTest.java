package com.PayRecon.recon_backend.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExceptionStatus")
class ExceptionStatusTest {

    @Test
    @DisplayName("Should move open items forward only")
    void shouldAllowForwardTransitions() {
        assertThat(ExceptionStatus.OPEN.allowedTransitions())
                .containsExactlyInAnyOrder(ExceptionStatus.UNDER_REVIEW, ExceptionStatus.RESOLVED, ExceptionStatus.ACCEPTED);
        assertThat(ExceptionStatus.UNDER_REVIEW.canTransitionTo(ExceptionStatus.OPEN)).isFalse();
        assertThat(ExceptionStatus.UNDER_REVIEW.canTransitionTo(ExceptionStatus.ACCEPTED)).isTrue();
    }

    @Test
    @DisplayName("Should treat resolved and accepted as final")
    void shouldStopAtTerminalStates() {
        assertThat(ExceptionStatus.RESOLVED.isTerminal()).isTrue();
        assertThat(ExceptionStatus.ACCEPTED.isTerminal()).isTrue();
        assertThat(ExceptionStatus.RESOLVED.allowedTransitions()).isEmpty();
        assertThat(ExceptionStatus.ACCEPTED.canTransitionTo(ExceptionStatus.OPEN)).isFalse();
    }

    @Test
    @DisplayName("Should parse case-insensitively and return null for unknown values")
    void shouldParseLeniently() {
        assertThat(ExceptionStatus.fromString("under_review")).isEqualTo(ExceptionStatus.UNDER_REVIEW);
        assertThat(ExceptionStatus.fromString("closed")).isNull();
    }
}
