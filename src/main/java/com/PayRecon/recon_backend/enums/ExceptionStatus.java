package com.PayRecon.recon_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review workflow of a reconciliation exception. RESOLVED and ACCEPTED are terminal.
 */
public enum ExceptionStatus {
    OPEN,
    UNDER_REVIEW,
    RESOLVED,
    ACCEPTED;

    public Set<ExceptionStatus> allowedTransitions() {
        switch (this) {
            case OPEN:
                return EnumSet.of(UNDER_REVIEW, RESOLVED, ACCEPTED);
            case UNDER_REVIEW:
                return EnumSet.of(RESOLVED, ACCEPTED);
            default:
                return EnumSet.noneOf(ExceptionStatus.class);
        }
    }

    public boolean canTransitionTo(ExceptionStatus target) {
        return target != null && allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == ACCEPTED;
    }

    @JsonCreator
    public static ExceptionStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            // Accept both uppercase and lowercase
            return ExceptionStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String toValue() {
        return this.name();
    }
}
