package com.PayRecon.recon_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a cost allocation rule.
 * <ul>
 *     <li>DEFAULT - built from the payroll detail report</li>
 *     <li>DERIVED - built from timesheet locations through the location mapping</li>
 *     <li>OVERRIDE - entered by a user</li>
 * </ul>
 */
public enum AllocationSource {
    DEFAULT("default"),
    DERIVED("derived"),
    OVERRIDE("override");

    private final String tag;

    AllocationSource(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Whether a rule built from this source may replace an existing rule of the given source.
     * Overrides replace anything; built rules never replace an override.
     */
    public boolean canReplace(AllocationSource existing) {
        if (existing == null || this == OVERRIDE) {
            return true;
        }
        return existing != OVERRIDE;
    }

    public boolean isBuilt() {
        return this != OVERRIDE;
    }

    @JsonCreator
    public static AllocationSource fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String input = value.trim();
        for (AllocationSource source : values()) {
            if (source.tag.equalsIgnoreCase(input) || source.name().equalsIgnoreCase(input)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown allocation source: " + value);
    }

    @JsonValue
    public String toValue() {
        return this.name();
    }
}
