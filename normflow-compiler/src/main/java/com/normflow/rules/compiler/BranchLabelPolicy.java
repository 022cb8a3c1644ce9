package com.normflow.rules.compiler;

/**
 * How decision branches whose label is neither the affirmative nor the negative token are
 * treated during rule synthesis.
 */
public enum BranchLabelPolicy {
    /** Unrecognized branch labels contribute no condition to the rule. */
    LENIENT,
    /** Unrecognized branch labels abort the compilation with a structural error. */
    STRICT;

    public static BranchLabelPolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return LENIENT;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
