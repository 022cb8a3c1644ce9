/*
 * Copyright (c) 2025 NormFlow Rule Generator
 * Licensed under the Apache License, Version 2.0
 */
package com.normflow.rules.compiler;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Tunables of the compilation pipeline.
 *
 * Configuration via environment variables (system properties of the same name win when the
 * variable is unset):
 * - NORMFLOW_AFFIRMATIVE_LABEL: branch label that makes a condition true (default: Yes)
 * - NORMFLOW_NEGATIVE_LABEL: branch label that makes a condition false (default: No)
 * - NORMFLOW_BRANCH_POLICY: lenient|strict (default: lenient)
 * - NORMFLOW_COLLECT_PATHS: keep the full path listing in the result (default: true)
 * - NORMFLOW_OBLIGATION_ELEMENTS: comma-separated element names read as obligations (default: task)
 *
 * @param affirmativeLabel   exact branch label read as {@code true}
 * @param negativeLabel      exact branch label read as {@code false}
 * @param branchLabelPolicy  treatment of any other decision branch label
 * @param collectPaths       whether enumerated paths are retained next to the rules
 * @param obligationElements diagram element names parsed as obligation nodes
 */
public record CompilerOptions(
        String affirmativeLabel,
        String negativeLabel,
        BranchLabelPolicy branchLabelPolicy,
        boolean collectPaths,
        Set<String> obligationElements
) {
    private static final Logger logger = Logger.getLogger(CompilerOptions.class.getName());

    public static final String DEFAULT_AFFIRMATIVE_LABEL = "Yes";
    public static final String DEFAULT_NEGATIVE_LABEL = "No";
    public static final Set<String> DEFAULT_OBLIGATION_ELEMENTS = Set.of("task");

    public CompilerOptions {
        Objects.requireNonNull(affirmativeLabel, "affirmativeLabel");
        Objects.requireNonNull(negativeLabel, "negativeLabel");
        Objects.requireNonNull(branchLabelPolicy, "branchLabelPolicy");
        if (affirmativeLabel.equals(negativeLabel)) {
            throw new IllegalArgumentException(
                    "Affirmative and negative branch labels must differ, got: " + affirmativeLabel);
        }
        if (obligationElements == null || obligationElements.isEmpty()) {
            throw new IllegalArgumentException("At least one obligation element name is required");
        }
        obligationElements = Collections.unmodifiableSet(new LinkedHashSet<>(obligationElements));
    }

    public static CompilerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the options from the environment, falling back to system properties and then
     * to the defaults.
     */
    public static CompilerOptions fromEnvironment() {
        Builder builder = builder()
                .affirmativeLabel(getEnvOrProperty("NORMFLOW_AFFIRMATIVE_LABEL", DEFAULT_AFFIRMATIVE_LABEL))
                .negativeLabel(getEnvOrProperty("NORMFLOW_NEGATIVE_LABEL", DEFAULT_NEGATIVE_LABEL))
                .collectPaths(Boolean.parseBoolean(getEnvOrProperty("NORMFLOW_COLLECT_PATHS", "true")));

        String policy = getEnvOrProperty("NORMFLOW_BRANCH_POLICY", "lenient");
        try {
            builder.branchLabelPolicy(BranchLabelPolicy.fromString(policy));
        } catch (IllegalArgumentException e) {
            logger.warning("Invalid NORMFLOW_BRANCH_POLICY '" + policy + "', using lenient");
        }

        String elements = getEnvOrProperty("NORMFLOW_OBLIGATION_ELEMENTS", "");
        if (!elements.isBlank()) {
            builder.obligationElements(Arrays.stream(elements.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .affirmativeLabel(affirmativeLabel)
                .negativeLabel(negativeLabel)
                .branchLabelPolicy(branchLabelPolicy)
                .collectPaths(collectPaths)
                .obligationElements(obligationElements);
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }

    public static final class Builder {
        private String affirmativeLabel = DEFAULT_AFFIRMATIVE_LABEL;
        private String negativeLabel = DEFAULT_NEGATIVE_LABEL;
        private BranchLabelPolicy branchLabelPolicy = BranchLabelPolicy.LENIENT;
        private boolean collectPaths = true;
        private Set<String> obligationElements = DEFAULT_OBLIGATION_ELEMENTS;

        private Builder() {
        }

        public Builder affirmativeLabel(String affirmativeLabel) {
            this.affirmativeLabel = affirmativeLabel;
            return this;
        }

        public Builder negativeLabel(String negativeLabel) {
            this.negativeLabel = negativeLabel;
            return this;
        }

        public Builder branchLabelPolicy(BranchLabelPolicy branchLabelPolicy) {
            this.branchLabelPolicy = branchLabelPolicy;
            return this;
        }

        public Builder collectPaths(boolean collectPaths) {
            this.collectPaths = collectPaths;
            return this;
        }

        public Builder obligationElements(Set<String> obligationElements) {
            this.obligationElements = obligationElements;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(affirmativeLabel, negativeLabel, branchLabelPolicy,
                    collectPaths, obligationElements);
        }
    }
}
