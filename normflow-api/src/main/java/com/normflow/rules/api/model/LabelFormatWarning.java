package com.normflow.rules.api.model;

/**
 * Records a label that had no whitespace-separable actor part and was normalized with the
 * placeholder actor. Never fatal.
 *
 * @param role   whether the label came from a decision or an obligation node
 * @param label  the raw label
 * @param actor  the placeholder actor used
 * @param symbol the normalized predicate or action name
 */
public record LabelFormatWarning(Role role, String label, String actor, String symbol) {

    public enum Role {
        CONDITION,
        ACTION
    }
}
