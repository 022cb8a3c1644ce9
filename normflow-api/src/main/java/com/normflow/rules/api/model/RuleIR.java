package com.normflow.rules.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Format-agnostic representation of one rule: if all {@code conditions} hold then all
 * {@code actions} are obligatory. One instance is produced per enumerated scenario and
 * exporters consume nothing else.
 */
public record RuleIR(String id, List<Condition> conditions, List<Action> actions) {

    public RuleIR {
        Objects.requireNonNull(id, "id");
        conditions = List.copyOf(conditions);
        actions = List.copyOf(actions);
    }

    public boolean isObligationFree() {
        return actions.isEmpty();
    }
}
