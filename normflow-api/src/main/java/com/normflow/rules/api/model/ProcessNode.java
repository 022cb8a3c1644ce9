package com.normflow.rules.api.model;

import java.util.Objects;

/**
 * A node of the process diagram. Identity is the element id.
 */
public record ProcessNode(String id, NodeKind kind, String label) {

    public ProcessNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        label = label != null ? label : "";
    }
}
