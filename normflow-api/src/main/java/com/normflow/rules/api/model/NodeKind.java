package com.normflow.rules.api.model;

/**
 * Normative role of a diagram node.
 */
public enum NodeKind {
    ENTRY,
    EXIT,
    DECISION,
    OBLIGATION,
    OTHER;

    /**
     * Entry, exit and decision nodes survive reduction; everything else is collapsed
     * into reduced edges.
     */
    public boolean isKept() {
        return this == ENTRY || this == EXIT || this == DECISION;
    }
}
