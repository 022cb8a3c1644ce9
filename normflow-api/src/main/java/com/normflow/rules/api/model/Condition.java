package com.normflow.rules.api.model;

/**
 * A decision outcome taken on a scenario: {@code actor.predicate == value}.
 */
public record Condition(String actor, String predicate, boolean value) {
}
