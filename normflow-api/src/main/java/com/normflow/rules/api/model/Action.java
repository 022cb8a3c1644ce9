package com.normflow.rules.api.model;

/**
 * An obligation required of an actor.
 */
public record Action(String actor, String name) {
}
