package com.normflow.rules.compiler.diagram;

/**
 * A directed sequence flow of the full diagram graph.
 *
 * @param label flow name, or null when the element carries no name attribute
 */
public record DiagramFlow(String id, String sourceId, String targetId, String label) {
}
