package com.normflow.rules.api.model;

/**
 * One link of the superiority chain: {@code higherRuleId} overrides {@code lowerRuleId}.
 */
public record Precedence(String higherRuleId, String lowerRuleId) {
}
