package com.normflow.rules.compiler.enumeration;

import java.util.regex.Pattern;

/**
 * Splits free-text node labels into an actor and a predicate or action name.
 *
 * <p>The first whitespace-separated token is the actor; the rest, with all whitespace
 * removed, is the predicate or action. Labels with a single token fall back to the
 * placeholder actor {@value #PLACEHOLDER_ACTOR} and a punctuation-free symbol.
 *
 * <p>Splitting is idempotent: re-splitting {@code actor + " " + symbol} gives back the same
 * pair.
 */
public final class LabelNormalizer {

    public static final String PLACEHOLDER_ACTOR = "x";
    public static final String UNNAMED = "unnamed";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern TRAILING_QUESTION_MARKS = Pattern.compile("[?\\s]+$");

    private LabelNormalizer() {
    }

    /**
     * Splits a decision label such as {@code "AIsystem generates content?"} into
     * {@code ("AIsystem", "generatescontent")}. Trailing question marks are dropped.
     */
    public static SplitLabel splitCondition(String label) {
        String text = TRAILING_QUESTION_MARKS.matcher(clean(label)).replaceFirst("");
        return split(text);
    }

    /**
     * Splits an obligation label such as {@code "AIprovider mark content"} into
     * {@code ("AIprovider", "markcontent")}.
     */
    public static SplitLabel splitAction(String label) {
        return split(clean(label));
    }

    private static String clean(String label) {
        return label == null ? "" : label.replace('\n', ' ').strip();
    }

    private static SplitLabel split(String text) {
        String[] parts = WHITESPACE.split(text, 2);
        if (parts.length == 2 && !parts[0].isEmpty()) {
            return new SplitLabel(parts[0], WHITESPACE.matcher(parts[1]).replaceAll(""), false);
        }
        String symbol = WHITESPACE.matcher(PUNCTUATION.matcher(text).replaceAll("")).replaceAll("");
        return new SplitLabel(PLACEHOLDER_ACTOR, symbol.isEmpty() ? UNNAMED : symbol, true);
    }

    /**
     * Result of splitting one label.
     *
     * @param actor    subject of the condition or action
     * @param symbol   predicate or action name without whitespace
     * @param fallback true when the label had no actor part and the placeholder was used
     */
    public record SplitLabel(String actor, String symbol, boolean fallback) {
    }
}
