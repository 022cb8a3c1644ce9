package com.normflow.rules.export;

import java.util.regex.Pattern;

/**
 * Text helpers shared by the exporters.
 */
public final class ExportText {

    public static final String UNNAMED = "unnamed";

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ID = Pattern.compile("[^A-Za-z0-9_\\-.]");

    private ExportText() {
    }

    /**
     * Turns free text into a logic atom: punctuation removed, whitespace runs joined with
     * {@code _}, and {@value #UNNAMED} when nothing is left.
     */
    public static String toSymbol(String text) {
        String cleaned = text == null ? "" : text.replace('\n', ' ').strip();
        cleaned = PUNCTUATION.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll("_");
        return cleaned.isEmpty() ? UNNAMED : cleaned;
    }

    /**
     * Restricts a rule id to characters that are safe in an XML key attribute.
     */
    public static String toXmlId(String id) {
        String stripped = id == null ? "" : id.strip();
        String safe = NON_ID.matcher(stripped).replaceAll("_");
        return safe.isEmpty() ? UNNAMED : safe;
    }

    public static String escapeXml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }

    static String pad(int indent) {
        return " ".repeat(indent);
    }
}
