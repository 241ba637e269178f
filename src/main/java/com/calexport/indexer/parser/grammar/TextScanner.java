package com.calexport.indexer.parser.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Character-level helpers shared by the grammars: nesting-aware splitting and index search.
 *
 * Double-quoted identifiers are always opaque. Single-quoted strings are only opaque in code
 * contexts; in property values an apostrophe is ordinary text ({@code ENU=Customer's Name}).
 */
@UtilityClass
public class TextScanner {

    public static final char BOM = '\uFEFF';

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    public static String stripBom(String text) {
        if (text != null && !text.isEmpty() && text.charAt(0) == BOM) {
            return text.substring(1);
        }
        return text;
    }

    public static String collapseWhitespace(String text) {
        return text == null ? null : WHITESPACE_RUN.matcher(text.trim()).replaceAll(" ");
    }

    /**
     * Removes one pair of surrounding double quotes.
     */
    public static String unquote(String text) {
        if (text == null) {
            return null;
        }
        String t = text.trim();
        if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) {
            return t.substring(1, t.length() - 1);
        }
        return t;
    }

    /**
     * First index of {@code target} at nesting depth zero, or -1.
     */
    public static int indexOfTopLevel(String text, char target, int from, boolean codeQuotes) {
        int depth = 0;
        boolean inDouble = false;
        boolean inSingle = false;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inDouble) {
                inDouble = c != '"';
                continue;
            }
            if (inSingle) {
                inSingle = c != '\'';
                continue;
            }
            if (c == target && depth == 0) {
                return i;
            }
            switch (c) {
                case '"' -> inDouble = true;
                case '\'' -> inSingle = codeQuotes;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth = Math.max(0, depth - 1);
                default -> {
                    // plain character
                }
            }
        }
        return -1;
    }

    /**
     * Splits on {@code separator} at nesting depth zero. Pieces are returned untrimmed; a trailing
     * empty piece is dropped.
     */
    public static List<String> splitTopLevel(String text, char separator, boolean codeQuotes) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        while (start <= text.length()) {
            int idx = indexOfTopLevel(text, separator, start, codeQuotes);
            if (idx < 0) {
                String tail = text.substring(start);
                if (!tail.isBlank()) {
                    parts.add(tail);
                }
                break;
            }
            parts.add(text.substring(start, idx));
            start = idx + 1;
        }
        return parts;
    }

    /**
     * Index of the bracket closing the one at {@code openIndex}, skipping quoted text, or -1.
     */
    public static int matchingClose(String text, int openIndex, boolean codeQuotes) {
        char open = text.charAt(openIndex);
        char close = switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            default -> throw new IllegalArgumentException("Not an opening bracket: " + open);
        };
        int depth = 0;
        boolean inDouble = false;
        boolean inSingle = false;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inDouble) {
                inDouble = c != '"';
                continue;
            }
            if (inSingle) {
                inSingle = c != '\'';
                continue;
            }
            if (c == '"') {
                inDouble = true;
            } else if (c == '\'' && codeQuotes) {
                inSingle = true;
            } else if (c == open) {
                depth++;
            } else if (c == close && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Decimal digits (optionally signed) as an int, or null when the value does not fit.
     */
    public static Integer toInt(String digits) {
        long value = Long.parseLong(digits.trim());
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? Integer.valueOf((int) value) : null;
    }

    /**
     * Zero-based column of {@code index} within its line.
     */
    public static int columnOf(String text, int index) {
        int lineStart = text.lastIndexOf('\n', index - 1) + 1;
        return index - lineStart;
    }
}
