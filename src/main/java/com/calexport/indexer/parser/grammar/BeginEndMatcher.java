package com.calexport.indexer.parser.grammar;

import lombok.experimental.UtilityClass;

/**
 * Finds the END closing a BEGIN in C/AL code. BEGIN and CASE open a block, END closes one;
 * string literals, quoted identifiers and comments are skipped. Brace comments do not nest.
 */
@UtilityClass
public class BeginEndMatcher {

    /**
     * @param beginIndex index of the B of the opening BEGIN
     * @return index just past the matching END, or -1 when the text ends first
     */
    public static int findEnd(String text, int beginIndex) {
        int depth = 0;
        int i = beginIndex;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\'') {
                i = skipPast(text, i + 1, '\'');
            } else if (c == '"') {
                i = skipPast(text, i + 1, '"');
            } else if (c == '{') {
                i = skipPast(text, i + 1, '}');
            } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                int eol = text.indexOf('\n', i);
                i = eol < 0 ? n : eol + 1;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                String word = text.substring(start, i);
                if (word.equalsIgnoreCase("BEGIN") || word.equalsIgnoreCase("CASE")) {
                    depth++;
                } else if (word.equalsIgnoreCase("END")) {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            } else if (Character.isDigit(c)) {
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
            } else {
                i++;
            }
        }
        return -1;
    }

    private static int skipPast(String text, int from, char quote) {
        int close = text.indexOf(quote, from);
        return close < 0 ? text.length() : close + 1;
    }
}
