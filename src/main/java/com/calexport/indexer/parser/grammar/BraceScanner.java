package com.calexport.indexer.parser.grammar;

import java.util.ArrayList;
import java.util.List;

import lombok.Value;
import lombok.experimental.UtilityClass;

/**
 * Depth counting over curly braces. Sections and item blocks are delimited this way.
 *
 * A BEGIN that ends its line and starts it (or follows a {@code =}) opens trigger or procedure
 * code; that code is skipped up to its END so string literals and comments in it do not count.
 * Property text outside code is not treated as quoted.
 */
@UtilityClass
public class BraceScanner {

    /**
     * One {@code { ... }} block: offsets of both braces, the text between them and the column of
     * the opening brace.
     */
    @Value
    public static class Block {
        int start;
        int end;
        String inner;
        int column;
    }

    /**
     * Index of the brace closing the one at {@code openIndex}, or -1 when the text ends first.
     */
    public static int matchingClose(String text, int openIndex) {
        int depth = 0;
        int i = openIndex;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            } else if (depth > 0 && opensCode(text, i)) {
                int end = BeginEndMatcher.findEnd(text, i);
                if (end > 0) {
                    i = end;
                    continue;
                }
            }
            i++;
        }
        return -1;
    }

    static boolean opensCode(String text, int index) {
        int after = index + 5;
        if (!text.regionMatches(true, index, "BEGIN", 0, 5) || after >= text.length()) {
            return false;
        }
        while (after < text.length() && (text.charAt(after) == ' ' || text.charAt(after) == '\t'
                || text.charAt(after) == '\r')) {
            after++;
        }
        if (after < text.length() && text.charAt(after) != '\n') {
            return false;
        }
        int before = index - 1;
        while (before >= 0 && (text.charAt(before) == ' ' || text.charAt(before) == '\t')) {
            before--;
        }
        return before < 0 || text.charAt(before) == '\n' || text.charAt(before) == '=';
    }

    /**
     * Blocks at depth zero of {@code text}, in order. An unterminated block ends the scan.
     */
    public static List<Block> topLevelBlocks(String text) {
        List<Block> blocks = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            int open = text.indexOf('{', i);
            if (open < 0) {
                break;
            }
            int close = matchingClose(text, open);
            if (close < 0) {
                break;
            }
            blocks.add(new Block(open, close, text.substring(open + 1, close), TextScanner.columnOf(text, open)));
            i = close + 1;
        }
        return blocks;
    }
}
