package com.calexport.indexer.parser;

import com.calexport.indexer.parser.grammar.TextScanner;

/**
 * Walks the leading {@code ;}-separated columns of an item block such as
 * {@code { 1 ; ;Code ;Code10 ;CaptionML=... }}. Whatever is left after the columns is the
 * item's property list.
 */
class ItemCursor {
    private final String text;
    private int pos;

    ItemCursor(String text) {
        this.text = text;
    }

    /**
     * Next column, trimmed. At the end of the text this returns the remainder (possibly empty).
     */
    String next() {
        if (pos >= text.length()) {
            return "";
        }
        int sep = TextScanner.indexOfTopLevel(text, ';', pos, false);
        String column;
        if (sep < 0) {
            column = text.substring(pos);
            pos = text.length();
        } else {
            column = text.substring(pos, sep);
            pos = sep + 1;
        }
        return column.trim();
    }

    String peek() {
        int saved = pos;
        String column = next();
        pos = saved;
        return column;
    }

    String rest() {
        return pos >= text.length() ? "" : text.substring(pos);
    }
}
