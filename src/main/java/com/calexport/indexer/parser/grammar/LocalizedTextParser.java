package com.calexport.indexer.parser.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses multi-language values: {@code CaptionML=[ENU=Code;DEU=Code]} and
 * {@code TextConst 'ENU=Hello %1;@@@=%1 is the user name'}.
 */
public class LocalizedTextParser {

    private static final Pattern ENTRY_SEPARATOR = Pattern.compile(";(?=\\s*(?:[A-Z]{3}|@@@)=)");
    private static final Pattern ENTRY = Pattern.compile("^\\s*([A-Z]{3}|@@@)=([\\s\\S]*)$");

    /**
     * Caption form, with or without the surrounding brackets.
     */
    public Optional<LocalizedText> parseCaption(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (text.startsWith("[") && text.endsWith("]")) {
            text = text.substring(1, text.length() - 1);
        }
        return parseEntries(text, false);
    }

    /**
     * Inner text of a TextConst literal (without the outer quotes); doubled quotes are unescaped.
     */
    public Optional<LocalizedText> parseTextConst(String inner) {
        if (inner == null) {
            return Optional.empty();
        }
        return parseEntries(inner, true);
    }

    private Optional<LocalizedText> parseEntries(String text, boolean unescape) {
        Map<String, String> texts = new LinkedHashMap<>();
        String comment = null;
        for (String part : ENTRY_SEPARATOR.split(text)) {
            Matcher m = ENTRY.matcher(part);
            if (!m.matches()) {
                continue;
            }
            String value = TextScanner.collapseWhitespace(m.group(2));
            if (unescape) {
                value = value.replace("''", "'");
            }
            if (LocalizedText.COMMENT_TAG.equals(m.group(1))) {
                comment = TextScanner.unquote(value);
            } else {
                texts.put(m.group(1), value);
            }
        }
        if (texts.isEmpty() && comment == null) {
            return Optional.empty();
        }
        return Optional.of(new LocalizedText(Collections.unmodifiableMap(texts), comment));
    }
}
