package com.calexport.indexer.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.calexport.indexer.parser.exception.MissingSectionException;
import com.calexport.indexer.parser.grammar.BraceScanner;

/**
 * Locates a named block by its keyword and returns it up to the matching closing brace.
 *
 * The keyword has to start its line (leading whitespace allowed) so that {@code PROPERTIES}
 * is not found inside {@code OBJECT-PROPERTIES}. Embedded sections, such as the ACTIONS list
 * of a page's {@code ActionList=} property, are looked up with {@link #findEmbedded}.
 */
public class SectionExtractor {

    private final Map<String, Pattern> lineAnchored = new HashMap<>();
    private final Map<String, Pattern> embedded = new HashMap<>();

    public Section extract(String text, String keyword) {
        return find(text, keyword).orElseThrow(() -> new MissingSectionException(keyword));
    }

    public Optional<Section> find(String text, String keyword) {
        Pattern pattern = lineAnchored.computeIfAbsent(keyword,
                k -> Pattern.compile("(?m)^[ \\t]*(" + Pattern.quote(k) + ")\\s*\\{"));
        return locate(text, keyword, pattern);
    }

    public Optional<Section> findEmbedded(String text, String keyword) {
        Pattern pattern = embedded.computeIfAbsent(keyword,
                k -> Pattern.compile("\\b(" + Pattern.quote(k) + ")\\s*\\{"));
        return locate(text, keyword, pattern);
    }

    private static Optional<Section> locate(String text, String keyword, Pattern pattern) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        int open = m.end() - 1;
        int close = BraceScanner.matchingClose(text, open);
        if (close < 0) {
            return Optional.empty();
        }
        return Optional.of(new Section(keyword,
                text.substring(m.start(1), close + 1),
                text.substring(open + 1, close),
                m.start(1),
                close));
    }
}
