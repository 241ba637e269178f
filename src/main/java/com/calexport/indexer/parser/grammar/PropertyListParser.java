package com.calexport.indexer.parser.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.model.Property;

/**
 * Reads {@code Name=value;} sequences as found in PROPERTIES sections and inside item blocks.
 *
 * Values may span lines and contain brackets, parentheses, braces or double-quoted names.
 * Trigger values ({@code BEGIN ... END;} or {@code VAR ... BEGIN ... END;}) run to their matching END.
 * Text that does not start with {@code Name=} is skipped up to the next separator.
 */
public class PropertyListParser {
    private static final Logger log = LoggerFactory.getLogger(PropertyListParser.class);

    private static final Pattern NAME = Pattern.compile("\\s*([A-Za-z][A-Za-z0-9_ ]*?)\\s*=");
    private static final Pattern TRIGGER_START = Pattern.compile("(?:BEGIN|VAR)(?=\\s)");
    private static final Pattern BEGIN_LINE = Pattern.compile("(?m)^[ \\t]*BEGIN\\b");

    public List<Property> parse(String text) {
        List<Property> properties = new ArrayList<>();
        if (text == null) {
            return properties;
        }
        int i = 0;
        int n = text.length();
        while (i < n) {
            i = skipSeparators(text, i);
            if (i >= n) {
                break;
            }
            Matcher name = NAME.matcher(text).region(i, n);
            if (!name.lookingAt()) {
                int next = TextScanner.indexOfTopLevel(text, ';', i, false);
                log.trace("Skipping unreadable property text at offset {}", i);
                i = next < 0 ? n : next + 1;
                continue;
            }
            int valueStart = skipBlanks(text, name.end());
            int valueEnd;
            int resume;
            if (TRIGGER_START.matcher(text).region(valueStart, n).lookingAt()) {
                valueEnd = triggerEnd(text, valueStart);
                resume = valueEnd;
            } else {
                int sep = TextScanner.indexOfTopLevel(text, ';', valueStart, false);
                valueEnd = sep < 0 ? n : sep;
                resume = sep < 0 ? n : sep + 1;
            }
            properties.add(Property.of(name.group(1), text.substring(valueStart, valueEnd)));
            i = resume;
        }
        return properties;
    }

    private int triggerEnd(String text, int valueStart) {
        Matcher begin = BEGIN_LINE.matcher(text);
        int beginIndex = text.startsWith("BEGIN", valueStart) ? valueStart : -1;
        if (beginIndex < 0 && begin.find(valueStart)) {
            beginIndex = begin.end() - "BEGIN".length();
        }
        if (beginIndex < 0) {
            return text.length();
        }
        int end = BeginEndMatcher.findEnd(text, beginIndex);
        return end < 0 ? text.length() : end;
    }

    private static int skipSeparators(String text, int i) {
        while (i < text.length() && (Character.isWhitespace(text.charAt(i)) || text.charAt(i) == ';')) {
            i++;
        }
        return i;
    }

    private static int skipBlanks(String text, int i) {
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
