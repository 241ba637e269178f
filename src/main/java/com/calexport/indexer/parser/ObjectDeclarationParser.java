package com.calexport.indexer.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.ObjectMetadata;
import com.calexport.indexer.parser.exception.InvalidDeclarationException;
import com.calexport.indexer.parser.grammar.TextScanner;

/**
 * Reads the {@code OBJECT <kind> <id> <name>} line and the optional OBJECT-PROPERTIES block.
 */
public class ObjectDeclarationParser {

    private static final Pattern HEADER = Pattern.compile("^OBJECT\\s+(\\S+)\\s+(\\S+)(?:\\s+(.*))?$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    private static final Pattern DATE = Pattern.compile("(?m)^\\s*Date=([^;]+);");
    private static final Pattern TIME = Pattern.compile("(?m)^\\s*Time=\\[?\\s*([^\\];]+?)\\s*\\]?;");
    private static final Pattern VERSION_LIST = Pattern.compile("(?m)^\\s*Version List=([^;]*);");

    private final SectionExtractor sectionExtractor;

    public ObjectDeclarationParser() {
        this(new SectionExtractor());
    }

    public ObjectDeclarationParser(SectionExtractor sectionExtractor) {
        this.sectionExtractor = sectionExtractor;
    }

    /**
     * Header and metadata of a whole object text.
     */
    public ObjectHeader parse(String objectText) {
        String text = TextScanner.stripBom(objectText == null ? "" : objectText);
        ObjectHeader header = parseHeaderLine(firstLine(text));
        return header.toBuilder().metadata(parseMetadata(text)).build();
    }

    public ObjectHeader parseHeaderLine(String line) {
        String text = TextScanner.stripBom(line == null ? "" : line).strip();
        Matcher m = HEADER.matcher(text);
        if (!m.matches()) {
            throw new InvalidDeclarationException(text, "expected OBJECT <kind> <id> <name>");
        }
        ObjectKind kind = ObjectKind.fromToken(m.group(1))
                .orElseThrow(() -> new InvalidDeclarationException(text, "unknown object kind " + m.group(1)));
        if (!DIGITS.matcher(m.group(2)).matches()) {
            throw new InvalidDeclarationException(text, "object id is not a number: " + m.group(2));
        }
        int id;
        try {
            id = Integer.parseInt(m.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidDeclarationException(text, "object id out of range: " + m.group(2), e);
        }
        String name = m.group(3) == null ? "" : m.group(3).trim();
        if (name.isEmpty()) {
            throw new InvalidDeclarationException(text, "object name is empty");
        }
        return ObjectHeader.builder()
                .kind(kind)
                .id(id)
                .name(name)
                .build();
    }

    /**
     * Date, time and version list of the OBJECT-PROPERTIES block. A missing block or entry is
     * simply absent.
     */
    public ObjectMetadata parseMetadata(String objectText) {
        Optional<Section> block = sectionExtractor.find(objectText, "OBJECT-PROPERTIES");
        if (block.isEmpty()) {
            return ObjectMetadata.EMPTY;
        }
        String body = block.get().getBody();
        return ObjectMetadata.builder()
                .date(group(DATE, body))
                .time(group(TIME, body))
                .versionList(group(VERSION_LIST, body))
                .build();
    }

    private static String group(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return null;
        }
        String value = m.group(1).trim();
        return value.isEmpty() ? null : value;
    }

    private static String firstLine(String text) {
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) {
                return line;
            }
        }
        return "";
    }
}
