package com.calexport.indexer.parser;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKey;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.Property;
import com.calexport.indexer.parser.exception.KindMismatchException;
import com.calexport.indexer.parser.exception.MissingSectionException;
import com.calexport.indexer.parser.grammar.CodeSection;
import com.calexport.indexer.parser.grammar.CodeSectionParser;
import com.calexport.indexer.parser.grammar.LocalizedTextParser;
import com.calexport.indexer.parser.grammar.PropertyListParser;
import com.calexport.indexer.parser.grammar.TextScanner;

/**
 * Shared plumbing of the per-kind body parsers: header, kind check, section lookup,
 * object properties and the CODE section.
 *
 * Parsers hold no per-call state and can be reused.
 */
public abstract class AbstractObjectParser<T extends CalObject> {
    private static final Logger log = LoggerFactory.getLogger(AbstractObjectParser.class);

    private static final Pattern TABLE_ID = Pattern.compile("^(?:Table)?\\s*(\\d{1,10})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern OBJECT_REF = Pattern.compile(
            "^(Table|Page|Form|Codeunit|Report|XMLport|Query|MenuSuite)\\s*(\\d{1,10})", Pattern.CASE_INSENSITIVE);

    private static final Pattern SMALL_INT = Pattern.compile("^-?\\d{1,10}$");

    protected final ObjectDeclarationParser declarationParser;
    protected final SectionExtractor sectionExtractor;
    protected final PropertyListParser propertyParser;
    protected final LocalizedTextParser localizedTextParser;
    protected final CodeSectionParser codeSectionParser;
    protected final HierarchyBuilder hierarchyBuilder;

    protected AbstractObjectParser() {
        this.sectionExtractor = new SectionExtractor();
        this.declarationParser = new ObjectDeclarationParser(sectionExtractor);
        this.propertyParser = new PropertyListParser();
        this.localizedTextParser = new LocalizedTextParser();
        this.codeSectionParser = new CodeSectionParser();
        this.hierarchyBuilder = new HierarchyBuilder();
    }

    public final T parse(String objectText) {
        String text = TextScanner.stripBom(objectText);
        ObjectHeader header = declarationParser.parse(text);
        if (!supportedKinds().contains(header.getKind())) {
            throw new KindMismatchException(header.getKind(), supportedKinds());
        }
        T object = parseBody(header, text);
        log.debug("Parsed {}", header.describe());
        return object;
    }

    protected abstract Set<ObjectKind> supportedKinds();

    protected abstract T parseBody(ObjectHeader header, String text);

    protected Section require(String text, String keyword, ObjectHeader header) {
        return sectionExtractor.find(text, keyword)
                .orElseThrow(() -> new MissingSectionException(keyword, header.describe()));
    }

    protected Optional<Section> optional(String text, String keyword) {
        return sectionExtractor.find(text, keyword);
    }

    protected List<Property> objectProperties(String text) {
        return optional(text, "PROPERTIES")
                .map(section -> propertyParser.parse(section.getBody()))
                .orElse(List.of());
    }

    protected CodeSection codeSection(String text) {
        return optional(text, "CODE")
                .map(section -> codeSectionParser.parse(section.getBody()))
                .orElse(CodeSection.EMPTY);
    }

    protected static Optional<String> value(List<Property> properties, String name) {
        return properties.stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .map(Property::getValue)
                .findFirst();
    }

    /**
     * {@code Table18}, {@code 18} or {@code Table 18}.
     */
    protected static Integer tableId(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = TABLE_ID.matcher(value.trim());
        return m.matches() ? TextScanner.toInt(m.group(1)) : null;
    }

    /**
     * {@code Page 21}, {@code Page21}, {@code Report 206}.
     */
    protected static ObjectKey objectRef(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = OBJECT_REF.matcher(value.trim());
        if (!m.find()) {
            return null;
        }
        Integer id = TextScanner.toInt(m.group(2));
        if (id == null) {
            return null;
        }
        return ObjectKind.parse(m.group(1))
                .map(kind -> ObjectKey.of(kind, id))
                .orElse(null);
    }

    protected static Integer integer(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return SMALL_INT.matcher(trimmed).matches() ? TextScanner.toInt(trimmed) : null;
    }
}
