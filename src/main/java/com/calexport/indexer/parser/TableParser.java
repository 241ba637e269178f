package com.calexport.indexer.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import com.calexport.indexer.model.Field;
import com.calexport.indexer.model.FieldGroup;
import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.Property;
import com.calexport.indexer.model.TableKey;
import com.calexport.indexer.model.TableObject;
import com.calexport.indexer.parser.exception.ObjectParseException;
import com.calexport.indexer.parser.grammar.BraceScanner;
import com.calexport.indexer.parser.grammar.BraceScanner.Block;
import com.calexport.indexer.parser.grammar.CodeSection;
import com.calexport.indexer.parser.grammar.TextScanner;

/**
 * Tables. FIELDS and KEYS are required; PROPERTIES, FIELDGROUPS and CODE are optional.
 */
public class TableParser extends AbstractObjectParser<TableObject> {

    @Override
    protected Set<ObjectKind> supportedKinds() {
        return Set.of(ObjectKind.TABLE);
    }

    @Override
    protected TableObject parseBody(ObjectHeader header, String text) {
        Section fieldsSection = require(text, "FIELDS", header);
        Section keysSection = require(text, "KEYS", header);
        List<Property> properties = objectProperties(text);
        CodeSection code = codeSection(text);

        return TableObject.builder()
                .header(header)
                .properties(properties)
                .fields(parseFields(fieldsSection, header))
                .keys(parseKeys(keysSection))
                .fieldGroups(optional(text, "FIELDGROUPS").map(this::parseFieldGroups).orElse(List.of()))
                .permissions(value(properties, "Permissions").orElse(null))
                .lookupPageId(pageId(value(properties, "LookupPageID").orElse(null)))
                .drillDownPageId(pageId(value(properties, "DrillDownPageID").orElse(null)))
                .variables(code.getVariables())
                .procedures(code.getProcedures())
                .build();
    }

    private List<Field> parseFields(Section section, ObjectHeader header) {
        List<Field> fields = new ArrayList<>();
        for (Block block : BraceScanner.topLevelBlocks(section.getBody())) {
            ItemCursor cursor = new ItemCursor(block.getInner());
            String idColumn = cursor.next();
            Integer id = integer(idColumn);
            if (id == null) {
                throw new ObjectParseException("Unreadable field declaration '"
                        + TextScanner.collapseWhitespace(block.getInner()) + "' in " + header.describe());
            }
            cursor.next();
            String name = cursor.next();
            String dataType = cursor.next();
            List<Property> properties = propertyParser.parse(cursor.rest());

            Field.FieldBuilder field = Field.builder()
                    .id(id)
                    .name(name)
                    .dataType(dataType)
                    .properties(properties)
                    .fieldClass(value(properties, "FieldClass").orElse(null))
                    .calcFormula(value(properties, "CalcFormula").map(TextScanner::collapseWhitespace).orElse(null))
                    .tableRelation(value(properties, "TableRelation").map(TextScanner::collapseWhitespace).orElse(null))
                    .onValidate(value(properties, "OnValidate").orElse(null))
                    .onLookup(value(properties, "OnLookup").orElse(null));
            value(properties, "CaptionML")
                    .flatMap(localizedTextParser::parseCaption)
                    .ifPresent(caption -> field.captions(caption.getTexts()));
            fields.add(field.build());
        }
        return fields;
    }

    private List<TableKey> parseKeys(Section section) {
        List<TableKey> keys = new ArrayList<>();
        for (Block block : BraceScanner.topLevelBlocks(section.getBody())) {
            ItemCursor cursor = new ItemCursor(block.getInner());
            String enabledColumn = cursor.next();
            String fieldList = cursor.next();
            List<Property> properties = propertyParser.parse(cursor.rest());
            boolean disabled = enabledColumn.equalsIgnoreCase("No")
                    || value(properties, "Enabled").map("No"::equalsIgnoreCase).orElse(false);
            keys.add(TableKey.builder()
                    .fields(splitFieldList(fieldList))
                    .clustered(value(properties, "Clustered").map("Yes"::equalsIgnoreCase).orElse(false))
                    .unique(value(properties, "Unique").map("Yes"::equalsIgnoreCase).orElse(false))
                    .enabled(!disabled)
                    .properties(properties)
                    .build());
        }
        return keys;
    }

    private List<FieldGroup> parseFieldGroups(Section section) {
        List<FieldGroup> groups = new ArrayList<>();
        for (Block block : BraceScanner.topLevelBlocks(section.getBody())) {
            ItemCursor cursor = new ItemCursor(block.getInner());
            Integer id = integer(cursor.next());
            String name = cursor.next();
            String fieldList = cursor.next();
            groups.add(FieldGroup.builder()
                    .id(id == null ? 0 : id)
                    .name(name)
                    .fields(splitFieldList(fieldList))
                    .build());
        }
        return groups;
    }

    private static List<String> splitFieldList(String fieldList) {
        return Arrays.stream(fieldList.split(","))
                .map(TextScanner::unquote)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static Integer pageId(String value) {
        if (value == null) {
            return null;
        }
        return integer(value.replaceFirst("(?i)^Page\\s*", ""));
    }
}
