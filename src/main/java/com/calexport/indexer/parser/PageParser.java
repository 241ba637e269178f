package com.calexport.indexer.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.calexport.indexer.model.Control;
import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.PageAction;
import com.calexport.indexer.model.PageObject;
import com.calexport.indexer.model.Property;
import com.calexport.indexer.parser.exception.ObjectParseException;
import com.calexport.indexer.parser.grammar.BraceScanner;
import com.calexport.indexer.parser.grammar.BraceScanner.Block;
import com.calexport.indexer.parser.grammar.CodeSection;
import com.calexport.indexer.parser.grammar.LocalizedText;
import com.calexport.indexer.parser.grammar.TextScanner;

/**
 * Pages and classic forms. CONTROLS is required.
 *
 * Page controls are {@code { id ; indentation ; type ; properties }} and nest by their explicit
 * indentation column. Form controls are {@code { id ; type ; x ; y ; width ; height ; properties }}
 * and stay flat. The action list lives in the {@code ActionList=ACTIONS { ... }} page property.
 */
public class PageParser extends AbstractObjectParser<PageObject> {

    private static final String ACTION_LIST = "ActionList";

    @Override
    protected Set<ObjectKind> supportedKinds() {
        return Set.of(ObjectKind.PAGE, ObjectKind.FORM);
    }

    @Override
    protected PageObject parseBody(ObjectHeader header, String text) {
        Section controlsSection = require(text, "CONTROLS", header);
        Optional<Section> propertiesSection = optional(text, "PROPERTIES");
        List<Property> properties = propertiesSection
                .map(section -> propertyParser.parse(section.getBody()))
                .orElse(List.of());
        List<PageAction> actions = propertiesSection
                .flatMap(section -> sectionExtractor.findEmbedded(section.getBody(), "ACTIONS"))
                .map(this::parseActions)
                .orElse(List.of());
        CodeSection code = codeSection(text);

        List<Control> flat = parseControls(controlsSection, header);
        List<Control> roots = hierarchyBuilder.build(flat, c -> "control " + c.getId());

        return PageObject.builder()
                .header(header)
                .properties(properties.stream().filter(p -> !p.getName().equalsIgnoreCase(ACTION_LIST)).toList())
                .sourceTableId(tableId(value(properties, "SourceTable").orElse(null)))
                .sourceTableView(value(properties, "SourceTableView").orElse(null))
                .pageType(value(properties, "PageType").orElse(null))
                .controls(roots)
                .actions(actions)
                .variables(code.getVariables())
                .procedures(code.getProcedures())
                .build();
    }

    private List<Control> parseControls(Section section, ObjectHeader header) {
        List<Control> controls = new ArrayList<>();
        for (Block block : BraceScanner.topLevelBlocks(section.getBody())) {
            ItemCursor cursor = new ItemCursor(block.getInner());
            Integer id = integer(cursor.next());
            if (id == null) {
                throw new ObjectParseException("Unreadable control declaration '"
                        + TextScanner.collapseWhitespace(block.getInner()) + "' in " + header.describe());
            }
            String second = cursor.next();
            Integer indentation = integer(second);
            int level;
            String type;
            if (indentation != null) {
                level = indentation;
                type = cursor.next();
            } else {
                level = 0;
                type = second;
                for (int i = 0; i < 4 && integer(cursor.peek()) != null; i++) {
                    cursor.next();
                }
            }
            List<Property> properties = propertyParser.parse(cursor.rest());
            controls.add(Control.builder()
                    .id(id)
                    .level(level)
                    .type(type)
                    .name(value(properties, "Name").orElse(null))
                    .sourceExpr(value(properties, "SourceExpr").map(TextScanner::unquote).orElse(null))
                    .captions(captions(properties))
                    .properties(properties)
                    .build());
        }
        return controls;
    }

    private List<PageAction> parseActions(Section section) {
        List<PageAction> actions = new ArrayList<>();
        for (Block block : BraceScanner.topLevelBlocks(section.getBody())) {
            ItemCursor cursor = new ItemCursor(block.getInner());
            Integer id = integer(cursor.next());
            Integer level = integer(cursor.next());
            String type = cursor.next();
            List<Property> properties = propertyParser.parse(cursor.rest());
            actions.add(PageAction.builder()
                    .id(id == null ? 0 : id)
                    .level(level == null ? 0 : level)
                    .type(type)
                    .name(value(properties, "Name").orElse(null))
                    .captions(captions(properties))
                    .runObject(objectRef(value(properties, "RunObject").orElse(null)))
                    .properties(properties)
                    .build());
        }
        return actions;
    }

    private Map<String, String> captions(List<Property> properties) {
        return value(properties, "CaptionML")
                .flatMap(localizedTextParser::parseCaption)
                .map(LocalizedText::getTexts)
                .orElse(Map.of());
    }
}
