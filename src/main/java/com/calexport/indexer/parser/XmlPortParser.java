package com.calexport.indexer.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.PortNode;
import com.calexport.indexer.model.PortNodeType;
import com.calexport.indexer.model.Property;
import com.calexport.indexer.model.XmlPortObject;
import com.calexport.indexer.parser.NestedItemScanner.RawItem;
import com.calexport.indexer.parser.grammar.CodeSection;

/**
 * XMLports. ELEMENTS is required; nodes are {@code { ELEMENT;Name;Type ; properties { ... } }}
 * and nest by brace depth.
 */
public class XmlPortParser extends AbstractObjectParser<XmlPortObject> {

    private static final Pattern ELEMENT = Pattern.compile(
            "\\s*ELEMENT\\s*;\\s*([^;{}]+?)\\s*;\\s*([A-Za-z]+)\\s*;?", Pattern.CASE_INSENSITIVE);

    private final NestedItemScanner scanner = new NestedItemScanner(ELEMENT);

    @Override
    protected Set<ObjectKind> supportedKinds() {
        return Set.of(ObjectKind.XMLPORT);
    }

    @Override
    protected XmlPortObject parseBody(ObjectHeader header, String text) {
        Section elements = require(text, "ELEMENTS", header);
        List<PortNode> flat = new ArrayList<>();
        for (RawItem raw : scanner.scan(elements.getBody())) {
            List<Property> properties = propertyParser.parse(raw.getOwnText());
            String sourceTable = value(properties, "SourceTable").orElse(null);
            flat.add(PortNode.builder()
                    .name(raw.group(1))
                    .nodeType(PortNodeType.fromToken(raw.group(2)).orElse(PortNodeType.ELEMENT))
                    .level(raw.getLevel())
                    .sourceTable(sourceTable)
                    .sourceTableId(tableId(sourceTable))
                    .sourceField(value(properties, "SourceField").orElse(null))
                    .properties(properties)
                    .build());
        }
        CodeSection code = codeSection(text);
        return XmlPortObject.builder()
                .header(header)
                .properties(objectProperties(text))
                .nodes(hierarchyBuilder.build(flat, n -> "element " + n.getName()))
                .variables(code.getVariables())
                .procedures(code.getProcedures())
                .build();
    }
}
