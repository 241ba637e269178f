package com.calexport.indexer.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.calexport.indexer.model.Column;
import com.calexport.indexer.model.DataItem;
import com.calexport.indexer.model.Property;
import com.calexport.indexer.parser.NestedItemScanner.RawItem;
import com.calexport.indexer.parser.grammar.PropertyListParser;
import com.calexport.indexer.parser.grammar.TextScanner;

import lombok.Value;

/**
 * DATASET (reports) and ELEMENTS (queries) sections:
 *
 * <pre>
 *   { DATAITEM "Customer";"Customer"
 *               {
 *                 DataItemTable=Table18;
 *                 column(No;"No.") { }
 *                 { DATAITEM "Ledger";"Cust. Ledger Entry" { ... } }
 *               }
 *   }
 * </pre>
 *
 * The nesting level of a data item is the number of data items enclosing it.
 */
class DataItemSectionParser {

    private static final Pattern DATAITEM = Pattern.compile(
            "\\s*DATAITEM\\s+(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))\\s*;\\s*(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CALL = Pattern.compile("\\b(column|filter)\\s*\\(", Pattern.CASE_INSENSITIVE);

    @Value
    static class Result {
        List<DataItem> roots;
        List<Column> columns;
        List<Column> filters;
    }

    private final NestedItemScanner scanner = new NestedItemScanner(DATAITEM);
    private final PropertyListParser propertyParser;
    private final HierarchyBuilder hierarchyBuilder;

    DataItemSectionParser(PropertyListParser propertyParser, HierarchyBuilder hierarchyBuilder) {
        this.propertyParser = propertyParser;
        this.hierarchyBuilder = hierarchyBuilder;
    }

    Result parse(Section section) {
        List<DataItem> flat = new ArrayList<>();
        List<Column> allColumns = new ArrayList<>();
        List<Column> allFilters = new ArrayList<>();

        for (RawItem raw : scanner.scan(section.getBody())) {
            String name = raw.group(1) != null ? raw.group(1) : raw.group(2);
            String tableName = raw.group(3) != null ? raw.group(3) : raw.group(4);

            List<Column> columns = new ArrayList<>();
            List<Column> filters = new ArrayList<>();
            String propertyText = extractCalls(raw.getOwnText(), name, columns, filters);
            List<Property> properties = propertyParser.parse(propertyText);

            flat.add(DataItem.builder()
                    .name(name)
                    .tableName(tableName)
                    .tableId(AbstractObjectParser.tableId(AbstractObjectParser.value(properties, "DataItemTable").orElse(null)))
                    .level(raw.getLevel())
                    .properties(properties)
                    .columns(columns)
                    .filters(filters)
                    .build());
            allColumns.addAll(columns);
            allFilters.addAll(filters);
        }
        List<DataItem> roots = hierarchyBuilder.build(flat, d -> "data item " + d.getName());
        return new Result(roots, allColumns, allFilters);
    }

    /**
     * Pulls {@code column(...)} and {@code filter(...)} calls out of the item text and returns
     * what is left, which is the item's property list.
     */
    private static String extractCalls(String text, String dataItem, List<Column> columns, List<Column> filters) {
        StringBuilder rest = new StringBuilder();
        Matcher m = CALL.matcher(text);
        int cursor = 0;
        while (m.find(cursor)) {
            int open = m.end() - 1;
            int close = TextScanner.matchingClose(text, open, false);
            if (close < 0) {
                break;
            }
            rest.append(text, cursor, m.start()).append(";\n");
            String inner = text.substring(open + 1, close);
            int sep = TextScanner.indexOfTopLevel(inner, ';', 0, false);
            String name = (sep < 0 ? inner : inner.substring(0, sep)).trim();
            String source = sep < 0 ? "" : inner.substring(sep + 1).trim();
            boolean filter = m.group(1).equalsIgnoreCase("filter");
            Column column = new Column(name, source, dataItem, filter);
            if (filter) {
                filters.add(column);
            } else {
                columns.add(column);
            }
            cursor = close + 1;
        }
        rest.append(text.substring(cursor));
        return rest.toString();
    }
}
