package com.calexport.indexer.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.calexport.indexer.model.MenuItem;
import com.calexport.indexer.model.MenuSuiteObject;
import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.Property;
import com.calexport.indexer.parser.exception.ObjectParseException;
import com.calexport.indexer.parser.grammar.BraceScanner;
import com.calexport.indexer.parser.grammar.TextScanner;

/**
 * Menu suites. MENUITEMS is a sequence of {@code MENUITEM(props)} and {@code SEPARATOR}
 * entries; a brace block after an item holds that item's children.
 */
public class MenuSuiteParser extends AbstractObjectParser<MenuSuiteObject> {

    private static final Pattern TOKEN = Pattern.compile("\\b(MENUITEM)\\s*\\(|\\b(SEPARATOR)\\b|(\\{)");

    @Override
    protected Set<ObjectKind> supportedKinds() {
        return Set.of(ObjectKind.MENUSUITE);
    }

    @Override
    protected MenuSuiteObject parseBody(ObjectHeader header, String text) {
        Section section = require(text, "MENUITEMS", header);
        List<MenuItem> flat = new ArrayList<>();
        scan(section.getBody(), 0, flat, header);
        return MenuSuiteObject.builder()
                .header(header)
                .properties(objectProperties(text))
                .menuItems(hierarchyBuilder.build(flat, m -> "menu item " + m.getId()))
                .build();
    }

    private void scan(String region, int level, List<MenuItem> out, ObjectHeader header) {
        Matcher m = TOKEN.matcher(region);
        int cursor = 0;
        while (m.find(cursor)) {
            if (m.group(1) != null) {
                int open = m.end() - 1;
                int close = TextScanner.matchingClose(region, open, false);
                if (close < 0) {
                    throw new ObjectParseException("Unterminated MENUITEM in " + header.describe());
                }
                out.add(menuItem(out.size() + 1, level, propertyParser.parse(region.substring(open + 1, close))));
                cursor = close + 1;
            } else if (m.group(2) != null) {
                out.add(MenuItem.builder()
                        .id(out.size() + 1)
                        .name(MenuItem.SEPARATOR)
                        .level(level)
                        .separator(true)
                        .build());
                cursor = m.end();
            } else {
                int open = m.start(3);
                int close = BraceScanner.matchingClose(region, open);
                if (close < 0) {
                    throw new ObjectParseException("Unterminated menu block in " + header.describe());
                }
                scan(region.substring(open + 1, close), level + 1, out, header);
                cursor = close + 1;
            }
        }
    }

    private static MenuItem menuItem(int id, int level, List<Property> properties) {
        String name = value(properties, "Text")
                .or(() -> value(properties, "Name"))
                .map(TextScanner::unquote)
                .orElse(null);
        return MenuItem.builder()
                .id(id)
                .name(name)
                .level(level)
                .folder(value(properties, "IsFolder").map(v -> v.equalsIgnoreCase("Yes")).orElse(false))
                .runObject(objectRef(value(properties, "RunObject").orElse(null)))
                .properties(properties)
                .build();
    }
}
