package com.calexport.indexer.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.calexport.indexer.parser.grammar.BraceScanner;
import com.calexport.indexer.parser.grammar.BraceScanner.Block;

import lombok.Getter;

/**
 * Flattens brace-nested item declarations (report and query DATAITEMs, XMLport ELEMENTs)
 * into a pre-order list of levelled records.
 *
 * A block whose text starts with the item marker is an item one level below the item that
 * encloses it; any other block is transparent and its text belongs to the enclosing item.
 * Each record keeps the marker's groups and its own text with nested items cut out.
 */
class NestedItemScanner {

    @Getter
    static class RawItem {
        private final int level;
        private final List<String> groups;
        private final int column;
        private String ownText = "";

        RawItem(int level, List<String> groups, int column) {
            this.level = level;
            this.groups = groups;
            this.column = column;
        }

        String group(int index) {
            return groups.get(index - 1);
        }
    }

    private final Pattern marker;

    NestedItemScanner(Pattern marker) {
        this.marker = marker;
    }

    List<RawItem> scan(String sectionBody) {
        List<RawItem> out = new ArrayList<>();
        collect(sectionBody, 0, null, out);
        return out;
    }

    private void collect(String region, int level, StringBuilder own, List<RawItem> out) {
        int cursor = 0;
        for (Block block : BraceScanner.topLevelBlocks(region)) {
            if (own != null) {
                own.append(region, cursor, block.getStart()).append('\n');
            }
            Matcher m = marker.matcher(block.getInner());
            if (m.lookingAt()) {
                List<String> groups = new ArrayList<>();
                for (int g = 1; g <= m.groupCount(); g++) {
                    groups.add(m.group(g));
                }
                RawItem item = new RawItem(level, groups, block.getColumn());
                out.add(item);
                StringBuilder itemOwn = new StringBuilder();
                collect(block.getInner().substring(m.end()), level + 1, itemOwn, out);
                item.ownText = itemOwn.toString();
            } else {
                collect(block.getInner(), level, own, out);
            }
            cursor = block.getEnd() + 1;
        }
        if (own != null) {
            own.append(region.substring(cursor));
        }
    }
}
