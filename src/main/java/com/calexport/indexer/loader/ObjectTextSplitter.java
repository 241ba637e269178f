package com.calexport.indexer.loader;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.calexport.indexer.parser.grammar.TextScanner;

/**
 * Cuts an export stream into one text per object. An object starts at a line
 * {@code OBJECT <kind> <id> ...} and runs up to the next such line.
 *
 * Text before the first object line is ignored.
 */
public class ObjectTextSplitter {

    private static final Pattern OBJECT_START = Pattern.compile(
            "(?m)^OBJECT\\s+(?:Table|Page|Form|Codeunit|Report|XMLport|Query|MenuSuite)\\s+\\d+\\b");

    public List<String> split(String content) {
        List<String> objects = new ArrayList<>();
        if (content == null) {
            return objects;
        }
        String text = TextScanner.stripBom(content);
        Matcher m = OBJECT_START.matcher(text);
        List<Integer> starts = new ArrayList<>();
        while (m.find()) {
            starts.add(m.start());
        }
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : text.length();
            objects.add(text.substring(starts.get(i), end).strip());
        }
        return objects;
    }
}
