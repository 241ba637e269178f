package com.calexport.indexer.parser.grammar;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TableRelation grammar. Anything it cannot read yields {@link Optional#empty()}.
 */
public class RelationConstraintParser {

    private static final Pattern CONDITION_START = Pattern.compile("^IF\\s*(?=\\()", Pattern.CASE_INSENSITIVE);
    private static final Pattern TARGET = Pattern.compile("^(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))");
    private static final Pattern FIELD = Pattern.compile("^\\.(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))");
    private static final Pattern KEYWORD = Pattern.compile("^(?:IF|ELSE|WHERE|CONST|FIELD|FILTER)$", Pattern.CASE_INSENSITIVE);

    public Optional<RelationConstraint> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = TextScanner.collapseWhitespace(raw);
        if (text.isEmpty()) {
            return Optional.empty();
        }

        String condition = null;
        Matcher cond = CONDITION_START.matcher(text);
        if (cond.find()) {
            int open = cond.end();
            int close = TextScanner.matchingClose(text, open, false);
            if (close < 0) {
                return Optional.empty();
            }
            condition = text.substring(open + 1, close).trim();
            text = text.substring(close + 1).trim();
        }

        Matcher target = TARGET.matcher(text);
        if (!target.find()) {
            return Optional.empty();
        }
        String targetName = target.group(1) != null ? target.group(1) : target.group(2);
        if (target.group(2) != null && KEYWORD.matcher(targetName).matches()) {
            return Optional.empty();
        }
        String rest = text.substring(target.end());

        String fieldName = null;
        Matcher field = FIELD.matcher(rest);
        if (field.find()) {
            fieldName = field.group(1) != null ? field.group(1) : field.group(2);
            rest = rest.substring(field.end());
        }

        rest = rest.trim();
        return Optional.of(RelationConstraint.builder()
                .targetName(targetName)
                .fieldName(fieldName)
                .condition(condition)
                .qualifier(rest.isEmpty() ? null : rest)
                .build());
    }
}
