package com.calexport.indexer.parser.grammar;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CalcFormula grammar. Anything it cannot read yields {@link Optional#empty()}.
 */
public class AggregateFormulaParser {

    private static final Pattern FORMULA = Pattern.compile(
            "^(-)?\\s*(Sum|Count|Exist|Lookup|Average|Min|Max)\\s*\\(\\s*"
                    + "(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))"
                    + "(?:\\.(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*)))?"
                    + "(.*)\\)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public Optional<AggregateFormula> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = TextScanner.collapseWhitespace(raw);
        Matcher m = FORMULA.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        Optional<AggregateMethod> method = AggregateMethod.fromToken(m.group(2));
        if (method.isEmpty()) {
            return Optional.empty();
        }
        String qualifier = m.group(7).trim();
        return Optional.of(AggregateFormula.builder()
                .method(method.get())
                .negated(m.group(1) != null)
                .targetName(m.group(3) != null ? m.group(3) : m.group(4))
                .fieldName(m.group(5) != null ? m.group(5) : m.group(6))
                .qualifier(qualifier.isEmpty() ? null : qualifier)
                .build());
    }
}
