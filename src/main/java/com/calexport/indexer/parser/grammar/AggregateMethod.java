package com.calexport.indexer.parser.grammar;

import java.util.Arrays;
import java.util.Optional;

/**
 * CalcFormula methods.
 */
public enum AggregateMethod {
    SUM("Sum"),
    COUNT("Count"),
    EXIST("Exist"),
    LOOKUP("Lookup"),
    AVERAGE("Average"),
    MIN("Min"),
    MAX("Max");

    private final String token;

    AggregateMethod(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static Optional<AggregateMethod> fromToken(String token) {
        return Arrays.stream(values())
                .filter(m -> m.token.equalsIgnoreCase(token))
                .findFirst();
    }
}
