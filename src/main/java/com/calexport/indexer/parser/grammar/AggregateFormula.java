package com.calexport.indexer.parser.grammar;

import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Parsed CalcFormula value: {@code [-]Method("Target"[.Field] [WHERE (...)])}.
 */
@Value
@Builder
public class AggregateFormula {
    AggregateMethod method;
    boolean negated;
    String targetName;
    String fieldName;
    String qualifier;

    public Optional<String> fieldName() {
        return Optional.ofNullable(fieldName);
    }
}
