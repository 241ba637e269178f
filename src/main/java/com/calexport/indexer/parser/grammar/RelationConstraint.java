package com.calexport.indexer.parser.grammar;

import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Parsed TableRelation value: {@code [IF (cond)] "Target"[.Field] [WHERE (...)]}.
 */
@Value
@Builder
public class RelationConstraint {
    String targetName;
    String fieldName;
    /** Leading {@code IF (...)} condition, without the IF keyword. */
    String condition;
    /** Everything after the target, kept as written (WHERE clauses, ELSE branches). */
    String qualifier;

    public Optional<String> fieldName() {
        return Optional.ofNullable(fieldName);
    }

    public boolean isConditional() {
        return condition != null;
    }
}
