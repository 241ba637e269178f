package com.calexport.indexer.reference;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where a reference edge was found.
 */
public enum ReferenceType {
    TABLE_RELATION("TableRelation"),
    CALC_FORMULA("CalcFormula"),
    RECORD_VARIABLE("RecordVariable"),
    OBJECT_VARIABLE("ObjectVariable"),
    SOURCE_TABLE("SourceTable"),
    DATA_ITEM_TABLE("DataItemTable"),
    RUN_OBJECT("RunObject"),
    PAGE_PART("PagePart");

    private final String label;

    ReferenceType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Accepts the label ({@code TableRelation}) or the constant name ({@code TABLE_RELATION}), any case.
     */
    public static Optional<ReferenceType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.label.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
