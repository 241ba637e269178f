package com.calexport.indexer.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A table field: {@code { id ; ; name ; type ; properties }}.
 */
@Value
@Builder
public class Field implements PropertyHolder {
    int id;
    @NonNull
    String name;
    @NonNull
    String dataType;
    @Singular
    List<Property> properties;
    @Singular("caption")
    Map<String, String> captions;

    /** FlowField, FlowFilter or Normal; null when not declared. */
    String fieldClass;
    /** Whitespace-collapsed CalcFormula text. */
    String calcFormula;
    String tableRelation;
    String onValidate;
    String onLookup;

    public boolean isFlowField() {
        return "FlowField".equalsIgnoreCase(fieldClass);
    }
}
