package com.calexport.indexer.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TableKey implements PropertyHolder {
    @Singular
    List<String> fields;
    boolean clustered;
    boolean unique;
    @Builder.Default
    boolean enabled = true;
    @Singular
    List<Property> properties;

    public String describe() {
        return String.join(",", fields);
    }
}
