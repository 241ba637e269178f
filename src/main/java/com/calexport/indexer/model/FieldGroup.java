package com.calexport.indexer.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class FieldGroup {
    int id;
    String name;
    @Singular
    List<String> fields;
}
