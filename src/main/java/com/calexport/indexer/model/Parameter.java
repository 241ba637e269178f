package com.calexport.indexer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Procedure parameter. {@code type} is the declared type text as written.
 */
@Value
@Builder
public class Parameter {
    String name;
    int id;
    String type;
    boolean byRef;
    boolean temporary;
}
