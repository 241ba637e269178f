package com.calexport.indexer.query;

import com.calexport.indexer.model.ObjectKind;

import lombok.Builder;
import lombok.Value;

/**
 * A line of a procedure body that matched a code search. {@code lineNumber} is 1-based within the body.
 */
@Value
@Builder
public class CodeMatch {
    ObjectKind objectKind;
    int objectId;
    String objectName;
    String procedureName;
    int lineNumber;
    String line;
}
