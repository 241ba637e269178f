package com.calexport.indexer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Parsed {@code OBJECT <kind> <id> <name>} line plus its export metadata.
 */
@Value
@Builder(toBuilder = true)
public class ObjectHeader {
    @NonNull
    ObjectKind kind;
    int id;
    @NonNull
    String name;
    @NonNull
    @Builder.Default
    ObjectMetadata metadata = ObjectMetadata.EMPTY;

    public ObjectKey getKey() {
        return ObjectKey.of(kind, id);
    }

    public String describe() {
        return kind.getToken() + " " + id + " " + name;
    }
}
