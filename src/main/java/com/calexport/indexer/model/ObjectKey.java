package com.calexport.indexer.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Identity of an object inside one export: ids are only unique per kind.
 */
@Value(staticConstructor = "of")
public class ObjectKey {
    @NonNull
    ObjectKind kind;
    int id;

    @Override
    public String toString() {
        return kind.getToken() + " " + id;
    }
}
