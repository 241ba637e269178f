package com.calexport.indexer.reference;

import java.util.Optional;

import com.calexport.indexer.model.ObjectKey;
import com.calexport.indexer.model.ObjectKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Directed edge from a location inside one object to another object.
 *
 * The target is known by id, by name, or both; {@code targetName} always holds something
 * printable (the id as text when only the id is known).
 */
@Value
@Builder
public class Reference {
    @NonNull
    ObjectKind sourceKind;
    int sourceId;
    @NonNull
    String sourceName;
    /** {@code Field:Customer No.}, {@code Variable:Cust}, {@code Procedure:Post/Variable:GLEntry}, ... */
    @NonNull
    String sourceLocation;

    @NonNull
    ObjectKind targetKind;
    Integer targetId;
    @NonNull
    String targetName;
    String targetField;

    @NonNull
    ReferenceType referenceType;

    public ObjectKey getSourceKey() {
        return ObjectKey.of(sourceKind, sourceId);
    }

    public Optional<ObjectKey> targetKey() {
        return targetId == null ? Optional.empty() : Optional.of(ObjectKey.of(targetKind, targetId));
    }

    public Optional<String> targetField() {
        return Optional.ofNullable(targetField);
    }

    public String describe() {
        String target = targetId != null && !targetName.equals(String.valueOf(targetId))
                ? targetId + " " + targetName
                : targetName;
        return sourceKind + " " + sourceId + " " + sourceName + " [" + sourceLocation + "] -"
                + referenceType.getLabel() + "-> " + targetKind + " " + target;
    }
}
