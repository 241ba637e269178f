package com.calexport.indexer.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A {@code Name@id : Type;} declaration. Only the payload fields matching {@link #getKind()} are set.
 */
@Value
@Builder
public class Variable {
    String name;
    int id;
    /** Everything after the colon, modifiers included. */
    String declaredType;
    /** Leading type word: Record, Code, DotNet, TextConst, ... */
    String typeTag;
    @Builder.Default
    VariableKind kind = VariableKind.PLAIN;
    boolean temporary;
    boolean byRef;
    /** Declared length of sized types such as {@code Text[50]}. */
    Integer length;
    @Singular
    List<Integer> dimensions;

    Integer objectId;
    String objectName;

    String assembly;
    String typePath;

    @Singular("text")
    Map<String, String> texts;
    String translatorComment;

    /**
     * The object kind an id/name payload points at, for Record and the other object-typed variables.
     */
    public Optional<ObjectKind> referencedKind() {
        if (kind != VariableKind.OBJECT_ID && kind != VariableKind.OBJECT_NAME) {
            return Optional.empty();
        }
        return targetKindOf(typeTag);
    }

    public static Optional<ObjectKind> targetKindOf(String typeTag) {
        if (typeTag == null) {
            return Optional.empty();
        }
        if (typeTag.equalsIgnoreCase("Record")) {
            return Optional.of(ObjectKind.TABLE);
        }
        return ObjectKind.parse(typeTag).filter(k -> k != ObjectKind.TABLE && k != ObjectKind.MENUSUITE);
    }

    public boolean isArray() {
        return !dimensions.isEmpty();
    }
}
