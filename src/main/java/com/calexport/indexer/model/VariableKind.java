package com.calexport.indexer.model;

/**
 * Which payload a {@link Variable} carries.
 */
public enum VariableKind {
    /** {@code Record 18}, {@code Codeunit 80}. */
    OBJECT_ID,
    /** {@code Record "G/L Account"}, {@code Record Customer}. */
    OBJECT_NAME,
    /** {@code DotNet "'assembly'.Type.Path"} and Automation. */
    EXTERNAL_TYPE,
    /** {@code TextConst 'ENU=...;@@@=...'}. */
    LOCALIZED_TEXT,
    /** Simple types such as {@code Code[20]}, or a payload that could not be read. */
    PLAIN
}
