package com.calexport.indexer.model;

/**
 * How a raw property value reads.
 */
public enum PropertyType {
    TEXT,
    BOOLEAN,
    NUMBER,
    /** Trigger body: {@code BEGIN ... END} or {@code VAR ... BEGIN ... END}. */
    CODE
}
