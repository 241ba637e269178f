package com.calexport.indexer.model;

import lombok.Value;

/**
 * A {@code column(name;source)} or {@code filter(name;source)} call inside a data item.
 */
@Value
public class Column {
    String name;
    String sourceExpr;
    String dataItemName;
    boolean filter;
}
