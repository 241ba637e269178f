package com.calexport.indexer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Report or query data item, bound to a table by name and optionally by id.
 */
@Getter
@ToString
@EqualsAndHashCode
public class DataItem implements HierarchyNode<DataItem>, PropertyHolder {
    private final String name;
    private final String tableName;
    private final Integer tableId;
    private final int level;
    private final List<Property> properties;
    private final List<Column> columns;
    private final List<Column> filters;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final List<DataItem> children = new ArrayList<>();

    @Builder
    public DataItem(String name, String tableName, Integer tableId, int level,
                    List<Property> properties, List<Column> columns, List<Column> filters) {
        this.name = name;
        this.tableName = tableName;
        this.tableId = tableId;
        this.level = level;
        this.properties = properties != null ? List.copyOf(properties) : List.of();
        this.columns = columns != null ? List.copyOf(columns) : List.of();
        this.filters = filters != null ? List.copyOf(filters) : List.of();
    }

    @Override
    public List<DataItem> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public void addChild(DataItem child) {
        children.add(child);
    }
}
