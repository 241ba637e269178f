package com.calexport.indexer.model;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class QueryObject extends CodeBearingObject {
    private final List<DataItem> dataItems;
    private final List<Column> columns;
    private final List<Column> filters;

    @Builder
    public QueryObject(ObjectHeader header, List<Property> properties, List<Variable> variables,
                       List<Procedure> procedures, List<DataItem> dataItems, List<Column> columns,
                       List<Column> filters) {
        super(header, properties, variables, procedures);
        this.dataItems = dataItems != null ? List.copyOf(dataItems) : List.of();
        this.columns = columns != null ? List.copyOf(columns) : List.of();
        this.filters = filters != null ? List.copyOf(filters) : List.of();
    }

    public List<DataItem> getAllDataItems() {
        return HierarchyNode.flatten(dataItems);
    }

    @Override
    public <R> R accept(CalObjectVisitor<R> visitor) {
        return visitor.visitQuery(this);
    }
}
