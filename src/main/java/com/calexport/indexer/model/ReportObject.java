package com.calexport.indexer.model;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ReportObject extends CodeBearingObject {
    private final List<DataItem> dataItems;
    /** Every column of every data item, in source order. */
    private final List<Column> columns;

    @Builder
    public ReportObject(ObjectHeader header, List<Property> properties, List<Variable> variables,
                        List<Procedure> procedures, List<DataItem> dataItems, List<Column> columns) {
        super(header, properties, variables, procedures);
        this.dataItems = dataItems != null ? List.copyOf(dataItems) : List.of();
        this.columns = columns != null ? List.copyOf(columns) : List.of();
    }

    public List<DataItem> getAllDataItems() {
        return HierarchyNode.flatten(dataItems);
    }

    @Override
    public <R> R accept(CalObjectVisitor<R> visitor) {
        return visitor.visitReport(this);
    }
}
