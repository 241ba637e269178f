package com.calexport.indexer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * XMLport {@code ELEMENT} declaration.
 */
@Getter
@ToString
@EqualsAndHashCode
public class PortNode implements HierarchyNode<PortNode>, PropertyHolder {
    private final String name;
    private final PortNodeType nodeType;
    private final int level;
    /** SourceTable as written, e.g. {@code "Customer"} or {@code Table18}. */
    private final String sourceTable;
    private final Integer sourceTableId;
    private final String sourceField;
    private final List<Property> properties;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final List<PortNode> children = new ArrayList<>();

    @Builder
    public PortNode(String name, PortNodeType nodeType, int level, String sourceTable, Integer sourceTableId,
                    String sourceField, List<Property> properties) {
        this.name = name;
        this.nodeType = nodeType;
        this.level = level;
        this.sourceTable = sourceTable;
        this.sourceTableId = sourceTableId;
        this.sourceField = sourceField;
        this.properties = properties != null ? List.copyOf(properties) : List.of();
    }

    @Override
    public List<PortNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public void addChild(PortNode child) {
        children.add(child);
    }
}
