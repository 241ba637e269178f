package com.calexport.indexer.model;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class XmlPortObject extends CodeBearingObject {
    private final List<PortNode> nodes;

    @Builder
    public XmlPortObject(ObjectHeader header, List<Property> properties, List<Variable> variables,
                         List<Procedure> procedures, List<PortNode> nodes) {
        super(header, properties, variables, procedures);
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
    }

    public List<PortNode> getAllNodes() {
        return HierarchyNode.flatten(nodes);
    }

    @Override
    public <R> R accept(CalObjectVisitor<R> visitor) {
        return visitor.visitXmlPort(this);
    }
}
