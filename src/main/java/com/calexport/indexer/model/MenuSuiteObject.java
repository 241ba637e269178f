package com.calexport.indexer.model;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class MenuSuiteObject extends CalObject {
    private final List<MenuItem> menuItems;

    @Builder
    public MenuSuiteObject(ObjectHeader header, List<Property> properties, List<MenuItem> menuItems) {
        super(header, properties);
        this.menuItems = menuItems != null ? List.copyOf(menuItems) : List.of();
    }

    public List<MenuItem> getAllMenuItems() {
        return HierarchyNode.flatten(menuItems);
    }

    @Override
    public <R> R accept(CalObjectVisitor<R> visitor) {
        return visitor.visitMenuSuite(this);
    }
}
