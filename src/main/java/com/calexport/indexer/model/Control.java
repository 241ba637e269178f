package com.calexport.indexer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A page (or form) control. Page controls carry an explicit indentation column which
 * becomes {@link #getLevel()}; classic form controls are flat.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Control implements HierarchyNode<Control>, PropertyHolder {
    private final int id;
    private final int level;
    private final String type;
    private final String name;
    private final String sourceExpr;
    private final Map<String, String> captions;
    private final List<Property> properties;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final List<Control> children = new ArrayList<>();

    @Builder
    public Control(int id, int level, String type, String name, String sourceExpr,
                   Map<String, String> captions, List<Property> properties) {
        this.id = id;
        this.level = level;
        this.type = type;
        this.name = name;
        this.sourceExpr = sourceExpr;
        this.captions = captions != null ? Collections.unmodifiableMap(new LinkedHashMap<>(captions)) : Map.of();
        this.properties = properties != null ? List.copyOf(properties) : List.of();
    }

    @Override
    public List<Control> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public void addChild(Control child) {
        children.add(child);
    }

    /**
     * Name if set, otherwise the source expression, otherwise the control id.
     */
    public String getDisplayName() {
        if (name != null) {
            return name;
        }
        return sourceExpr != null ? sourceExpr : String.valueOf(id);
    }
}
