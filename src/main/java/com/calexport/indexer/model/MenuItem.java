package com.calexport.indexer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * {@code MENUITEM(...)} or {@code SEPARATOR}. Folders ({@code IsFolder=Yes}) own the items of the
 * brace block that follows them.
 */
@Getter
@ToString
@EqualsAndHashCode
public class MenuItem implements HierarchyNode<MenuItem>, PropertyHolder {
    public static final String SEPARATOR = "SEPARATOR";

    /** Position in source order, starting at 1. */
    private final int id;
    private final String name;
    private final int level;
    private final boolean separator;
    private final boolean folder;
    private final ObjectKey runObject;
    private final List<Property> properties;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final List<MenuItem> children = new ArrayList<>();

    @Builder
    public MenuItem(int id, String name, int level, boolean separator, boolean folder, ObjectKey runObject,
                    List<Property> properties) {
        this.id = id;
        this.name = name;
        this.level = level;
        this.separator = separator;
        this.folder = folder;
        this.runObject = runObject;
        this.properties = properties != null ? List.copyOf(properties) : List.of();
    }

    public Optional<ObjectKey> runObject() {
        return Optional.ofNullable(runObject);
    }

    @Override
    public List<MenuItem> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public void addChild(MenuItem child) {
        children.add(child);
    }
}
