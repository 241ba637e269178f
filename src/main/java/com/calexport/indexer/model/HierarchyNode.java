package com.calexport.indexer.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of a tree-shaped section (controls, data items, port nodes, menu items).
 * Children are attached once, while the section is being parsed.
 */
public interface HierarchyNode<T extends HierarchyNode<T>> {

    int getLevel();

    List<T> getChildren();

    void addChild(T child);

    /**
     * Pre-order walk over a forest, siblings in source order.
     */
    static <T extends HierarchyNode<T>> List<T> flatten(List<T> roots) {
        List<T> out = new ArrayList<>();
        for (T root : roots) {
            collect(root, out);
        }
        return out;
    }

    private static <T extends HierarchyNode<T>> void collect(T node, List<T> out) {
        out.add(node);
        for (T child : node.getChildren()) {
            collect(child, out);
        }
    }
}
