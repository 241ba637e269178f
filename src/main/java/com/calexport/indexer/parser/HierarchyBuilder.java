package com.calexport.indexer.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

import com.calexport.indexer.model.HierarchyNode;
import com.calexport.indexer.parser.exception.MalformedHierarchyException;

/**
 * Turns a flat, source-ordered list of levelled items into a forest.
 *
 * Single pass with a stack: pop while the top is at the same or a deeper level, attach to
 * whatever is left on top, push. An item that finds the stack empty must be at level 0.
 */
public class HierarchyBuilder {

    public <T extends HierarchyNode<T>> List<T> build(List<T> items) {
        return build(items, String::valueOf);
    }

    public <T extends HierarchyNode<T>> List<T> build(List<T> items, Function<T, String> label) {
        List<T> roots = new ArrayList<>();
        Deque<T> stack = new ArrayDeque<>();
        for (T item : items) {
            int level = item.getLevel();
            while (!stack.isEmpty() && stack.peek().getLevel() >= level) {
                stack.pop();
            }
            if (stack.isEmpty()) {
                if (level != 0) {
                    throw new MalformedHierarchyException(level, label.apply(item));
                }
                roots.add(item);
            } else {
                stack.peek().addChild(item);
            }
            stack.push(item);
        }
        return roots;
    }
}
