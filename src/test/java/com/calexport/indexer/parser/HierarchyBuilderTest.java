package com.calexport.indexer.parser;

import com.calexport.indexer.model.HierarchyNode;
import com.calexport.indexer.parser.exception.MalformedHierarchyException;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for HierarchyBuilder.
 */
class HierarchyBuilderTest {

    private final HierarchyBuilder builder = new HierarchyBuilder();

    @Test
    void testPreOrderWalkRecoversInput() {
        List<Node> flat = nodes("A:0", "B:1", "C:2", "D:2", "E:1", "F:0", "G:1");

        List<Node> roots = builder.build(flat);

        assertThat(roots).extracting(Node::toString).containsExactly("A", "F");
        assertThat(HierarchyNode.flatten(roots)).containsExactlyElementsOf(flat);
    }

    @Test
    void testChildrenAttachToNearestShallowerItem() {
        List<Node> roots = builder.build(nodes("A:0", "B:1", "C:2", "D:3", "E:1"));

        Node a = roots.get(0);
        assertThat(a.getChildren()).extracting(Node::toString).containsExactly("B", "E");
        assertThat(a.getChildren().get(0).getChildren()).extracting(Node::toString).containsExactly("C");
        assertThat(a.getChildren().get(0).getChildren().get(0).getChildren())
                .extracting(Node::toString).containsExactly("D");
    }

    @Test
    void testMultiLevelDecreaseReturnsToRoot() {
        List<Node> roots = builder.build(nodes("A:0", "B:1", "C:2", "D:3", "E:0"));

        assertThat(roots).extracting(Node::toString).containsExactly("A", "E");
        assertThat(roots.get(1).getChildren()).isEmpty();
    }

    @Test
    void testFlatListStaysFlat() {
        List<Node> roots = builder.build(nodes("A:0", "B:0", "C:0"));

        assertThat(roots).hasSize(3);
        assertThat(roots).allSatisfy(n -> assertThat(n.getChildren()).isEmpty());
    }

    @Test
    void testEmptyInput() {
        assertThat(builder.build(new ArrayList<Node>())).isEmpty();
    }

    @Test
    void testFirstItemMustBeAtLevelZero() {
        List<Node> flat = nodes("A:1", "B:2");

        assertThatThrownBy(() -> builder.build(flat, n -> "node " + n))
                .isInstanceOf(MalformedHierarchyException.class)
                .hasMessageContaining("node A");
    }

    private static List<Node> nodes(String... specs) {
        List<Node> out = new ArrayList<>();
        for (String spec : specs) {
            String[] parts = spec.split(":");
            out.add(new Node(parts[0], Integer.parseInt(parts[1])));
        }
        return out;
    }

    private static final class Node implements HierarchyNode<Node> {
        private final String name;
        private final int level;
        private final List<Node> children = new ArrayList<>();

        Node(String name, int level) {
            this.name = name;
            this.level = level;
        }

        @Override
        public int getLevel() {
            return level;
        }

        @Override
        public List<Node> getChildren() {
            return children;
        }

        @Override
        public void addChild(Node child) {
            children.add(child);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
