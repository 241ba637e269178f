package com.calexport.indexer.parser;

import com.calexport.indexer.Fixtures;
import com.calexport.indexer.model.PortNode;
import com.calexport.indexer.model.PortNodeType;
import com.calexport.indexer.model.XmlPortObject;
import com.calexport.indexer.parser.exception.MissingSectionException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for XmlPortParser.
 */
class XmlPortParserTest {

    private final XmlPortParser parser = new XmlPortParser();

    @Test
    void testNodesNestByBraces() {
        XmlPortObject port = parser.parse(Fixtures.read("xmlport-1225-customer-export.txt"));

        assertThat(port.getNodes()).extracting(PortNode::getName).containsExactly("Root");
        assertThat(port.getAllNodes()).extracting(PortNode::getName)
                .containsExactly("Root", "Customer", "No", "Name", "Terms", "Code");
        assertThat(port.getAllNodes()).extracting(PortNode::getLevel)
                .containsExactly(0, 1, 2, 2, 2, 3);
    }

    @Test
    void testNodeDetails() {
        XmlPortObject port = parser.parse(Fixtures.read("xmlport-1225-customer-export.txt"));

        PortNode customer = port.getAllNodes().get(1);
        assertThat(customer.getNodeType()).isEqualTo(PortNodeType.ELEMENT);
        assertThat(customer.getSourceTable()).isEqualTo("\"Customer\"");
        assertThat(customer.getSourceTableId()).isNull();

        PortNode no = port.getAllNodes().get(2);
        assertThat(no.getNodeType()).isEqualTo(PortNodeType.FIELD);
        assertThat(no.getSourceField()).isEqualTo("\"Customer\".\"No.\"");

        PortNode terms = port.getAllNodes().get(4);
        assertThat(terms.getSourceTableId()).isEqualTo(3);

        PortNode code = port.getAllNodes().get(5);
        assertThat(code.getNodeType()).isEqualTo(PortNodeType.ATTRIBUTE);
    }

    @Test
    void testPropertiesAndCode() {
        XmlPortObject port = parser.parse(Fixtures.read("xmlport-1225-customer-export.txt"));

        assertThat(port.propertyValue("Direction")).hasValue("Export");
        assertThat(port.getVariables()).hasSize(1);
        assertThat(port.getProcedures()).isEmpty();
    }

    @Test
    void testMissingElements() {
        String text = """
            OBJECT XMLport 50000 Empty
            {
              PROPERTIES
              {
              }
            }
            """;

        assertThatThrownBy(() -> parser.parse(text))
                .isInstanceOf(MissingSectionException.class)
                .hasMessageContaining("ELEMENTS");
    }
}
