package com.calexport.indexer.parser;

import com.calexport.indexer.Fixtures;
import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.model.CodeunitObject;
import com.calexport.indexer.model.MenuSuiteObject;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.PageObject;
import com.calexport.indexer.model.QueryObject;
import com.calexport.indexer.model.ReportObject;
import com.calexport.indexer.model.TableObject;
import com.calexport.indexer.model.XmlPortObject;
import com.calexport.indexer.parser.exception.InvalidDeclarationException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ObjectParser dispatch.
 */
class ObjectParserTest {

    private final ObjectParser parser = new ObjectParser();

    @ParameterizedTest
    @CsvSource({
            "table-3-payment-terms.txt, TABLE, 3",
            "table-18-customer.txt, TABLE, 18",
            "page-21-customer-card.txt, PAGE, 21",
            "form-22-customer-list.txt, FORM, 22",
            "codeunit-80-sales-post.txt, CODEUNIT, 80",
            "report-101-customer-list.txt, REPORT, 101",
            "query-9150-payment-terms.txt, QUERY, 9150",
            "xmlport-1225-customer-export.txt, XMLPORT, 1225",
            "menusuite-1010-dept.txt, MENUSUITE, 1010"
    })
    void testDispatchByKind(String fixture, ObjectKind kind, int id) {
        CalObject object = parser.parse(Fixtures.read(fixture));

        assertThat(object.getKind()).isEqualTo(kind);
        assertThat(object.getId()).isEqualTo(id);
        Class<?> expected = switch (kind) {
            case TABLE -> TableObject.class;
            case PAGE, FORM -> PageObject.class;
            case CODEUNIT -> CodeunitObject.class;
            case REPORT -> ReportObject.class;
            case QUERY -> QueryObject.class;
            case XMLPORT -> XmlPortObject.class;
            case MENUSUITE -> MenuSuiteObject.class;
        };
        assertThat(object).isInstanceOf(expected);
    }

    @Test
    void testInvalidHeader() {
        assertThatThrownBy(() -> parser.parse("OBJECT Dataport 5 Old Stuff\n{\n}\n"))
                .isInstanceOf(InvalidDeclarationException.class)
                .hasMessageContaining("unknown object kind Dataport");
    }
}
