package com.calexport.indexer.parser;

import com.calexport.indexer.Fixtures;
import com.calexport.indexer.model.Column;
import com.calexport.indexer.model.DataItem;
import com.calexport.indexer.model.ReportObject;
import com.calexport.indexer.parser.exception.MissingSectionException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ReportParser.
 */
class ReportParserTest {

    private final ReportParser parser = new ReportParser();

    @Test
    void testDataItemsNestByBraces() {
        ReportObject report = parser.parse(Fixtures.read("report-101-customer-list.txt"));

        assertThat(report.getName()).isEqualTo("Customer - List");
        assertThat(report.getDataItems()).extracting(DataItem::getName).containsExactly("Customer", "Integer");

        DataItem customer = report.getDataItems().get(0);
        assertThat(customer.getLevel()).isZero();
        assertThat(customer.getTableName()).isEqualTo("Customer");
        assertThat(customer.getTableId()).isEqualTo(18);
        assertThat(customer.getChildren()).hasSize(1);

        DataItem entries = customer.getChildren().get(0);
        assertThat(entries.getName()).isEqualTo("CustLedgerEntry");
        assertThat(entries.getTableName()).isEqualTo("Cust. Ledger Entry");
        assertThat(entries.getLevel()).isEqualTo(1);
        assertThat(entries.propertyValue("DataItemLink")).hasValue("Customer No.=FIELD(No.)");

        assertThat(report.getDataItems().get(1).getTableId()).isEqualTo(2000000026);
        assertThat(report.getAllDataItems()).extracting(DataItem::getName)
                .containsExactly("Customer", "CustLedgerEntry", "Integer");
    }

    @Test
    void testColumnsAreSeparatedFromProperties() {
        ReportObject report = parser.parse(Fixtures.read("report-101-customer-list.txt"));

        DataItem customer = report.getDataItems().get(0);
        assertThat(customer.getColumns()).extracting(Column::getName).containsExactly("No_Customer", "Name_Customer");
        assertThat(customer.getColumns()).extracting(Column::getSourceExpr).containsExactly("\"No.\"", "Name");
        assertThat(customer.getProperties()).extracting(p -> p.getName())
                .containsExactly("DataItemTable", "ReqFilterFields");

        assertThat(report.getColumns()).extracting(Column::getName)
                .containsExactly("No_Customer", "Name_Customer", "Amount_Entry");
        assertThat(report.getColumns().get(2).getDataItemName()).isEqualTo("CustLedgerEntry");
        assertThat(report.getColumns()).noneMatch(Column::isFilter);
    }

    @Test
    void testReportCode() {
        ReportObject report = parser.parse(Fixtures.read("report-101-customer-list.txt"));

        assertThat(report.getVariables()).hasSize(2);
        assertThat(report.findProcedure("FormatAddress"))
                .hasValueSatisfying(p -> assertThat(p.getBodyLines())
                        .containsExactly("EXIT(Cust.Name + ', ' + Cust.City);"));
        assertThat(report.propertyValue("CaptionML")).hasValue("ENU=Customer - List");
    }

    @Test
    void testMissingDataset() {
        String text = """
            OBJECT Report 50000 Empty
            {
              PROPERTIES
              {
              }
            }
            """;

        assertThatThrownBy(() -> parser.parse(text))
                .isInstanceOfSatisfying(MissingSectionException.class,
                        e -> assertThat(e.getSection()).isEqualTo("DATASET"));
    }
}
