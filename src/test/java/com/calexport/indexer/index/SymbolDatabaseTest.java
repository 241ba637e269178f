package com.calexport.indexer.index;

import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.model.CodeunitObject;
import com.calexport.indexer.model.Field;
import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKey;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.Procedure;
import com.calexport.indexer.model.TableObject;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SymbolDatabase.
 */
class SymbolDatabaseTest {

    private SymbolDatabase database;

    @BeforeEach
    void setUp() {
        database = new SymbolDatabase();
    }

    @Test
    void testLookupByIdAndName() {
        database.insert(table(18, "Customer", 3));
        database.insert(codeunit(18, "Customer Mgt.", 0));

        assertThat(database.getById(ObjectKind.TABLE, 18)).map(CalObject::getName).hasValue("Customer");
        assertThat(database.getById(ObjectKind.CODEUNIT, 18)).map(CalObject::getName).hasValue("Customer Mgt.");
        assertThat(database.getById(ObjectKind.PAGE, 18)).isEmpty();
        assertThat(database.getByName(ObjectKind.TABLE, "CUSTOMER")).map(CalObject::getId).hasValue(18);
        assertThat(database.getByName(ObjectKind.PAGE, "Customer")).isEmpty();
        assertThat(database.getByName(null, "customer mgt.")).map(CalObject::getKind).hasValue(ObjectKind.CODEUNIT);
        assertThat(database.size()).isEqualTo(2);
    }

    @Test
    void testGetByIdOrName() {
        database.insert(table(3, "Payment Terms", 0));
        database.insert(table(4, "1099", 0));

        assertThat(database.getByIdOrName(ObjectKind.TABLE, "3")).map(CalObject::getName).hasValue("Payment Terms");
        assertThat(database.getByIdOrName(ObjectKind.TABLE, " payment terms ")).map(CalObject::getId).hasValue(3);
        assertThat(database.getByIdOrName(ObjectKind.TABLE, "1099")).map(CalObject::getId).hasValue(4);
        assertThat(database.getByIdOrName(ObjectKind.TABLE, "99999999999")).isEmpty();
        assertThat(database.getByIdOrName(ObjectKind.TABLE, " ")).isEmpty();
        assertThat(database.getByIdOrName(ObjectKind.TABLE, null)).isEmpty();
    }

    @Test
    void testSearchIsCaseInsensitive() {
        database.insert(table(18, "Customer", 0));
        database.insert(table(21, "Cust. Ledger Entry", 0));
        database.insert(table(23, "Vendor", 0));

        assertThat(database.search("CUST*")).extracting(CalObject::getName)
                .containsExactly("Customer", "Cust. Ledger Entry");
        assertThat(database.search("cust*")).extracting(CalObject::getName)
                .containsExactly("Customer", "Cust. Ledger Entry");
    }

    @Test
    void testSearchWithInnerWildcard() {
        database.insert(table(36, "Sales Header", 0));
        database.insert(table(37, "Sales Line", 0));
        database.insert(table(110, "Sales Shipment Header", 0));
        database.insert(table(38, "Purchase Header", 0));

        assertThat(database.search("Sales*Header")).extracting(CalObject::getId).containsExactly(36, 110);
        assertThat(database.search("Header*Sales")).isEmpty();
    }

    @Test
    void testSearchByKind() {
        database.insert(table(18, "Customer", 0));
        database.insert(codeunit(80, "Sales-Post", 0));

        assertThat(database.search("*", ObjectKind.CODEUNIT, 0, 0)).extracting(CalObject::getId).containsExactly(80);
        assertThat(database.count("*", ObjectKind.TABLE)).isEqualTo(1);
        assertThat(database.count(null, null)).isEqualTo(2);
    }

    @Test
    void testPagesDoNotOverlap() {
        IntStream.rangeClosed(1, 10).forEach(i -> database.insert(table(i, "Item " + i, 0)));

        List<CalObject> first = database.search("Item*", null, 5, 0);
        List<CalObject> second = database.search("Item*", null, 5, 5);

        assertThat(first).extracting(CalObject::getId).containsExactly(1, 2, 3, 4, 5);
        assertThat(second).extracting(CalObject::getId).containsExactly(6, 7, 8, 9, 10);
        assertThat(database.search("Item*", null, 5, 10)).isEmpty();
        assertThat(database.search("Item*", null, 0, 8)).hasSize(2);
    }

    @Test
    void testReinsertReplaces() {
        database.insert(table(18, "Customer", 2));
        database.insert(table(23, "Vendor", 0));
        database.insert(table(18, "Debitor", 5));

        assertThat(database.size()).isEqualTo(2);
        assertThat(database.getByName(ObjectKind.TABLE, "Customer")).isEmpty();
        assertThat(database.getByName(ObjectKind.TABLE, "Debitor")).isPresent();
        assertThat(database.getFields(18)).hasSize(5);
        assertThat(database.all()).extracting(CalObject::getName).containsExactly("Debitor", "Vendor");
    }

    @Test
    void testFieldsAndProcedures() {
        database.insert(table(18, "Customer", 3));
        database.insert(codeunit(80, "Sales-Post", 2));

        assertThat(database.getFields(18)).extracting(Field::getName).containsExactly("Field 1", "Field 2", "Field 3");
        assertThat(database.getFields(99)).isEmpty();
        assertThat(database.getProcedures(ObjectKey.of(ObjectKind.CODEUNIT, 80)))
                .extracting(Procedure::getName).containsExactly("Proc1", "Proc2");
        assertThat(database.getProcedures(ObjectKey.of(ObjectKind.TABLE, 80))).isEmpty();
    }

    @Test
    void testSummaryTruncatesToPrefix() {
        database.insert(table(18, "Customer", 12));

        ObjectSummary summary = database.summarize(ObjectKind.TABLE, 18).orElseThrow();

        assertThat(summary.getHeader().getName()).isEqualTo("Customer");
        assertThat(summary.getFields()).hasSize(SymbolDatabase.DEFAULT_SUMMARY_PREFIX);
        assertThat(summary.getFieldCount()).isEqualTo(12);
        assertThat(summary.isFieldListTruncated()).isTrue();
        assertThat(summary.getProcedureCount()).isZero();
        assertThat(summary.isProcedureListTruncated()).isFalse();

        ObjectSummary brief = database.summarize(ObjectKind.TABLE, 18, 3).orElseThrow();
        assertThat(brief.getFields()).extracting(Field::getId).containsExactly(1, 2, 3);
        assertThat(database.summarize(ObjectKind.PAGE, 18)).isEmpty();
    }

    @Test
    void testCountByKindAndClear() {
        database.insert(table(18, "Customer", 0));
        database.insert(table(23, "Vendor", 0));
        database.insert(codeunit(80, "Sales-Post", 0));

        assertThat(database.countByKind())
                .containsEntry(ObjectKind.TABLE, 2)
                .containsEntry(ObjectKind.CODEUNIT, 1)
                .doesNotContainKey(ObjectKind.PAGE);
        assertThat(database.all(ObjectKind.TABLE)).hasSize(2);

        database.clear();

        assertThat(database.size()).isZero();
        assertThat(database.countByKind()).isEmpty();
        assertThat(database.getFields(18)).isEmpty();
        assertThat(database.search("*")).isEmpty();
    }

    private static TableObject table(int id, String name, int fieldCount) {
        List<Field> fields = IntStream.rangeClosed(1, fieldCount)
                .mapToObj(i -> Field.builder().id(i).name("Field " + i).dataType("Integer").build())
                .toList();
        return TableObject.builder()
                .header(ObjectHeader.builder().kind(ObjectKind.TABLE).id(id).name(name).build())
                .fields(fields)
                .build();
    }

    private static CodeunitObject codeunit(int id, String name, int procedureCount) {
        List<Procedure> procedures = IntStream.rangeClosed(1, procedureCount)
                .mapToObj(i -> Procedure.builder().id(i).name("Proc" + i).build())
                .toList();
        return CodeunitObject.builder()
                .header(ObjectHeader.builder().kind(ObjectKind.CODEUNIT).id(id).name(name).build())
                .procedures(procedures)
                .build();
    }
}
