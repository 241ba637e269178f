package com.calexport.indexer.parser.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RelationConstraintParser.
 */
class RelationConstraintParserTest {

    private final RelationConstraintParser parser = new RelationConstraintParser();

    @Test
    void testQuotedTargetWithWhereClause() {
        RelationConstraint relation = parser.parse("\"Payment Terms\" WHERE (Code=FIELD(Payment Terms Code))").orElseThrow();

        assertThat(relation.getTargetName()).isEqualTo("Payment Terms");
        assertThat(relation.fieldName()).isEmpty();
        assertThat(relation.getQualifier()).isEqualTo("WHERE (Code=FIELD(Payment Terms Code))");
        assertThat(relation.isConditional()).isFalse();
    }

    @Test
    void testBareTargetWithField() {
        RelationConstraint relation = parser.parse("Customer.\"No.\"").orElseThrow();

        assertThat(relation.getTargetName()).isEqualTo("Customer");
        assertThat(relation.fieldName()).hasValue("No.");
        assertThat(relation.getQualifier()).isNull();
    }

    @Test
    void testConditionalRelation() {
        RelationConstraint relation = parser.parse("""
            IF (Type=CONST(Customer)) Customer
                                 ELSE IF (Type=CONST(Vendor)) Vendor
            """).orElseThrow();

        assertThat(relation.isConditional()).isTrue();
        assertThat(relation.getCondition()).isEqualTo("Type=CONST(Customer)");
        assertThat(relation.getTargetName()).isEqualTo("Customer");
        assertThat(relation.getQualifier()).isEqualTo("ELSE IF (Type=CONST(Vendor)) Vendor");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "WHERE (Code=CONST(X))", "IF (Type=CONST(Customer)", "(broken"})
    void testUnreadableValuesYieldNothing(String raw) {
        assertThat(parser.parse(raw)).isEmpty();
    }
}
