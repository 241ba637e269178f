package com.calexport.indexer.parser.grammar;

import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.Parameter;
import com.calexport.indexer.model.Variable;
import com.calexport.indexer.model.VariableKind;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VariableDeclarationParser.
 */
class VariableDeclarationParserTest {

    private final VariableDeclarationParser parser = new VariableDeclarationParser();

    @Test
    void testRecordById() {
        Variable v = parser.parse("Cust@1000 : Record 18;").orElseThrow();

        assertThat(v.getName()).isEqualTo("Cust");
        assertThat(v.getId()).isEqualTo(1000);
        assertThat(v.getKind()).isEqualTo(VariableKind.OBJECT_ID);
        assertThat(v.getTypeTag()).isEqualTo("Record");
        assertThat(v.getObjectId()).isEqualTo(18);
        assertThat(v.referencedKind()).hasValue(ObjectKind.TABLE);
    }

    @Test
    void testRecordByQuotedName() {
        Variable v = parser.parse("GLAcc@1001 : Record \"G/L Account\"").orElseThrow();

        assertThat(v.getKind()).isEqualTo(VariableKind.OBJECT_NAME);
        assertThat(v.getObjectName()).isEqualTo("G/L Account");
        assertThat(v.getObjectId()).isNull();
    }

    @Test
    void testTemporaryRecord() {
        Variable prefixed = parser.parse("TempBuf@1002 : TEMPORARY Record 379").orElseThrow();
        Variable suffixed = parser.parse("TempBuf@1002 : Record 379 TEMPORARY").orElseThrow();

        assertThat(prefixed.isTemporary()).isTrue();
        assertThat(prefixed.getObjectId()).isEqualTo(379);
        assertThat(suffixed.isTemporary()).isTrue();
        assertThat(suffixed.getObjectId()).isEqualTo(379);
        assertThat(prefixed.getDeclaredType()).isEqualTo("TEMPORARY Record 379");
    }

    @Test
    void testSystemTableIds() {
        Variable v = parser.parse("Int@1000 : Record 2000000026").orElseThrow();

        assertThat(v.getObjectId()).isEqualTo(2000000026);
    }

    @Test
    void testOtherObjectTypes() {
        Variable codeunit = parser.parse("SalesPost@1000 : Codeunit 80").orElseThrow();
        Variable page = parser.parse("CustCard@1001 : Page \"Customer Card\"").orElseThrow();

        assertThat(codeunit.referencedKind()).hasValue(ObjectKind.CODEUNIT);
        assertThat(page.referencedKind()).hasValue(ObjectKind.PAGE);
        assertThat(page.getObjectName()).isEqualTo("Customer Card");
    }

    @Test
    void testDotNet() {
        Variable v = parser.parse(
                "Str@1003 : DotNet \"'mscorlib, Version=4.0.0.0, Culture=neutral'.System.String\" RUNONCLIENT").orElseThrow();

        assertThat(v.getKind()).isEqualTo(VariableKind.EXTERNAL_TYPE);
        assertThat(v.getTypeTag()).isEqualTo("DotNet");
        assertThat(v.getAssembly()).isEqualTo("mscorlib, Version=4.0.0.0, Culture=neutral");
        assertThat(v.getTypePath()).isEqualTo("System.String");
        assertThat(v.referencedKind()).isEmpty();
    }

    @Test
    void testTextConst() {
        Variable v = parser.parse("Text000@1004 : TextConst 'ENU=Posting %1;DEU=Buchen %1;@@@=%1 = document no.'")
                .orElseThrow();

        assertThat(v.getKind()).isEqualTo(VariableKind.LOCALIZED_TEXT);
        assertThat(v.getTexts()).containsExactly(entry("ENU", "Posting %1"), entry("DEU", "Buchen %1"));
        assertThat(v.getTranslatorComment()).isEqualTo("%1 = document no.");
    }

    @Test
    void testTextConstWithEscapedQuote() {
        Variable v = parser.parse("Text001@1005 : TextConst 'ENU=Can''t post'").orElseThrow();

        assertThat(v.getTexts()).containsEntry("ENU", "Can't post");
    }

    @Test
    void testArray() {
        Variable v = parser.parse("Amounts@1005 : ARRAY [2,4] OF Decimal").orElseThrow();

        assertThat(v.isArray()).isTrue();
        assertThat(v.getDimensions()).containsExactly(2, 4);
        assertThat(v.getTypeTag()).isEqualTo("Decimal");
    }

    @Test
    void testSimpleTypes() {
        Variable code = parser.parse("No@1006 : Code[20]").orElseThrow();
        Variable option = parser.parse("Status@1007 : 'Open,Released'").orElseThrow();

        assertThat(code.getKind()).isEqualTo(VariableKind.PLAIN);
        assertThat(code.getTypeTag()).isEqualTo("Code");
        assertThat(code.getLength()).isEqualTo(20);
        assertThat(option.getTypeTag()).isEqualTo("Option");
    }

    @Test
    void testUnreadableDeclaration() {
        assertThat(parser.parse("this is not a declaration")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void testBlockKeepsQuotedSeparators() {
        List<Variable> variables = parser.parseBlock("""
              Cust@1000 : Record 18;
              Text000@1001 : TextConst 'ENU=a;DEU=b';
              "Sales Header"@1002 : Record 36;
              garbage;
            """);

        assertThat(variables).extracting(Variable::getName).containsExactly("Cust", "Text000", "Sales Header");
    }

    @Test
    void testParameters() {
        List<Parameter> parameters = parser.parseParameters(
                "VAR SalesHeader@1000 : Record 36;Preview@1001 : Boolean;VAR TempLine@1002 : TEMPORARY Record 37");

        assertThat(parameters).extracting(Parameter::getName).containsExactly("SalesHeader", "Preview", "TempLine");
        assertThat(parameters).extracting(Parameter::isByRef).containsExactly(true, false, true);
        assertThat(parameters.get(2).isTemporary()).isTrue();
        assertThat(parameters.get(0).getType()).isEqualTo("Record 36");
    }
}
