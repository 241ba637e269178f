package com.calexport.indexer.parser;

import com.calexport.indexer.parser.exception.MissingSectionException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SectionExtractor.
 */
class SectionExtractorTest {

    private static final String TABLE = """
        OBJECT Table 3 Payment Terms
        {
          OBJECT-PROPERTIES
          {
            Date=25.10.16;
          }
          PROPERTIES
          {
            CaptionML=ENU=Payment Terms;
          }
          FIELDS
          {
            { 1   ;   ;Code                ;Code10         }
          }
          FIELDGROUPS
          {
            { 1   ;Brick               ;Code }
          }
        }
        """;

    private final SectionExtractor extractor = new SectionExtractor();

    @Test
    void testPropertiesIsNotFoundInsideObjectProperties() {
        Section section = extractor.extract(TABLE, "PROPERTIES");

        assertThat(section.getBody()).contains("CaptionML=ENU=Payment Terms;");
        assertThat(section.getBody()).doesNotContain("Date=");
    }

    @Test
    void testFieldsIsNotConfusedWithFieldGroups() {
        Section section = extractor.extract(TABLE, "FIELDS");

        assertThat(section.getBody()).contains("Code10");
        assertThat(section.getBody()).doesNotContain("Brick");
    }

    @Test
    void testTextRunsFromKeywordToMatchingBrace() {
        Section section = extractor.extract(TABLE, "FIELDGROUPS");

        assertThat(section.getText()).startsWith("FIELDGROUPS");
        assertThat(section.getText()).endsWith("}");
        assertThat(section.getBody().trim()).isEqualTo("{ 1   ;Brick               ;Code }");
    }

    @Test
    void testMissingSectionNamesTheKeyword() {
        assertThatThrownBy(() -> extractor.extract(TABLE, "KEYS"))
                .isInstanceOf(MissingSectionException.class)
                .hasMessageContaining("KEYS")
                .extracting(e -> ((MissingSectionException) e).getSection())
                .isEqualTo("KEYS");
    }

    @Test
    void testUnterminatedSectionIsMissing() {
        String text = """
            OBJECT Codeunit 1 Test
            {
              CODE
              {
                BEGIN
            """;

        assertThat(extractor.find(text, "CODE")).isEmpty();
        assertThatThrownBy(() -> extractor.extract(text, "CODE"))
                .isInstanceOf(MissingSectionException.class);
    }

    @Test
    void testBraceInsideStringDoesNotMoveSectionEnd() {
        String text = """
            OBJECT Codeunit 50000 Braces
            {
              CODE
              {
                PROCEDURE Open@1() : Text;
                BEGIN
                  EXIT('{');
                END;

                BEGIN
                END.
              }
            }
            """;

        Section section = extractor.extract(text, "CODE");

        assertThat(section.getBody()).contains("EXIT('{');");
        assertThat(section.getBody().trim()).endsWith("END.");
    }

    @Test
    void testFindEmbeddedAction() {
        String properties = """
            SourceTable=Table18;
            ActionList=ACTIONS
            {
              { 1 ;0 ;ActionContainer }
            }
            """;

        assertThat(extractor.find(properties, "ACTIONS")).isEmpty();
        assertThat(extractor.findEmbedded(properties, "ACTIONS"))
                .hasValueSatisfying(s -> assertThat(s.getBody()).contains("ActionContainer"));
    }
}
