package com.calexport.indexer.parser;

import com.calexport.indexer.Fixtures;
import com.calexport.indexer.model.MenuItem;
import com.calexport.indexer.model.MenuSuiteObject;
import com.calexport.indexer.model.ObjectKey;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.parser.exception.ObjectParseException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MenuSuiteParser.
 */
class MenuSuiteParserTest {

    private final MenuSuiteParser parser = new MenuSuiteParser();

    @Test
    void testFolderOwnsFollowingBlock() {
        MenuSuiteObject suite = parser.parse(Fixtures.read("menusuite-1010-dept.txt"));

        assertThat(suite.getName()).isEqualTo("Dept - Financial Management");
        assertThat(suite.getMenuItems()).extracting(MenuItem::getName).containsExactly("Setup", "Sales-Post");

        MenuItem setup = suite.getMenuItems().get(0);
        assertThat(setup.isFolder()).isTrue();
        assertThat(setup.getChildren()).extracting(MenuItem::getName)
                .containsExactly("Payment Terms", MenuItem.SEPARATOR, "Customers");
        assertThat(setup.getChildren()).allSatisfy(c -> assertThat(c.getLevel()).isEqualTo(1));
    }

    @Test
    void testItemsAreNumberedInSourceOrder() {
        MenuSuiteObject suite = parser.parse(Fixtures.read("menusuite-1010-dept.txt"));

        assertThat(suite.getAllMenuItems()).extracting(MenuItem::getId).containsExactly(1, 2, 3, 4, 5);
        MenuItem separator = suite.getAllMenuItems().get(2);
        assertThat(separator.isSeparator()).isTrue();
        assertThat(separator.runObject()).isEmpty();
    }

    @Test
    void testRunObjects() {
        MenuSuiteObject suite = parser.parse(Fixtures.read("menusuite-1010-dept.txt"));

        MenuItem terms = suite.getAllMenuItems().get(1);
        assertThat(terms.runObject()).hasValue(ObjectKey.of(ObjectKind.PAGE, 4));
        assertThat(terms.propertyValue("Action")).hasValue("Page 4");
        assertThat(suite.getAllMenuItems().get(4).runObject()).hasValue(ObjectKey.of(ObjectKind.CODEUNIT, 80));
    }

    @Test
    void testUnterminatedMenuItem() {
        String text = """
            OBJECT MenuSuite 50000 Broken
            {
              MENUITEMS
              {
                MENUITEM(Text=Setup;
                         IsFolder=Yes
              }
            }
            """;

        assertThatThrownBy(() -> parser.parse(text))
                .isInstanceOf(ObjectParseException.class)
                .hasMessageContaining("Unterminated MENUITEM");
    }
}
