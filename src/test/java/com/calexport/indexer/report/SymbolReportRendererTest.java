package com.calexport.indexer.report;

import com.calexport.indexer.Fixtures;
import com.calexport.indexer.loader.ObjectFileLoader;
import com.calexport.indexer.query.CategorizedSummary;
import com.calexport.indexer.query.IndexContext;
import com.calexport.indexer.query.IndexQueryService;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SymbolReportRenderer.
 */
class SymbolReportRendererTest {

    @TempDir
    Path tempDir;

    private final SymbolReportRenderer renderer = new SymbolReportRenderer();
    private IndexQueryService service;

    @BeforeEach
    void setUp() {
        IndexContext context = new IndexContext();
        ObjectFileLoader loader = new ObjectFileLoader(context);
        loader.loadText("table-3-payment-terms.txt", Fixtures.read("table-3-payment-terms.txt"));
        loader.loadText("codeunit-80-sales-post.txt", Fixtures.read("codeunit-80-sales-post.txt"));
        service = new IndexQueryService(context);
    }

    @Test
    void testTableSummary() {
        CategorizedSummary summary = service.getSummary("Payment Terms", "Table").getValue();

        String markdown = renderer.renderSummary(summary);

        assertThat(markdown).startsWith("# Table 3 Payment Terms");
        assertThat(markdown).contains("- Version List: NAVW19.00");
        assertThat(markdown).contains("## Fields (5 of 5)");
        assertThat(markdown).contains("| 1 | Code | Code10 |");
        assertThat(markdown).contains("| fields | 5 |");
        assertThat(markdown).doesNotContain("## Procedures");
    }

    @Test
    void testCodeunitSummary() {
        CategorizedSummary summary = service.getSummary("80", "Codeunit").getValue();

        String markdown = renderer.renderSummary(summary);

        assertThat(markdown).startsWith("# Codeunit 80 Sales-Post");
        assertThat(markdown).contains("## Procedures (3 of 3)");
        assertThat(markdown).contains("- `Code(VAR SalesHeader : Record 36)`\n");
        assertThat(markdown).contains("- `PostInvoice(VAR SalesHeader : Record 36) : Boolean` (local)");
        assertThat(markdown).contains("### Event subscribers\n\n- OnDeleteSalesHeader");
        assertThat(markdown).doesNotContain("## Fields");
    }

    @Test
    void testStatistics() {
        String markdown = renderer.renderStatistics(service.getStatistics());

        assertThat(markdown).startsWith("# Symbol index");
        assertThat(markdown).contains("- Objects: 2");
        assertThat(markdown).contains("- Rejected objects: 0");
        assertThat(markdown).contains("| Table | 1 |");
        assertThat(markdown).contains("| Codeunit | 1 |");
        assertThat(markdown).contains("- codeunit-80-sales-post.txt");
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("reports").resolve("index.md");

        renderer.write(target, "# Symbol index\n");

        assertThat(target).exists();
        assertThat(Files.readString(target)).isEqualTo("# Symbol index\n");
    }
}
