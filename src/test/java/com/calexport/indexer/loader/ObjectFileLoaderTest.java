package com.calexport.indexer.loader;

import com.calexport.indexer.Fixtures;
import com.calexport.indexer.config.IndexerConfig;
import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.model.ObjectKey;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.query.IndexContext;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ObjectFileLoader.
 */
class ObjectFileLoaderTest {

    private static final String SMALL_CODEUNIT = """
            OBJECT Codeunit 5 Prüfung
            {
              PROPERTIES
              {
              }
              CODE
              {
                BEGIN
                END.
              }
            }
            """;

    @TempDir
    Path tempDir;

    private IndexContext context;
    private ObjectFileLoader loader;

    @BeforeEach
    void setUp() {
        context = new IndexContext();
        loader = new ObjectFileLoader(context);
    }

    @Test
    void testLoadFileWithBom() throws IOException {
        Path file = tempDir.resolve("payment-terms.txt");
        Files.writeString(file, "\uFEFF" + Fixtures.read("table-3-payment-terms.txt"), StandardCharsets.UTF_8);

        LoadResult result = loader.loadFile(file);

        assertThat(result.getObjectsFound()).isEqualTo(1);
        assertThat(result.getLoadedKeys()).containsExactly(ObjectKey.of(ObjectKind.TABLE, 3));
        assertThat(result.hasFailures()).isFalse();
        assertThat(result.getBytes()).isEqualTo(Files.size(file));
        assertThat(result.getSource()).isEqualTo(file.toString());
        assertThat(context.getDatabase().getById(ObjectKind.TABLE, 3)).isPresent();
    }

    @Test
    void testFailedObjectDoesNotStopTheRest() {
        LoadResult result = loader.loadText("mixed", Fixtures.read("mixed-export.txt"));

        assertThat(result.getObjectsFound()).isEqualTo(3);
        assertThat(result.getObjectsLoaded()).isEqualTo(2);
        assertThat(result.getLoadedKeys()).containsExactly(
                ObjectKey.of(ObjectKind.TABLE, 3),
                ObjectKey.of(ObjectKind.CODEUNIT, 1));
        assertThat(result.getFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.getObjectIndex()).isEqualTo(1);
            assertThat(failure.getHeaderLine()).isEqualTo("OBJECT Table 4 Currency");
            assertThat(failure.getMessage()).contains("KEYS");
            assertThat(failure.describe()).startsWith("mixed #1 (OBJECT Table 4 Currency): ");
        });
        assertThat(context.getDatabase().getById(ObjectKind.TABLE, 4)).isEmpty();
        assertThat(context.getLoadResults()).containsExactly(result);
    }

    @Test
    void testLoadDirectoryRecursively() throws IOException {
        writeTree();

        List<LoadResult> results = loader.load(tempDir);

        assertThat(results).extracting(LoadResult::getSource).containsExactly(
                tempDir.resolve("a.txt").toString(),
                tempDir.resolve("sub").resolve("b.txt").toString());
        assertThat(context.getDatabase().size()).isEqualTo(2);
    }

    @Test
    void testLoadDirectoryFlat() throws IOException {
        writeTree();
        context = new IndexContext(IndexerConfig.builder().recursive(false).build());
        loader = new ObjectFileLoader(context);

        List<LoadResult> results = loader.loadDirectory(tempDir);

        assertThat(results).hasSize(1);
        assertThat(context.getDatabase().getById(ObjectKind.TABLE, 3)).isPresent();
        assertThat(context.getDatabase().getById(ObjectKind.TABLE, 18)).isEmpty();
    }

    @Test
    void testCustomFilePattern() throws IOException {
        writeTree();
        context = new IndexContext(IndexerConfig.builder().filePattern("*.log").build());
        loader = new ObjectFileLoader(context);

        loader.load(tempDir);

        assertThat(context.getDatabase().all()).extracting(CalObject::getKey)
                .containsExactly(ObjectKey.of(ObjectKind.CODEUNIT, 80));
    }

    @Test
    void testConfiguredCharset() throws IOException {
        Charset ansi = Charset.forName("windows-1252");
        Path file = tempDir.resolve("ansi.txt");
        Files.writeString(file, SMALL_CODEUNIT, ansi);
        context = new IndexContext(IndexerConfig.builder().charset(ansi).build());
        loader = new ObjectFileLoader(context);

        loader.load(file);

        assertThat(context.getDatabase().getById(ObjectKind.CODEUNIT, 5)).map(CalObject::getName).hasValue("Prüfung");
    }

    @Test
    void testUndecodableBytesDoNotStopTheDirectory() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), SMALL_CODEUNIT, Charset.forName("windows-1252"));
        Files.writeString(tempDir.resolve("b.txt"), Fixtures.read("table-3-payment-terms.txt"), StandardCharsets.UTF_8);

        List<LoadResult> results = loader.loadDirectory(tempDir);

        assertThat(results).extracting(LoadResult::getObjectsLoaded).containsExactly(1, 1);
        assertThat(results).noneMatch(LoadResult::hasFailures);
        CalObject codeunit = context.getDatabase().getById(ObjectKind.CODEUNIT, 5).orElseThrow();
        assertThat(codeunit.getName()).isEqualTo("Pr\uFFFDfung");
        assertThat(context.getDatabase().getById(ObjectKind.TABLE, 3)).isPresent();
    }

    @Test
    void testLoadText() {
        LoadResult result = loader.loadText("inline", SMALL_CODEUNIT);

        assertThat(result.getObjectsLoaded()).isEqualTo(1);
        assertThat(result.getBytes()).isEqualTo(SMALL_CODEUNIT.getBytes(StandardCharsets.UTF_8).length);
        assertThat(context.getLoadedSources()).containsExactly("inline");
    }

    @Test
    void testEmptyText() {
        LoadResult result = loader.loadText("empty", "no objects in here\n");

        assertThat(result.getObjectsFound()).isZero();
        assertThat(result.getObjectsLoaded()).isZero();
        assertThat(result.hasFailures()).isFalse();
    }

    @Test
    void testMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("nope.txt")))
                .isInstanceOf(NoSuchFileException.class);
    }

    private void writeTree() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), Fixtures.read("table-3-payment-terms.txt"));
        Path sub = Files.createDirectory(tempDir.resolve("sub"));
        Files.writeString(sub.resolve("b.txt"), Fixtures.read("table-18-customer.txt"));
        Files.writeString(tempDir.resolve("c.log"), Fixtures.read("codeunit-80-sales-post.txt"));
    }
}
