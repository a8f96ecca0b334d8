package sk.pcola.dedup.export;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import sk.pcola.dedup.catalog.CanonicalRecord;
import sk.pcola.dedup.catalog.Fingerprinter;
import sk.pcola.dedup.catalog.JdbcProductRecordStore;
import sk.pcola.dedup.catalog.TestDatabase;
import sk.pcola.dedup.config.ExportConfig;

import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogExporterTest {

    private TestDatabase database;
    private JdbcProductRecordStore store;

    @BeforeEach
    void setUp() {
        database = TestDatabase.start();
        store = database.store();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private void storeRecords(int count) {
        for (int i = 0; i < count; i++) {
            String article = "a" + i;
            store.createIfAbsent(CanonicalRecord.newRecord(article, "acme", "Product " + i,
                    Fingerprinter.fingerprint(article, "acme")));
        }
    }

    private CatalogExporter exporter(int pageSize) {
        ExportConfig config = new ExportConfig();
        config.setPageSize(pageSize);
        return new CatalogExporter(store, config);
    }

    private static long countInserts(String dump) {
        return dump.lines().filter(line -> line.startsWith("INSERT INTO")).count();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 7, 25, 26, 1000})
    void shouldExportEveryRecordForAnyPageSize(int pageSize) throws Exception {
        storeRecords(25);

        StringWriter out = new StringWriter();
        int written = exporter(pageSize).write(out);

        assertEquals(25, written);
        assertEquals(25, countInserts(out.toString()));
    }

    @Test
    void shouldWriteHeaderAndEscapedInserts(@TempDir Path tempDir) throws Exception {
        store.createIfAbsent(CanonicalRecord.newRecord("x100", "acme", "Widget 5' \\ Deluxe",
                Fingerprinter.fingerprint("x100", "acme")));
        Path output = tempDir.resolve("output.sql");

        int written = exporter(ExportConfig.DEFAULT_PAGE_SIZE).export(output);

        String dump = Files.readString(output, StandardCharsets.UTF_8);
        assertEquals(1, written);
        assertTrue(dump.startsWith("CREATE TABLE IF NOT EXISTS `products` ("));
        assertTrue(dump.contains(
                "INSERT INTO `products` (`article`, `brand`, `name`) VALUES ('x100', 'acme', 'Widget 5'' \\\\ Deluxe');\n"));
    }

    @Test
    void shouldWriteOnlyHeaderForEmptyCatalog() throws Exception {
        StringWriter out = new StringWriter();

        int written = exporter(10).write(out);

        assertEquals(0, written);
        assertEquals(0, countInserts(out.toString()));
        assertTrue(out.toString().contains("CREATE TABLE IF NOT EXISTS"));
    }

    @Test
    void shouldPreserveUnicode(@TempDir Path tempDir) throws Exception {
        store.createIfAbsent(CanonicalRecord.newRecord("k1", "kärcher", "Vysávač Kärcher",
                Fingerprinter.fingerprint("k1", "kärcher")));
        Path output = tempDir.resolve("output.sql");

        exporter(100).export(output);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertTrue(lines.stream().anyMatch(line -> line.contains("'Vysávač Kärcher'")));
    }

    @Test
    void shouldFailWhenOutputCannotBeCreated(@TempDir Path tempDir) {
        Path output = tempDir.resolve("missing-dir").resolve("output.sql");

        assertThrows(UncheckedIOException.class, () -> exporter(100).export(output));
    }

    @Test
    void shouldRejectInvalidPageSize() {
        assertThrows(IllegalStateException.class, () -> exporter(0).write(new StringWriter()));
    }
}
