package sk.pcola.dedup.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import sk.pcola.dedup.catalog.CanonicalRecord;
import sk.pcola.dedup.catalog.ProductRecordStore;
import sk.pcola.dedup.config.ExportConfig;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Export katalógu do SQL dumpu.
 *
 * Záznamy sa čítajú po stránkach (catalog.export.page-size), kým nepríde prázdna stránka.
 * Hlavička CREATE TABLE je len informatívna a nemusí presne sedieť so živou schémou.
 */
@Service
public class CatalogExporter {

    private static final Logger log = LoggerFactory.getLogger(CatalogExporter.class);

    private static final int BUFFER_SIZE = 1 << 20;

    private final ProductRecordStore store;
    private final ExportConfig config;

    public CatalogExporter(ProductRecordStore store, ExportConfig config) {
        this.store = store;
        this.config = config;
    }

    public int export() {
        return export(Path.of(config.getOutputPath()));
    }

    /**
     * Zapíše dump do súboru.
     *
     * @return počet zapísaných INSERT príkazov
     */
    public int export(Path output) {
        log.info("Exporting catalog to {}", output);

        try (Writer writer = new BufferedWriter(
                new OutputStreamWriter(Files.newOutputStream(output), StandardCharsets.UTF_8), BUFFER_SIZE)) {
            int written = write(writer);
            log.info("Export completed: {} records written to {}", written, output);
            return written;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write SQL dump " + output, e);
        }
    }

    /**
     * Zapíše dump do writera. Writer nezatvára.
     */
    public int write(Writer writer) throws IOException {
        String table = config.getTableName();
        int pageSize = config.getPageSize();
        if (pageSize < 1) {
            throw new IllegalStateException("Export page size must be >= 1, got " + pageSize);
        }

        writer.write(createTableStatement(table));

        int offset = 0;
        int written = 0;
        while (true) {
            List<CanonicalRecord> page = store.findPage(offset, pageSize);
            if (page.isEmpty()) {
                break;
            }

            for (CanonicalRecord record : page) {
                writer.write(insertStatement(table, record));
                written++;
            }

            offset += pageSize;
            log.debug("Exported {} records", written);
        }

        writer.flush();
        return written;
    }

    static String createTableStatement(String table) {
        return "CREATE TABLE IF NOT EXISTS `" + table + "` (\n"
                + "`id` INT AUTO_INCREMENT PRIMARY KEY,\n"
                + "`article` VARCHAR(255) NOT NULL,\n"
                + "`brand` VARCHAR(255) NOT NULL,\n"
                + "`name` VARCHAR(1000) NOT NULL\n"
                + ");\n\n";
    }

    static String insertStatement(String table, CanonicalRecord record) {
        return String.format("INSERT INTO `%s` (`article`, `brand`, `name`) VALUES ('%s', '%s', '%s');\n",
                table,
                SqlEscaper.escape(record.article()),
                SqlEscaper.escape(record.brand()),
                SqlEscaper.escape(record.name()));
    }
}
