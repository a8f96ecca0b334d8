package sk.pcola.dedup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import sk.pcola.dedup.catalog.ProductRecordStore;
import sk.pcola.dedup.config.ExportConfig;
import sk.pcola.dedup.config.IngestConfig;
import sk.pcola.dedup.export.CatalogExporter;
import sk.pcola.dedup.ingest.IngestResult;
import sk.pcola.dedup.ingest.IngestionCoordinator;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * CLI runner pre deduplikáciu cenníkov.
 *
 * Použitie:
 *   java -jar catalog-dedup.jar                       (ingest + export)
 *   java -jar catalog-dedup.jar --ingest
 *   java -jar catalog-dedup.jar --export
 *   java -jar catalog-dedup.jar --help
 *
 * Chyba pri nastavení (mapovanie, adresár, databáza, výstupný súbor) ukončí beh
 * s nenulovým kódom. Čas behu sa vypíše vždy. Neznámy argument vypíše nápovedu a nič nespustí.
 */
@Component
@ConditionalOnProperty(prefix = "catalog.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DedupCommandLineRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DedupCommandLineRunner.class);

    private static final Set<String> KNOWN_OPTIONS = Set.of("--ingest", "--export", "--help");

    private final IngestionCoordinator coordinator;
    private final CatalogExporter exporter;
    private final ProductRecordStore store;
    private final IngestConfig ingestConfig;
    private final ExportConfig exportConfig;

    public DedupCommandLineRunner(IngestionCoordinator coordinator,
                                  CatalogExporter exporter,
                                  ProductRecordStore store,
                                  IngestConfig ingestConfig,
                                  ExportConfig exportConfig) {
        this.coordinator = coordinator;
        this.exporter = exporter;
        this.store = store;
        this.ingestConfig = ingestConfig;
        this.exportConfig = exportConfig;
    }

    @Override
    public void run(String... args) {
        List<String> argList = Arrays.asList(args);
        if (argList.contains("--help")) {
            printHelp();
            return;
        }

        List<String> unknown = argList.stream()
                .filter(arg -> !KNOWN_OPTIONS.contains(arg) && !isPropertyOverride(arg))
                .toList();
        if (!unknown.isEmpty()) {
            // Preklep nesmie spustiť plný beh, ktorý vyprázdni tabuľku
            log.warn("Unknown arguments {}, nothing was run", unknown);
            printHelp();
            return;
        }

        boolean ingest = argList.contains("--ingest");
        boolean export = argList.contains("--export");
        if (!ingest && !export) {
            ingest = true;
            export = exportConfig.isEnabled();
        }

        long start = System.nanoTime();
        try {
            store.createSchemaIfAbsent();
            if (ingest) {
                runIngest();
            }
            if (export) {
                runExport();
            }
        } finally {
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
            log.info("Elapsed: {} s", String.format("%.2f", seconds));
        }
    }

    /**
     * --catalog.ingest.worker-threads=4 a podobné spracuje Spring Boot ako property.
     */
    private static boolean isPropertyOverride(String arg) {
        return arg.startsWith("--") && arg.indexOf('=') > 2;
    }

    private void runIngest() {
        if (ingestConfig.isResetBeforeRun()) {
            store.truncate();
        }

        log.info("Running price file ingestion...");
        IngestResult result = coordinator.ingest();
        log.info("Ingestion completed:");
        log.info("  Files processed: {}", result.filesProcessed());
        log.info("  Files skipped:   {}", result.filesSkipped());
        log.info("  Rows read:       {}", result.rowsRead());
        log.info("  Rows skipped:    {}", result.rowsSkipped());
        log.info("  Inserted:        {}", result.inserted());
        log.info("  Updated:         {}", result.updated());
        log.info("  Unchanged:       {}", result.unchanged());
        log.info("  Soft conflicts:  {}", result.softConflicts());
        log.info("  Failed:          {}", result.failed());
    }

    private void runExport() {
        log.info("Running catalog export...");
        int written = exporter.export();
        log.info("Exported {} of {} stored records", written, store.count());
    }

    private void printHelp() {
        System.out.println("""
            Catalog Dedup - CLI Commands

            Usage: java -jar catalog-dedup.jar [options]

            Options:
              --ingest    Load price files into the catalog (deduplicate and merge)
              --export    Write the catalog as an SQL dump
              --help      Show this help

            Without options both steps run: ingest, then export.
            Spring properties may be passed as --name=value.
            """);
    }
}
