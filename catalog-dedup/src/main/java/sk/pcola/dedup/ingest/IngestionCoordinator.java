package sk.pcola.dedup.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import sk.pcola.dedup.catalog.ConflictResolver;
import sk.pcola.dedup.catalog.Resolution;
import sk.pcola.dedup.common.util.TextNormalizer;
import sk.pcola.dedup.config.IngestConfig;
import sk.pcola.dedup.staging.ColumnMapping;
import sk.pcola.dedup.staging.PriceFileMapping;
import sk.pcola.dedup.staging.PriceFileMappingLoader;
import sk.pcola.dedup.staging.SpreadsheetRowReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Orchestrácia spracovania cenníkov:
 * 1. Načítanie mapovania stĺpcov
 * 2. Vyhľadanie cenníkov v adresári
 * 3. Paralelné spracovanie - jeden task na súbor, riadky v rámci súboru sekvenčne
 * 4. Čakanie na všetky súbory a súhrn výsledku
 *
 * Chyba pri nastavení (mapovanie, adresár) je fatálna. Chyba súboru alebo riadku
 * sa zaloguje a preskočí.
 */
@Service
public class IngestionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final IngestConfig config;
    private final PriceFileMappingLoader mappingLoader;
    private final SpreadsheetRowReader rowReader;
    private final ConflictResolver resolver;

    public IngestionCoordinator(IngestConfig config,
                                PriceFileMappingLoader mappingLoader,
                                SpreadsheetRowReader rowReader,
                                ConflictResolver resolver) {
        this.config = config;
        this.mappingLoader = mappingLoader;
        this.rowReader = rowReader;
        this.resolver = resolver;
    }

    /**
     * Spracuje všetky cenníky z nakonfigurovaného adresára.
     */
    public IngestResult ingest() {
        PriceFileMapping mapping = mappingLoader.load(Path.of(config.getMappingFile()));
        List<Path> files = scanPriceDirectory(Path.of(config.getPriceDirectory()));
        log.info("Found {} price files in {}", files.size(), config.getPriceDirectory());

        List<PriceFileTask> tasks = new ArrayList<>();
        int unmapped = 0;

        for (Path file : files) {
            String filename = file.getFileName().toString();
            Optional<ColumnMapping> columns = mapping.columnsFor(filename);
            if (columns.isEmpty()) {
                log.warn("No column mapping configured for file '{}', skipping", filename);
                unmapped++;
                continue;
            }
            tasks.add(new PriceFileTask(file, columns.get()));
        }

        IngestResult result = ingest(tasks);
        for (int i = 0; i < unmapped; i++) {
            result = result.plus(IngestResult.skippedFile());
        }
        return result;
    }

    /**
     * Spracuje zadané súbory paralelne a počká na dokončenie všetkých.
     */
    public IngestResult ingest(List<PriceFileTask> tasks) {
        if (tasks.isEmpty()) {
            log.info("No price files to process");
            return IngestResult.empty();
        }

        int threads = Math.max(1, Math.min(config.getWorkerThreads(), tasks.size()));
        log.info("Processing {} price files with {} workers", tasks.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<IngestResult>> futures = new ArrayList<>(tasks.size());
            for (PriceFileTask task : tasks) {
                futures.add(executor.submit(() -> processFile(task)));
            }

            IngestResult total = IngestResult.empty();
            for (int i = 0; i < futures.size(); i++) {
                total = total.plus(await(futures.get(i), tasks.get(i)));
            }

            log.info("Ingestion completed: {}", total);
            return total;
        } finally {
            executor.shutdown();
        }
    }

    private IngestResult await(Future<IngestResult> future, PriceFileTask task) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + task.file(), e);
        } catch (ExecutionException e) {
            log.error("Worker for {} failed: {}", task.file(), e.getCause().getMessage(), e.getCause());
            return IngestResult.skippedFile();
        }
    }

    /**
     * Spracuje jeden cenník. Nikdy nevyhodí výnimku - chyba súboru znamená preskočenie.
     */
    IngestResult processFile(PriceFileTask task) {
        Path file = task.file();
        ColumnMapping columns = task.columns();
        log.info("Processing price file {}", file.getFileName());

        // rowsRead, rowsSkipped, inserted, updated, unchanged, softConflicts, failed
        int[] totals = new int[7];

        try {
            rowReader.read(file, row -> processRow(file, row, columns, totals));
        } catch (Exception e) {
            log.error("Failed to process price file {}: {}", file, e.getMessage());
            return new IngestResult(0, 1, totals[0], totals[1], totals[2], totals[3], totals[4], totals[5], totals[6]);
        }

        IngestResult result = new IngestResult(1, 0,
                totals[0], totals[1], totals[2], totals[3], totals[4], totals[5], totals[6]);
        log.info("Finished {}: {}", file.getFileName(), result);
        return result;
    }

    private void processRow(Path file, List<String> row, ColumnMapping columns, int[] totals) {
        totals[0]++;

        if (!columns.fits(row.size())) {
            totals[1]++;
            return;
        }

        String article = row.get(columns.article());
        String brand = row.get(columns.brand());
        String name = row.get(columns.name());

        // Uložený artikel aj značka musia byť neprázdne
        if (config.isSkipBlankKeys()
                && (TextNormalizer.normalizeArticle(article).isEmpty()
                || TextNormalizer.normalizeBrand(brand).isEmpty())) {
            totals[1]++;
            return;
        }

        try {
            Resolution resolution = resolver.resolve(article, brand, name);
            switch (resolution.action()) {
                case INSERTED -> totals[2]++;
                case UPDATED -> totals[3]++;
                case UNCHANGED -> totals[4]++;
            }
            totals[5] += resolution.conflicts().size();
        } catch (Exception e) {
            log.error("Failed to resolve row {} of {} (article={}, brand={}): {}",
                    totals[0], file.getFileName(), article, brand, e.getMessage());
            totals[6]++;
        }

        if (totals[0] % 500 == 0) {
            log.debug("Processed {} rows of {}", totals[0], file.getFileName());
        }
    }

    private List<Path> scanPriceDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalStateException("Price directory does not exist: " + directory);
        }

        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(this::hasPriceFileExtension)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read price directory " + directory + ": " + e.getMessage(), e);
        }
    }

    private boolean hasPriceFileExtension(Path file) {
        String filename = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return config.getFileExtensions().stream()
                .map(ext -> "." + ext.toLowerCase(Locale.ROOT))
                .anyMatch(filename::endsWith);
    }
}
