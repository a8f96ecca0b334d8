package sk.pcola.dedup.ingest;

import sk.pcola.dedup.staging.ColumnMapping;

import java.nio.file.Path;

/**
 * Jeden cenník na spracovanie spolu s jeho mapovaním stĺpcov.
 */
public record PriceFileTask(Path file, ColumnMapping columns) {
}
