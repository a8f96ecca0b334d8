package sk.pcola.dedup.staging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Obsah mapovacieho súboru:
 * <pre>
 * { "files": [ { "filename": "supplier.xlsx", "columns": { "brand": 0, "article": 1, "name": 2 } } ] }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceFileMapping(@JsonProperty("files") List<FileEntry> files) {

    public PriceFileMapping {
        files = files != null ? List.copyOf(files) : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileEntry(
            @JsonProperty("filename") String filename,
            @JsonProperty("columns") ColumnMapping columns
    ) {}

    /**
     * Nájde mapovanie stĺpcov podľa názvu súboru (bez cesty).
     */
    public Optional<ColumnMapping> columnsFor(String filename) {
        return files.stream()
                .filter(entry -> entry.filename().equals(filename))
                .map(FileEntry::columns)
                .findFirst();
    }
}
