package sk.pcola.dedup.staging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Načíta mapovací súbor cenníkov. Chyba je fatálna - bez mapovania nemá beh zmysel.
 */
@Component
public class PriceFileMappingLoader {

    private static final Logger log = LoggerFactory.getLogger(PriceFileMappingLoader.class);

    private final ObjectMapper objectMapper;

    public PriceFileMappingLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PriceFileMapping load(Path mappingFile) {
        PriceFileMapping mapping;
        try {
            mapping = objectMapper.readValue(mappingFile.toFile(), PriceFileMapping.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read price file mapping " + mappingFile + ": " + e.getMessage(), e);
        }

        for (PriceFileMapping.FileEntry entry : mapping.files()) {
            if (entry.filename() == null || entry.filename().isBlank()) {
                throw new IllegalStateException("Mapping entry without filename in " + mappingFile);
            }
            if (entry.columns() == null || !entry.columns().isValid()) {
                throw new IllegalStateException("Invalid column mapping for " + entry.filename() + ": " + entry.columns());
            }
        }

        log.info("Loaded column mappings for {} price files from {}", mapping.files().size(), mappingFile);
        return mapping;
    }
}
