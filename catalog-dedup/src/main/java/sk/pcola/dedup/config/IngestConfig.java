package sk.pcola.dedup.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "catalog.ingest")
public class IngestConfig {

    /**
     * Spôsob zápisu do úložiska.
     * Nový záznam vždy cez createIfAbsent. Dlhší názov: TWO_STEP = updateName, UPSERT = upsertByFingerprint.
     */
    public enum WriteMode {
        TWO_STEP,
        UPSERT
    }

    private String priceDirectory = "./prices";
    private String mappingFile = "./config.json";
    private List<String> fileExtensions = new ArrayList<>(List.of("xlsx"));
    private int workerThreads = 8;
    private int lockStripes = 64;
    private WriteMode writeMode = WriteMode.TWO_STEP;
    private boolean resetBeforeRun = true;
    private boolean driftDetection = true;
    private boolean skipBlankKeys = true;

    public String getPriceDirectory() {
        return priceDirectory;
    }

    public void setPriceDirectory(String priceDirectory) {
        this.priceDirectory = priceDirectory;
    }

    public String getMappingFile() {
        return mappingFile;
    }

    public void setMappingFile(String mappingFile) {
        this.mappingFile = mappingFile;
    }

    public List<String> getFileExtensions() {
        return fileExtensions;
    }

    public void setFileExtensions(List<String> fileExtensions) {
        this.fileExtensions = fileExtensions;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getLockStripes() {
        return lockStripes;
    }

    public void setLockStripes(int lockStripes) {
        this.lockStripes = lockStripes;
    }

    public WriteMode getWriteMode() {
        return writeMode;
    }

    public void setWriteMode(WriteMode writeMode) {
        this.writeMode = writeMode;
    }

    public boolean isResetBeforeRun() {
        return resetBeforeRun;
    }

    public void setResetBeforeRun(boolean resetBeforeRun) {
        this.resetBeforeRun = resetBeforeRun;
    }

    public boolean isDriftDetection() {
        return driftDetection;
    }

    public void setDriftDetection(boolean driftDetection) {
        this.driftDetection = driftDetection;
    }

    public boolean isSkipBlankKeys() {
        return skipBlankKeys;
    }

    public void setSkipBlankKeys(boolean skipBlankKeys) {
        this.skipBlankKeys = skipBlankKeys;
    }
}
