package sk.pcola.dedup.ingest;

/**
 * Súhrnný výsledok spracovania cenníkov.
 */
public record IngestResult(
        int filesProcessed,
        int filesSkipped,
        int rowsRead,
        int rowsSkipped,
        int inserted,
        int updated,
        int unchanged,
        int softConflicts,
        int failed
) {

    public static IngestResult empty() {
        return new IngestResult(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public static IngestResult skippedFile() {
        return new IngestResult(0, 1, 0, 0, 0, 0, 0, 0, 0);
    }

    public IngestResult plus(IngestResult other) {
        return new IngestResult(
                filesProcessed + other.filesProcessed,
                filesSkipped + other.filesSkipped,
                rowsRead + other.rowsRead,
                rowsSkipped + other.rowsSkipped,
                inserted + other.inserted,
                updated + other.updated,
                unchanged + other.unchanged,
                softConflicts + other.softConflicts,
                failed + other.failed
        );
    }

    public int resolved() {
        return inserted + updated + unchanged;
    }
}
