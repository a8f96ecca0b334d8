package sk.pcola.dedup.catalog;

/**
 * Zistená nezhoda medzi uloženým záznamom a novým riadkom. Len sa loguje, nerieši sa.
 *
 * @param kind                typ nezhody
 * @param existingId          id uloženého záznamu
 * @param storedFingerprint   fingerprint uloženého záznamu
 * @param expectedFingerprint fingerprint vypočítaný z nového riadku
 * @param storedArticle       artikel uloženého záznamu
 * @param storedBrand         značka uloženého záznamu
 */
public record SoftConflict(
        Kind kind,
        Long existingId,
        String storedFingerprint,
        String expectedFingerprint,
        String storedArticle,
        String storedBrand
) {

    public enum Kind {
        /** Rovnaké (article, brand), iný fingerprint. */
        FINGERPRINT_DRIFT,
        /** Rovnaký fingerprint, iné uložené (article, brand). */
        KEY_ALIAS
    }

    static SoftConflict of(Kind kind, CanonicalRecord existing, String expectedFingerprint) {
        return new SoftConflict(
                kind,
                existing.id(),
                existing.fingerprint(),
                expectedFingerprint,
                existing.article(),
                existing.brand()
        );
    }
}
