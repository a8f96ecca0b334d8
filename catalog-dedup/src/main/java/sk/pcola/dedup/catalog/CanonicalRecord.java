package sk.pcola.dedup.catalog;

/**
 * Deduplikovaný produkt v katalógu. Jeden záznam na fingerprint.
 *
 * @param id          pridelené úložiskom pri vložení, pred vložením null
 * @param article     normalizovaný artikel
 * @param brand       normalizovaná značka
 * @param name        názov produktu (najdlhší doteraz videný)
 * @param fingerprint SHA-256 hex z (article, brand) po deepClean
 */
public record CanonicalRecord(
        Long id,
        String article,
        String brand,
        String name,
        String fingerprint
) {

    public static CanonicalRecord newRecord(String article, String brand, String name, String fingerprint) {
        return new CanonicalRecord(null, article, brand, name, fingerprint);
    }

    public boolean hasSameKey(String otherArticle, String otherBrand) {
        return article.equals(otherArticle) && brand.equals(otherBrand);
    }
}
