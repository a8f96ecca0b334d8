package sk.pcola.dedup.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Úložisko kanonických záznamov. Jedinečnosť fingerprintu vynucuje samotné úložisko.
 */
public interface ProductRecordStore {

    Optional<CanonicalRecord> findByFingerprint(String fingerprint);

    /**
     * Záznamy s rovnakým (article, brand). Slúži len na detekciu konfliktov.
     */
    List<CanonicalRecord> findByArticleBrand(String article, String brand);

    /**
     * Vloží záznam, alebo ak fingerprint existuje, prepíše len jeho názov.
     * Prehraný súboj o unique constraint sa nesmie prejaviť ako výnimka.
     */
    void upsertByFingerprint(CanonicalRecord record);

    /**
     * @return false ak záznam s daným fingerprintom už existuje
     */
    boolean createIfAbsent(CanonicalRecord record);

    /**
     * @return true ak bol záznam aktualizovaný
     */
    boolean updateName(String fingerprint, String name);

    /**
     * Stránka záznamov zoradená podľa id. Každé volanie vracia nový zoznam.
     */
    List<CanonicalRecord> findPage(int offset, int limit);

    long count();

    void createSchemaIfAbsent();

    void truncate();
}
