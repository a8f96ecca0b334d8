package sk.pcola.dedup.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import sk.pcola.dedup.common.util.TextNormalizer;
import sk.pcola.dedup.config.IngestConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rozhoduje, čo sa má stať s riadkom z cenníka: vložiť, aktualizovať názov, alebo nič.
 *
 * Postup:
 * 1. Normalizuj artikel, značku a názov, vypočítaj fingerprint
 * 2. Pod zámkom fingerprintu vyhľadaj existujúci záznam
 * 3. Ak neexistuje, skontroluj drift - záznam s rovnakým (article, brand) ale iným fingerprintom
 * 4. Neexistuje -> INSERT, dlhší názov -> UPDATE, inak bez zmeny (existujúci vyhráva)
 *
 * Konflikty sa len logujú, nikdy nezastavia beh.
 */
@Service
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final ProductRecordStore store;
    private final FingerprintLocks locks;
    private final IngestConfig.WriteMode writeMode;
    private final boolean driftDetection;

    public ConflictResolver(ProductRecordStore store, FingerprintLocks locks, IngestConfig config) {
        this.store = store;
        this.locks = locks;
        this.writeMode = config.getWriteMode();
        this.driftDetection = config.isDriftDetection();
    }

    /**
     * Spracuje jeden riadok z cenníka.
     *
     * @param rawArticle artikel tak, ako je v súbore
     * @param rawBrand   značka tak, ako je v súbore
     * @param rawName    názov tak, ako je v súbore
     * @return čo sa s riadkom stalo
     */
    public Resolution resolve(String rawArticle, String rawBrand, String rawName) {
        String article = TextNormalizer.normalizeArticle(rawArticle);
        String brand = TextNormalizer.normalizeBrand(rawBrand);
        String name = TextNormalizer.normalizeName(rawName);
        String fingerprint = Fingerprinter.fingerprint(article, brand);

        return locks.withLock(fingerprint, () -> resolveLocked(article, brand, name, fingerprint));
    }

    private Resolution resolveLocked(String article, String brand, String name, String fingerprint) {
        List<SoftConflict> conflicts = new ArrayList<>();
        Optional<CanonicalRecord> existing = store.findByFingerprint(fingerprint);

        if (existing.isEmpty()) {
            if (driftDetection) {
                conflicts.addAll(detectDrift(article, brand, fingerprint));
            }
            Resolution.Action action = insert(CanonicalRecord.newRecord(article, brand, name, fingerprint));
            return new Resolution(action, fingerprint, conflicts);
        }

        CanonicalRecord stored = existing.get();
        if (!stored.hasSameKey(article, brand)) {
            // Rovnaký deepClean, iná ľahká normalizácia
            log.warn("Record with same fingerprint but different article/brand: id={}, fingerprint={}, "
                            + "stored=({}, {}), incoming=({}, {})",
                    stored.id(), fingerprint, stored.article(), stored.brand(), article, brand);
            conflicts.add(SoftConflict.of(SoftConflict.Kind.KEY_ALIAS, stored, fingerprint));
        }

        return new Resolution(mergeName(stored, name), fingerprint, conflicts);
    }

    private List<SoftConflict> detectDrift(String article, String brand, String fingerprint) {
        List<SoftConflict> drift = new ArrayList<>();
        for (CanonicalRecord duplicate : store.findByArticleBrand(article, brand)) {
            if (fingerprint.equals(duplicate.fingerprint())) {
                continue;
            }
            log.warn("Record with same article and brand but different fingerprint: id={}, fingerprint={}, "
                            + "expected_fingerprint={}",
                    duplicate.id(), duplicate.fingerprint(), fingerprint);
            drift.add(SoftConflict.of(SoftConflict.Kind.FINGERPRINT_DRIFT, duplicate, fingerprint));
        }
        return drift;
    }

    /**
     * Vloženie nikdy neprepíše existujúci záznam, ani v režime UPSERT.
     * Prehraný súboj sa rieši pravidlom najdlhšieho názvu.
     */
    private Resolution.Action insert(CanonicalRecord record) {
        if (store.createIfAbsent(record)) {
            return Resolution.Action.INSERTED;
        }

        // Iný proces vložil rovnaký fingerprint medzi SELECT a INSERT
        Optional<CanonicalRecord> winner = store.findByFingerprint(record.fingerprint());
        if (winner.isEmpty()) {
            throw new IllegalStateException("Insert of fingerprint " + record.fingerprint()
                    + " rejected but no stored record found");
        }
        log.warn("Recovered insert race: id={}, fingerprint={}", winner.get().id(), record.fingerprint());
        return mergeName(winner.get(), record.name());
    }

    /**
     * Najdlhší názov vyhráva. Dĺžka sa počíta v znakoch (code points), nie v UTF-16 jednotkách.
     * Pri rovnakej dĺžke zostáva uložený názov.
     */
    private Resolution.Action mergeName(CanonicalRecord stored, String name) {
        if (characterCount(name) <= characterCount(stored.name())) {
            return Resolution.Action.UNCHANGED;
        }

        if (writeMode == IngestConfig.WriteMode.UPSERT) {
            store.upsertByFingerprint(new CanonicalRecord(
                    stored.id(), stored.article(), stored.brand(), name, stored.fingerprint()));
        } else {
            store.updateName(stored.fingerprint(), name);
        }
        log.debug("Name updated for {}: '{}' -> '{}'", stored.fingerprint(), stored.name(), name);
        return Resolution.Action.UPDATED;
    }

    private static int characterCount(String text) {
        return text.codePointCount(0, text.length());
    }
}
