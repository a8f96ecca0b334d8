package sk.pcola.dedup.common.util;

import java.util.Locale;

/**
 * Utility pre normalizáciu identifikátorov z cenníkov dodávateľov.
 * Dodávatelia píšu ten istý artikel rôzne: "X-100", "x 100", "X.100".
 *
 * Všetky metódy sú čisté, null berú ako prázdny reťazec a nikdy nezlyhajú.
 * Prázdny výsledok je legálny.
 */
public final class TextNormalizer {

    // Oddeľovače, ktoré sa z artiklu vyhadzujú
    private static final String ARTICLE_SEPARATORS = "-_./+ ,";

    private TextNormalizer() {
    }

    /**
     * Normalizuje kód artiklu: trim, lowercase, odstránenie oddeľovačov.
     * Príklad: " X-100/B " -> "x100b"
     */
    public static String normalizeArticle(String raw) {
        String cleaned = lower(nullSafe(raw).trim());
        StringBuilder sb = new StringBuilder(cleaned.length());
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (ARTICLE_SEPARATORS.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Normalizuje značku: trim a lowercase. Interpunkcia zostáva.
     */
    public static String normalizeBrand(String raw) {
        return lower(nullSafe(raw).trim());
    }

    /**
     * Názov produktu - len trim, veľkosť písmen aj interpunkcia zostávajú.
     */
    public static String normalizeName(String raw) {
        return nullSafe(raw).trim();
    }

    /**
     * Hĺbková očista pre fingerprint. Výsledok sa nikdy neukladá.
     * Ponechá len [a-z0-9], takže aj diakritika a iné písma zmiznú.
     */
    public static String deepClean(String raw) {
        String value = nullSafe(raw).trim()
                .replace(" ", "")
                .replace("\t", "")
                .replace("\n", "")
                .replace("\r", "");
        value = lower(value);

        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static String nullSafe(String s) {
        return s != null ? s : "";
    }
}
