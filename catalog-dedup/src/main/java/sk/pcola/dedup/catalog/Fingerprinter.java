package sk.pcola.dedup.catalog;

import sk.pcola.dedup.common.util.TextNormalizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Fingerprint produktu = SHA-256 z deepClean(article) + deepClean(brand), hex lowercase.
 *
 * Medzi artiklom a značkou nie je oddeľovač, takže ("ab", "c") a ("a", "bc") dajú
 * rovnaký fingerprint. Zmena by zneplatnila všetky existujúce fingerprinty.
 */
public final class Fingerprinter {

    public static final int LENGTH = 64;

    private Fingerprinter() {
    }

    public static String fingerprint(String article, String brand) {
        return sha256Hex(TextNormalizer.deepClean(article) + TextNormalizer.deepClean(brand));
    }

    public static String sha256Hex(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
