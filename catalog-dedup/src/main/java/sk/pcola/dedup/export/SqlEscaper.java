package sk.pcola.dedup.export;

/**
 * Escapovanie reťazcov do SQL literálov v dumpe.
 */
public final class SqlEscaper {

    private SqlEscaper() {
    }

    /**
     * Poradie je pevné: najprv spätné lomky, potom apostrofy.
     */
    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value
                .replace("\\", "\\\\")
                .replace("'", "''");
    }
}
