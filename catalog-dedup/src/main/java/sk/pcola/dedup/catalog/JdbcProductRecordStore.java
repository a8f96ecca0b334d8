package sk.pcola.dedup.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementácia úložiska nad tabuľkou products.
 * SQL je prenositeľné medzi PostgreSQL a H2.
 */
@Repository
public class JdbcProductRecordStore implements ProductRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcProductRecordStore.class);

    private static final RowMapper<CanonicalRecord> ROW_MAPPER = new CanonicalRecordRowMapper();

    private final JdbcTemplate jdbc;

    public JdbcProductRecordStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<CanonicalRecord> findByFingerprint(String fingerprint) {
        List<CanonicalRecord> found = jdbc.query(
                "SELECT id, article, brand, name, fingerprint FROM products WHERE fingerprint = ?",
                ROW_MAPPER,
                fingerprint
        );
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<CanonicalRecord> findByArticleBrand(String article, String brand) {
        return jdbc.query(
                "SELECT id, article, brand, name, fingerprint FROM products WHERE article = ? AND brand = ? ORDER BY id",
                ROW_MAPPER,
                article,
                brand
        );
    }

    @Override
    public void upsertByFingerprint(CanonicalRecord record) {
        if (updateName(record.fingerprint(), record.name())) {
            return;
        }
        if (!createIfAbsent(record)) {
            // Niekto ho vložil medzi UPDATE a INSERT
            updateName(record.fingerprint(), record.name());
        }
    }

    @Override
    public boolean createIfAbsent(CanonicalRecord record) {
        String sql = """
            INSERT INTO products (article, brand, name, fingerprint)
            VALUES (?, ?, ?, ?)
            """;

        try {
            int rows = jdbc.update(sql,
                    record.article(),
                    record.brand(),
                    record.name(),
                    record.fingerprint()
            );
            return rows > 0;
        } catch (DuplicateKeyException e) {
            // Unique constraint na fingerprint - záznam už existuje
            log.debug("Fingerprint {} already stored: {}", record.fingerprint(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean updateName(String fingerprint, String name) {
        return jdbc.update("UPDATE products SET name = ? WHERE fingerprint = ?", name, fingerprint) > 0;
    }

    @Override
    public List<CanonicalRecord> findPage(int offset, int limit) {
        return jdbc.query(
                "SELECT id, article, brand, name, fingerprint FROM products ORDER BY id LIMIT ? OFFSET ?",
                ROW_MAPPER,
                limit,
                offset
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM products", Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void createSchemaIfAbsent() {
        jdbc.execute("""
            CREATE TABLE IF NOT EXISTS products (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                article VARCHAR(255) NOT NULL,
                brand VARCHAR(255) NOT NULL,
                name VARCHAR(1000) NOT NULL,
                fingerprint VARCHAR(64) NOT NULL,
                CONSTRAINT uq_products_fingerprint UNIQUE (fingerprint)
            )
            """);
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_products_article_brand ON products (article, brand)");
    }

    @Override
    public void truncate() {
        jdbc.execute("TRUNCATE TABLE products");
        log.info("Table products truncated");
    }

    /**
     * RowMapper pre CanonicalRecord.
     */
    private static class CanonicalRecordRowMapper implements RowMapper<CanonicalRecord> {
        @Override
        public CanonicalRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new CanonicalRecord(
                    rs.getLong("id"),
                    rs.getString("article"),
                    rs.getString("brand"),
                    rs.getString("name"),
                    rs.getString("fingerprint")
            );
        }
    }
}
