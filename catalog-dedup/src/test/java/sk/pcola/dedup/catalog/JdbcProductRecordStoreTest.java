package sk.pcola.dedup.catalog;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcProductRecordStoreTest {

    private TestDatabase database;
    private JdbcProductRecordStore store;

    @BeforeEach
    void setUp() {
        database = TestDatabase.start();
        store = database.store();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private static CanonicalRecord record(String article, String brand, String name) {
        return CanonicalRecord.newRecord(article, brand, name, Fingerprinter.fingerprint(article, brand));
    }

    @Test
    void shouldCreateAndFindByFingerprint() {
        CanonicalRecord record = record("x100", "acme", "Widget");

        assertTrue(store.createIfAbsent(record));

        Optional<CanonicalRecord> found = store.findByFingerprint(record.fingerprint());
        assertTrue(found.isPresent());
        assertNotNull(found.get().id());
        assertEquals("x100", found.get().article());
        assertEquals("acme", found.get().brand());
        assertEquals("Widget", found.get().name());
    }

    @Test
    void shouldNotCreateDuplicateFingerprint() {
        CanonicalRecord record = record("x100", "acme", "Widget");

        assertTrue(store.createIfAbsent(record));
        assertFalse(store.createIfAbsent(record("x100", "acme", "Other")));

        assertEquals(1, store.count());
        assertEquals("Widget", store.findByFingerprint(record.fingerprint()).orElseThrow().name());
    }

    @Test
    void shouldUpdateOnlyName() {
        CanonicalRecord record = record("x100", "acme", "Widget");
        store.createIfAbsent(record);
        Long id = store.findByFingerprint(record.fingerprint()).orElseThrow().id();

        assertTrue(store.updateName(record.fingerprint(), "Widget Deluxe"));

        CanonicalRecord updated = store.findByFingerprint(record.fingerprint()).orElseThrow();
        assertEquals(id, updated.id());
        assertEquals("x100", updated.article());
        assertEquals("Widget Deluxe", updated.name());
    }

    @Test
    void shouldReportMissingOnUpdate() {
        assertFalse(store.updateName("missing", "Name"));
    }

    @Test
    void shouldUpsertInsertThenUpdate() {
        store.upsertByFingerprint(record("x100", "acme", "Widget"));
        store.upsertByFingerprint(record("x100", "acme", "Widget v2"));

        assertEquals(1, store.count());
        assertEquals("Widget v2", store.findByFingerprint(Fingerprinter.fingerprint("x100", "acme"))
                .orElseThrow().name());
    }

    @Test
    void shouldFindByArticleBrand() {
        store.createIfAbsent(record("x100", "acme", "Widget"));
        store.createIfAbsent(new CanonicalRecord(null, "x100", "acme", "Legacy", Fingerprinter.sha256Hex("legacy")));
        store.createIfAbsent(record("y200", "acme", "Gadget"));

        List<CanonicalRecord> found = store.findByArticleBrand("x100", "acme");

        assertEquals(2, found.size());
        assertTrue(store.findByArticleBrand("z300", "acme").isEmpty());
    }

    @Test
    void shouldPageInIdOrder() {
        for (int i = 0; i < 5; i++) {
            store.createIfAbsent(record("a" + i, "brand", "Name " + i));
        }

        List<CanonicalRecord> first = store.findPage(0, 2);
        List<CanonicalRecord> second = store.findPage(2, 2);
        List<CanonicalRecord> third = store.findPage(4, 2);
        List<CanonicalRecord> past = store.findPage(6, 2);

        assertEquals(List.of("a0", "a1"), first.stream().map(CanonicalRecord::article).toList());
        assertEquals(List.of("a2", "a3"), second.stream().map(CanonicalRecord::article).toList());
        assertEquals(List.of("a4"), third.stream().map(CanonicalRecord::article).toList());
        assertTrue(past.isEmpty());
    }

    @Test
    void shouldTruncate() {
        store.createIfAbsent(record("x100", "acme", "Widget"));

        store.truncate();

        assertEquals(0, store.count());
    }

    @Test
    void shouldCreateSchemaIdempotently() {
        store.createSchemaIfAbsent();
        store.createSchemaIfAbsent();

        assertEquals(0, store.count());
    }
}
