package win.ixuni.strata.core.collection.decorator;

import org.junit.jupiter.api.*;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.support.Book;
import win.ixuni.strata.core.support.RecordingEntityCollection;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultValueCollectionTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private RecordingEntityCollection<Book> raw;
    private DefaultValueCollection<Book> books;

    @BeforeEach
    void setUp() {
        raw = new RecordingEntityCollection<>(Book.TYPE);
        books = new DefaultValueCollection<>(raw, "alice", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== Reads ====================

    @Test
    @DisplayName("Records stored before a field existed are backfilled on read")
    void backfillOnRead() {
        Map<String, Object> legacy = new LinkedHashMap<>();
        legacy.put("id", "old");
        legacy.put("title", "Walden");
        raw.seed(legacy);

        Book book = books.findById("old").block();

        assertNotNull(book);
        assertEquals("v2", book.getEdition());
        assertFalse(raw.rawDocument("old").containsKey("edition"));
    }

    @Test
    @DisplayName("Stored values are never overwritten by defaults")
    void keepsStoredValue() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", "new");
        document.put("edition", "v3");
        raw.seed(document);

        List<Book> found = books.find(EntityFilter.all()).collectList().block();

        assertEquals(1, found.size());
        assertEquals("v3", found.get(0).getEdition());
    }

    // ==================== Writes ====================

    @Test
    @DisplayName("Create stamps audit fields and defaults")
    void createStamps() {
        Book created = books.create(new Book("b1", "Dune", "Herbert")).block();

        assertAll(
                () -> assertEquals(NOW, created.getCreated()),
                () -> assertEquals(NOW, created.getLastModified()),
                () -> assertEquals("alice", created.getLastModifiedBy()),
                () -> assertEquals("v2", raw.rawDocument("b1").get("edition"))
        );
    }

    @Test
    @DisplayName("Update keeps the creation time and records the actor")
    void updateStamps() {
        Book book = new Book("b1", "Dune", "Herbert");
        book.setCreated(Instant.parse("2020-01-01T00:00:00Z"));
        raw.create(book).block();

        book.setTitle("Dune Messiah");
        Book updated = books.update(book).block();

        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), updated.getCreated());
        assertEquals(NOW, updated.getLastModified());
        assertEquals("alice", updated.getLastModifiedBy());
        assertEquals("Dune Messiah", raw.rawDocument("b1").get("title"));
    }

    @Test
    @DisplayName("Nothing reaches the store before subscription")
    void lazyCreate() {
        books.create(new Book("b1", "Dune", "Herbert"));

        assertEquals(0, raw.calls("create"));
    }
}
