package win.ixuni.strata.core.pipeline;

import org.junit.jupiter.api.*;
import org.slf4j.LoggerFactory;
import win.ixuni.strata.core.cache.MemoryEntityCache;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.support.Book;
import win.ixuni.strata.core.support.RecordingEntityCollection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CollectionPipelineTest {

    private MemoryEntityCache cache;

    @BeforeEach
    void setUp() {
        cache = new MemoryEntityCache();
    }

    @Test
    @DisplayName("Layers are composed outermost first without timing")
    void orderWithoutTiming() {
        EntityCollection<Book> books = pipeline(false).wrap(new RecordingEntityCollection<>(Book.TYPE));

        assertEquals(List.of("SoftDeleteCollection", "DefaultValueCollection", "CachingCollection",
                "RecordingEntityCollection"), CollectionPipeline.describe(books));
    }

    @Test
    @DisplayName("Timing sits directly above the raw collection")
    void orderWithTiming() {
        EntityCollection<Book> books = pipeline(true).wrap(new RecordingEntityCollection<>(Book.TYPE));

        assertEquals(List.of("SoftDeleteCollection", "DefaultValueCollection", "CachingCollection",
                "TimingCollection", "RecordingEntityCollection"), CollectionPipeline.describe(books));
    }

    @Test
    @DisplayName("State check wraps every other layer")
    void guardOutermost() {
        AtomicBoolean open = new AtomicBoolean(true);
        CollectionPipeline pipeline = new CollectionPipeline(PipelineSettings.builder()
                .cache(cache)
                .logger(LoggerFactory.getLogger(CollectionPipelineTest.class))
                .stateCheck(() -> {
                    if (!open.get()) {
                        throw new IllegalStateException("closed");
                    }
                })
                .build());
        RecordingEntityCollection<Book> raw = new RecordingEntityCollection<>(Book.TYPE);
        EntityCollection<Book> books = pipeline.wrap(raw);
        books.create(new Book("b1", "Dune", "Herbert")).block();
        books.findById("b1").block();

        open.set(false);

        assertEquals("TransactionGuardCollection", CollectionPipeline.describe(books).get(0));
        assertThrows(IllegalStateException.class, () -> books.findById("b1").block());
        assertEquals(1, raw.calls("findById"));
    }

    @Test
    @DisplayName("Cached reads come back business-ready")
    void cachedReadsHaveDefaults() {
        RecordingEntityCollection<Book> raw = new RecordingEntityCollection<>(Book.TYPE);
        Map<String, Object> legacy = new LinkedHashMap<>();
        legacy.put("id", "old");
        legacy.put("title", "Walden");
        raw.seed(legacy);
        EntityCollection<Book> books = pipeline(false).wrap(raw);

        Book first = books.findById("old").block();
        Book second = books.findById("old").block();

        assertEquals("v2", first.getEdition());
        assertEquals("v2", second.getEdition());
        assertEquals(1, raw.calls("findById"));
    }

    @Test
    @DisplayName("Soft-deleted records stay hidden behind the cache")
    void deleteThroughPipeline() {
        RecordingEntityCollection<Book> raw = new RecordingEntityCollection<>(Book.TYPE);
        EntityCollection<Book> books = pipeline(false).wrap(raw);
        books.create(new Book("b1", "Dune", "Herbert")).block();
        books.findById("b1").block();

        assertTrue(books.delete("b1").block());

        assertNull(books.findById("b1").block());
        assertEquals(Boolean.TRUE, raw.rawDocument("b1").get("deleted"));
        assertEquals("tester", raw.rawDocument("b1").get("lastModifiedBy"));
    }

    private CollectionPipeline pipeline(boolean logTime) {
        return new CollectionPipeline(PipelineSettings.builder()
                .cache(cache)
                .actorId("tester")
                .logTime(logTime)
                .logger(LoggerFactory.getLogger(CollectionPipelineTest.class))
                .build());
    }
}
