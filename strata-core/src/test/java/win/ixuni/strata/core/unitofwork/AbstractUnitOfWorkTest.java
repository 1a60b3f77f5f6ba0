package win.ixuni.strata.core.unitofwork;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.*;
import org.slf4j.LoggerFactory;
import win.ixuni.strata.core.cache.MemoryEntityCache;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.config.CommitRetrySettings;
import win.ixuni.strata.core.config.UnitOfWorkOptions;
import win.ixuni.strata.core.exception.AbortFailedException;
import win.ixuni.strata.core.exception.AmbiguousCommitException;
import win.ixuni.strata.core.exception.CommitFailedException;
import win.ixuni.strata.core.exception.CommitRetryExhaustedException;
import win.ixuni.strata.core.exception.ConfigurationException;
import win.ixuni.strata.core.exception.IllegalTransactionStateException;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.pipeline.CollectionPipeline;
import win.ixuni.strata.core.support.Author;
import win.ixuni.strata.core.support.Book;
import win.ixuni.strata.core.support.LogCapture;
import win.ixuni.strata.core.support.ScriptedTransactionSession;
import win.ixuni.strata.core.support.TestUnitOfWork;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit of work lifecycle tests
 */
class AbstractUnitOfWorkTest {

    private static final CommitRetrySettings FAST_RETRY = CommitRetrySettings.builder()
            .maxRetries(3)
            .minBackoff(Duration.ofMillis(1))
            .maxBackoff(Duration.ofMillis(5))
            .build();

    private ScriptedTransactionSession session;
    private LogCapture logs;

    @BeforeEach
    void setUp() {
        session = new ScriptedTransactionSession();
        logs = LogCapture.of(TestUnitOfWork.class);
    }

    @AfterEach
    void tearDown() {
        logs.close();
    }

    // ==================== Collections ====================

    @Test
    @DisplayName("Collections are built once per type and fully decorated")
    void collectionIdentity() {
        TestUnitOfWork uow = unitOfWork(options().build());

        EntityCollection<Book> first = uow.getCollection(Book.TYPE);
        EntityCollection<Book> second = uow.getCollection(Book.TYPE);
        uow.getCollection(Author.TYPE);

        assertSame(first, second);
        assertEquals(2, uow.getCollectionsCreated().get());
        assertEquals(List.of("TransactionGuardCollection", "SoftDeleteCollection"),
                CollectionPipeline.describe(first).subList(0, 2));
    }

    @Test
    @DisplayName("Timing layer is added when enabled and logs to the unit of work logger")
    void timingEnabled() {
        TestUnitOfWork uow = unitOfWork(options().logTime(true).build());

        EntityCollection<Book> books = uow.getCollection(Book.TYPE);
        books.create(new Book("b1", "Dune", "Herbert")).block();

        assertTrue(CollectionPipeline.describe(books).contains("TimingCollection"));
        assertTrue(logs.messages(Level.INFO).stream().anyMatch(m -> m.startsWith("[books] Create completed in ")));
    }

    @Test
    @DisplayName("Actor id is stamped on writes")
    void actorStamped() {
        TestUnitOfWork uow = unitOfWork(options().build());

        uow.getCollection(Book.TYPE).create(new Book("b1", "Dune", "Herbert")).block();

        assertEquals("tester", uow.raw(Book.TYPE).rawDocument("b1").get("lastModifiedBy"));
        assertEquals("tester", uow.getActorId());
    }

    @Test
    @DisplayName("Database id carries the default qualifier")
    void databaseId() {
        assertEquals("test-Development", unitOfWork(options().build()).getDatabaseId());
        assertEquals("test-Production", unitOfWork(options().environment("Production").build()).getDatabaseId());
    }

    @Test
    @DisplayName("Missing options are a configuration error")
    void missingOptions() {
        assertThrows(ConfigurationException.class,
                () -> new TestUnitOfWork(new MemoryEntityCache(), LoggerFactory.getILoggerFactory(), null, session));
    }

    // ==================== Commit ====================

    @Test
    @DisplayName("Ambiguous commit results are retried until the commit succeeds")
    void commitRetriesAmbiguous() {
        session.failCommitWith(ambiguous(), ambiguous());
        TestUnitOfWork uow = unitOfWork(options().build());

        uow.commit().block();

        assertAll(
                () -> assertEquals(3, session.getCommitAttempts()),
                () -> assertEquals(TransactionState.COMMITTED, uow.getState()),
                () -> assertEquals(2, logs.count(Level.WARN)),
                () -> assertEquals(1, logs.count(Level.INFO)),
                () -> assertEquals("Transaction committed.", logs.messages(Level.INFO).get(0)),
                () -> assertTrue(logs.messages(Level.WARN).get(0).endsWith("attempt 2")),
                () -> assertTrue(logs.messages(Level.WARN).get(1).endsWith("attempt 3"))
        );
    }

    @Test
    @DisplayName("Definitive commit failures are not retried")
    void commitDefinitiveFailure() {
        session.failCommitWith(new CommitFailedException("Write conflict", null));
        TestUnitOfWork uow = unitOfWork(options().build());

        CommitFailedException error = assertThrows(CommitFailedException.class, () -> uow.commit().block());

        assertEquals("Write conflict", error.getMessage());
        assertEquals(1, session.getCommitAttempts());
        assertEquals(TransactionState.FAILED, uow.getState());
        assertEquals(0, logs.count(Level.WARN));
        assertEquals(1, logs.count(Level.ERROR));
    }

    @Test
    @DisplayName("Retries stop after the configured bound")
    void commitRetryExhausted() {
        session.failCommitWith(ambiguous(), ambiguous(), ambiguous(), ambiguous(), ambiguous());
        TestUnitOfWork uow = unitOfWork(options().build());

        CommitRetryExhaustedException error = assertThrows(CommitRetryExhaustedException.class,
                () -> uow.commit().block());

        assertEquals(4, error.getAttempts());
        assertInstanceOf(AmbiguousCommitException.class, error.getCause());
        assertEquals(4, session.getCommitAttempts());
        assertEquals(TransactionState.FAILED, uow.getState());
    }

    @Test
    @DisplayName("Unbounded retry outlasts the default bound")
    void commitRetryUnbounded() {
        RuntimeException[] failures = new RuntimeException[15];
        for (int i = 0; i < failures.length; i++) {
            failures[i] = ambiguous();
        }
        session.failCommitWith(failures);
        CommitRetrySettings retry = CommitRetrySettings.unbounded().toBuilder()
                .minBackoff(Duration.ofMillis(1))
                .maxBackoff(Duration.ofMillis(2))
                .build();
        TestUnitOfWork uow = unitOfWork(options().commitRetry(retry).build());

        uow.commit().block(Duration.ofSeconds(10));

        assertAll(
                () -> assertEquals(Long.MAX_VALUE, retry.getMaxRetries()),
                () -> assertEquals(16, session.getCommitAttempts()),
                () -> assertEquals(TransactionState.COMMITTED, uow.getState()),
                () -> assertEquals(15, logs.count(Level.WARN)),
                () -> assertTrue(logs.messages(Level.WARN).get(14).endsWith("attempt 16"))
        );
    }

    @Test
    @DisplayName("Operations after commit are rejected")
    void closedAfterCommit() {
        TestUnitOfWork uow = unitOfWork(options().build());
        uow.commit().block();

        assertThrows(IllegalTransactionStateException.class, () -> uow.getCollection(Book.TYPE));
        assertThrows(IllegalTransactionStateException.class, () -> uow.commit().block());
        assertThrows(IllegalTransactionStateException.class, () -> uow.abort().block());
    }

    @Test
    @DisplayName("A collection held past commit rejects every operation")
    void heldCollectionAfterCommit() {
        TestUnitOfWork uow = unitOfWork(options().build());
        EntityCollection<Book> books = uow.getCollection(Book.TYPE);
        Book book = books.create(new Book("b1", "Dune", "Herbert")).block();
        books.findById("b1").block();
        uow.commit().block();

        assertThrows(IllegalTransactionStateException.class, () -> books.findById("b1").block());
        assertThrows(IllegalTransactionStateException.class, () -> books.update(book).block());
        assertThrows(IllegalTransactionStateException.class, () -> books.delete("b1").block());
        assertThrows(IllegalTransactionStateException.class,
                () -> books.find(EntityFilter.all()).collectList().block());
        assertEquals(1, uow.raw(Book.TYPE).calls("findById"));
        assertEquals(0, uow.raw(Book.TYPE).calls("update"));
    }

    @Test
    @DisplayName("A collection held past abort rejects every operation")
    void heldCollectionAfterAbort() {
        TestUnitOfWork uow = unitOfWork(options().build());
        EntityCollection<Book> books = uow.getCollection(Book.TYPE);
        Book book = books.create(new Book("b1", "Dune", "Herbert")).block();
        uow.abort().block();

        assertThrows(IllegalTransactionStateException.class, () -> books.findById("b1").block());
        assertThrows(IllegalTransactionStateException.class, () -> books.update(book).block());
        assertThrows(IllegalTransactionStateException.class, () -> books.create(new Book()).block());
        assertEquals(0, uow.raw(Book.TYPE).calls("findById"));
    }

    @Test
    @DisplayName("Commit is lazy")
    void commitLazy() {
        TestUnitOfWork uow = unitOfWork(options().build());

        uow.commit();

        assertEquals(0, session.getCommitAttempts());
        assertEquals(TransactionState.STARTED, uow.getState());
    }

    // ==================== Abort / Close ====================

    @Test
    @DisplayName("Abort issues a single rollback")
    void abort() {
        TestUnitOfWork uow = unitOfWork(options().build());

        uow.abort().block();

        assertEquals(1, session.getAbortAttempts());
        assertEquals(TransactionState.ABORTED, uow.getState());
        assertEquals("Transaction aborted.", logs.messages(Level.INFO).get(0));
    }

    @Test
    @DisplayName("Abort failures propagate without retry")
    void abortFailure() {
        session.failAbortWith(new AbortFailedException("Abort refused", null));
        TestUnitOfWork uow = unitOfWork(options().build());

        assertThrows(AbortFailedException.class, () -> uow.abort().block());

        assertEquals(1, session.getAbortAttempts());
        assertEquals(TransactionState.FAILED, uow.getState());
    }

    @Test
    @DisplayName("Close aborts an open transaction and releases resources once")
    void closeAborts() {
        TestUnitOfWork uow = unitOfWork(options().build());

        uow.close();
        uow.close();

        assertEquals(1, session.getAbortAttempts());
        assertEquals(TransactionState.ABORTED, uow.getState());
        assertTrue(uow.isReleased());
        assertTrue(session.isClosed());
    }

    @Test
    @DisplayName("Close after commit only releases")
    void closeAfterCommit() {
        TestUnitOfWork uow = unitOfWork(options().build());
        uow.commit().block();

        uow.close();

        assertEquals(0, session.getAbortAttempts());
        assertEquals(TransactionState.COMMITTED, uow.getState());
        assertTrue(uow.isReleased());
    }

    private TestUnitOfWork unitOfWork(UnitOfWorkOptions options) {
        return new TestUnitOfWork(new MemoryEntityCache(), LoggerFactory.getILoggerFactory(), options, session);
    }

    private static UnitOfWorkOptions.UnitOfWorkOptionsBuilder<?, ?> options() {
        return UnitOfWorkOptions.builder().actorId("tester").commitRetry(FAST_RETRY);
    }

    private static AmbiguousCommitException ambiguous() {
        return new AmbiguousCommitException("Commit result unknown", null);
    }
}
