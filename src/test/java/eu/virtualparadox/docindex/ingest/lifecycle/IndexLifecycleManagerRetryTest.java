package eu.virtualparadox.docindex.ingest.lifecycle;

import eu.virtualparadox.docindex.application.executor.IngestionExecutor;
import eu.virtualparadox.docindex.error.ConfigException;
import eu.virtualparadox.docindex.error.ExtractionException;
import eu.virtualparadox.docindex.error.IndexWriteException;
import eu.virtualparadox.docindex.ingest.chunker.Chunker;
import eu.virtualparadox.docindex.ingest.extractor.TextExtractor;
import eu.virtualparadox.docindex.ingest.model.EUnitKind;
import eu.virtualparadox.docindex.ingest.model.TextUnit;
import eu.virtualparadox.docindex.ingest.tokenizer.Tokenizer;
import eu.virtualparadox.docindex.rag.index.IndexStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Error policy of the lifecycle manager: write failures are retried once, extraction failures never.
 */
class IndexLifecycleManagerRetryTest {

    private static final DocumentSource SOURCE = new DocumentSource("ab".repeat(32), "report.txt", "text/plain", 42);

    private final Tokenizer tokenizer = new Tokenizer(true, true);
    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private IndexStore store;
    private IndexLifecycleManager manager;

    @BeforeEach
    void setUp() {
        store = mock(IndexStore.class);
        when(store.exists(anyString())).thenReturn(Optional.empty());
        when(store.findByName(anyString(), anyString())).thenReturn(List.of());
        manager = new IndexLifecycleManager(store, mock(TextExtractor.class), new Chunker(400, 80, 50), tokenizer,
                new IngestionExecutor(), clock, 24, "global");
    }

    @AfterEach
    void tearDown() {
        tokenizer.close();
    }

    private static Supplier<List<TextUnit>> units(AtomicInteger calls) {
        return () -> {
            calls.incrementAndGet();
            return List.of(new TextUnit(1, EUnitKind.PARAGRAPH, "Revenue grew strongly in the third quarter."));
        };
    }

    @Test
    @DisplayName("A failed write is retried once and then succeeds")
    void ensureIndexed_transientWriteFailure_retriedOnce() {
        doThrow(new IndexWriteException("disk hiccup"))
                .doNothing()
                .when(store).insertDocument(any(), anyList(), any());
        AtomicInteger extractions = new AtomicInteger();

        IndexHandle handle = manager.ensureIndexed(SOURCE, null, units(extractions));

        assertTrue(handle.created());
        assertEquals(1, handle.totalChunks());
        assertEquals(1, extractions.get(), "extraction is not repeated on retry");
        verify(store, times(2)).insertDocument(any(), anyList(), any());
    }

    @Test
    @DisplayName("A write failing twice is surfaced")
    void ensureIndexed_persistentWriteFailure_surfaced() {
        doThrow(new IndexWriteException("disk full")).when(store).insertDocument(any(), anyList(), any());

        IndexWriteException ex = assertThrows(IndexWriteException.class,
                () -> manager.ensureIndexed(SOURCE, null, units(new AtomicInteger())));

        assertEquals(1, ex.getSuppressed().length);
        verify(store, times(2)).insertDocument(any(), anyList(), any());
    }

    @Test
    @DisplayName("Extraction failures are not retried")
    void ensureIndexed_extractionFailure_notRetried() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<List<TextUnit>> failing = () -> {
            calls.incrementAndGet();
            throw new ExtractionException("corrupt file");
        };

        assertThrows(ExtractionException.class, () -> manager.ensureIndexed(SOURCE, null, failing));

        assertEquals(1, calls.get());
        verify(store, never()).insertDocument(any(), anyList(), any());
    }

    @Test
    @DisplayName("A document without text is an extraction error")
    void ensureIndexed_noText_extractionException() {
        assertThrows(ExtractionException.class,
                () -> manager.ensureIndexed(SOURCE, null, () -> List.of(new TextUnit(1, EUnitKind.PAGE, "  "))));
    }

    @Test
    @DisplayName("Metadata carries name, scope and clock time")
    void ensureIndexed_passesMetadata() {
        manager.ensureIndexed(SOURCE, "session-7", units(new AtomicInteger()));

        verify(store).insertDocument(argThat(meta -> meta.fileName().equals("report.txt")
                && meta.orphanScope().equals("session-7")
                && meta.indexedAt().equals(clock.instant())
                && meta.totalChunks() == 1), anyList(), any());
        verify(store).findByName("report.txt", "session-7");
    }

    @Test
    @DisplayName("Invalid lifecycle settings fail at construction")
    void constructor_invalidSettings_throwConfigException() {
        assertThrows(ConfigException.class, () -> new IndexLifecycleManager(store, mock(TextExtractor.class),
                new Chunker(400, 80, 50), tokenizer, new IngestionExecutor(), clock, 0, "global"));
        assertThrows(ConfigException.class, () -> new IndexLifecycleManager(store, mock(TextExtractor.class),
                new Chunker(400, 80, 50), tokenizer, new IngestionExecutor(), clock, 24, " "));
    }
}
