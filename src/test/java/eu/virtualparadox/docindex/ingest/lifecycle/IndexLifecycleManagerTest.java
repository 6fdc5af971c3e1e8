package eu.virtualparadox.docindex.ingest.lifecycle;

import eu.virtualparadox.docindex.error.ExtractionException;
import eu.virtualparadox.docindex.ingest.model.EUnitKind;
import eu.virtualparadox.docindex.ingest.model.TextUnit;
import eu.virtualparadox.docindex.rag.index.DocumentMeta;
import eu.virtualparadox.docindex.rag.index.ETokenColumn;
import eu.virtualparadox.docindex.rag.index.IndexStats;
import eu.virtualparadox.docindex.rag.index.IndexStore;
import eu.virtualparadox.docindex.support.MutableClock;
import eu.virtualparadox.docindex.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestClockConfig.class)
class IndexLifecycleManagerTest {

    private static final String REPORT_V1 = "The quarterly report shows revenue growth in Europe.\n\nCosts were stable across all regions.";
    private static final String REPORT_V2 = "The revised report shows declining margins in Asia.\n\nHeadcount increased in every office.";

    @Autowired
    private IndexLifecycleManager manager;

    @Autowired
    private IndexStore indexStore;

    @Autowired
    private MutableClock clock;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        clock.reset();
        indexStore.listDocuments().forEach(meta -> indexStore.deleteDocument(meta.fileHash()));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("Indexing identical bytes twice reuses the first index")
    void ensureIndexed_twice_idempotent() throws IOException {
        Path file = write("report.txt", REPORT_V1);

        IndexHandle first = manager.ensureIndexed(file);
        IndexHandle second = manager.ensureIndexed(file);

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.fileHash(), second.fileHash());
        assertEquals(first.totalChunks(), second.totalChunks());
        assertEquals(1, manager.getStats().totalFiles());
    }

    @Test
    @DisplayName("Identical content under two names maps to one document")
    void ensureIndexed_sameBytesDifferentNames_deduplicated() throws IOException {
        IndexHandle a = manager.ensureIndexed(write("a.txt", REPORT_V1));
        IndexHandle b = manager.ensureIndexed(write("b.txt", REPORT_V1));

        assertEquals(a.fileHash(), b.fileHash());
        assertFalse(b.created());
        assertEquals(1, indexStore.listDocuments().size());
    }

    @Test
    @DisplayName("New content under the same name removes the old index and its chunks")
    void ensureIndexed_replacedContent_orphanRemoved() throws IOException {
        Path file = write("report.txt", REPORT_V1);
        IndexHandle old = manager.ensureIndexed(file);
        Files.writeString(file, REPORT_V2);

        IndexHandle current = manager.ensureIndexed(file);

        assertNotEquals(old.fileHash(), current.fileHash());
        assertTrue(indexStore.exists(old.fileHash()).isEmpty());
        assertTrue(indexStore.query(List.of("europ"), ETokenColumn.STEM, 10).isEmpty());
        assertEquals(1, manager.getStats().totalFiles());
    }

    @Test
    @DisplayName("Orphan cleanup only applies within the same scope")
    void ensureIndexed_differentScopes_bothKept() throws IOException {
        Path dirA = Files.createDirectories(tempDir.resolve("a"));
        Path dirB = Files.createDirectories(tempDir.resolve("b"));
        Path v1 = Files.writeString(dirA.resolve("report.txt"), REPORT_V1);
        Path v2 = Files.writeString(dirB.resolve("report.txt"), REPORT_V2);

        IndexHandle first = manager.ensureIndexed(v1, "session-1");
        IndexHandle second = manager.ensureIndexed(v2, "session-2");

        assertTrue(indexStore.exists(first.fileHash()).isPresent());
        assertTrue(indexStore.exists(second.fileHash()).isPresent());
        assertEquals(0, manager.cleanupOrphansForName("report.txt", second.fileHash(), "session-2"));
        assertEquals(1, manager.cleanupOrphansForName("report.txt", second.fileHash(), "session-1"));
    }

    @Test
    @DisplayName("Index is fresh after 1h and stale after 25h, and a stale index is rebuilt")
    void staleness_thresholdAndRebuild() throws IOException {
        Path file = write("report.txt", REPORT_V1);
        IndexHandle handle = manager.ensureIndexed(file);
        String firstGeneration = manager.loadIndex(handle.fileHash()).map(DocumentMeta::generation).orElseThrow();

        clock.advance(Duration.ofHours(1));
        assertTrue(manager.isFresh(handle.fileHash()));
        assertFalse(manager.ensureIndexed(file).created());

        clock.advance(Duration.ofHours(24));
        assertFalse(manager.isFresh(handle.fileHash()));

        IndexHandle rebuilt = manager.ensureIndexed(file);
        assertTrue(rebuilt.created());
        assertEquals(handle.fileHash(), rebuilt.fileHash());
        DocumentMeta rebuiltMeta = manager.loadIndex(handle.fileHash()).orElseThrow();
        assertEquals(clock.instant(), rebuiltMeta.indexedAt());
        assertNotEquals(firstGeneration, rebuiltMeta.generation());
        assertEquals(1, manager.getStats().totalFiles());
        assertEquals(handle.totalChunks(), manager.getStats().totalChunks());
    }

    @Test
    @DisplayName("Documents older than the cutoff are garbage collected")
    void cleanupOlderThan_removesOldDocuments() throws IOException {
        manager.ensureIndexed(write("old.txt", REPORT_V1));
        clock.advance(Duration.ofDays(40));
        manager.ensureIndexed(write("new.txt", REPORT_V2));
        assertEquals(2, manager.getStats().totalFiles());

        assertEquals(1, manager.cleanupOlderThan(30));

        assertEquals(1, manager.getStats().totalFiles());
        assertEquals(0, manager.cleanupOlderThan(30), "cleanup is idempotent");
    }

    @Test
    @DisplayName("Stats report files, chunks and bytes")
    void getStats_aggregates() throws IOException {
        Path file = write("report.txt", REPORT_V1);
        IndexHandle handle = manager.ensureIndexed(file);

        IndexStats stats = manager.getStats();

        assertEquals(1, stats.totalFiles());
        assertEquals(handle.totalChunks(), stats.totalChunks());
        assertEquals(Files.size(file), stats.totalSizeBytes());
    }

    @Test
    @DisplayName("Index metadata can be loaded by hash")
    void loadIndex_returnsMetadata() throws IOException {
        IndexHandle handle = manager.ensureIndexed(write("notes.md", REPORT_V1));

        DocumentMeta meta = manager.loadIndex(handle.fileHash()).orElseThrow();

        assertEquals("notes.md", meta.fileName());
        assertEquals(handle.totalChunks(), meta.totalChunks());
        assertEquals(clock.instant(), meta.indexedAt());
        assertTrue(manager.loadIndex("0".repeat(64)).isEmpty());
    }

    @Test
    @DisplayName("Concurrent requests for one hash extract only once")
    void ensureIndexed_concurrentSameHash_singleExtraction() throws Exception {
        DocumentSource source = new DocumentSource("cd".repeat(32), "shared.txt", "text/plain", 10);
        AtomicInteger extractions = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        int callers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<IndexHandle>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return manager.ensureIndexed(source, null, () -> {
                        extractions.incrementAndGet();
                        sleep(200);
                        return List.of(new TextUnit(1, EUnitKind.PARAGRAPH, "Shared content for every caller."));
                    });
                }));
            }
            start.countDown();

            int created = 0;
            for (Future<IndexHandle> f : futures) {
                if (f.get(30, TimeUnit.SECONDS).created()) {
                    created++;
                }
            }
            assertEquals(1, extractions.get());
            assertEquals(1, created);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Asynchronous indexing completes on the ingestion pool")
    void ensureIndexedAsync_completes() throws Exception {
        IndexHandle handle = manager.ensureIndexedAsync(write("async.txt", REPORT_V2)).get(30, TimeUnit.SECONDS);

        assertTrue(handle.created());
        assertThat(manager.isFresh(handle.fileHash())).isTrue();
    }

    @Test
    @DisplayName("Unsupported or missing files raise ExtractionException")
    void ensureIndexed_badInput_extractionException() throws IOException {
        Path docx = write("report.docx", "not really a docx");

        assertThrows(ExtractionException.class, () -> manager.ensureIndexed(docx));
        assertThrows(ExtractionException.class, () -> manager.ensureIndexed(tempDir.resolve("missing.txt")));
        assertEquals(0, manager.getStats().totalFiles());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
