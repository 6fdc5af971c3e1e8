package eu.virtualparadox.docindex.ingest.lifecycle;

import eu.virtualparadox.docindex.application.executor.IngestionExecutor;
import eu.virtualparadox.docindex.error.ConfigException;
import eu.virtualparadox.docindex.error.DocumentIndexException;
import eu.virtualparadox.docindex.error.ExtractionException;
import eu.virtualparadox.docindex.error.IndexWriteException;
import eu.virtualparadox.docindex.ingest.chunker.Chunker;
import eu.virtualparadox.docindex.ingest.extractor.TextExtractor;
import eu.virtualparadox.docindex.ingest.model.Chunk;
import eu.virtualparadox.docindex.ingest.model.IndexedChunk;
import eu.virtualparadox.docindex.ingest.model.TextUnit;
import eu.virtualparadox.docindex.ingest.tokenizer.Tokenizer;
import eu.virtualparadox.docindex.rag.index.DocumentMeta;
import eu.virtualparadox.docindex.rag.index.IndexStats;
import eu.virtualparadox.docindex.rag.index.IndexStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static eu.virtualparadox.docindex.util.ContentHashing.abbreviate;
import static eu.virtualparadox.docindex.util.ContentHashing.sha256;

/**
 * Manages the index lifecycle of documents:
 * <ul>
 *   <li>Content-hash identity and deduplication</li>
 *   <li>Freshness checks and periodic rebuilds of stale indexes</li>
 *   <li>Orphan cleanup when a logical name gets new content</li>
 *   <li>Age-based garbage collection and statistics</li>
 * </ul>
 * Supports both synchronous and asynchronous indexing.
 *
 * <p>At most one caller builds the index of a given hash at a time; concurrent callers for the same
 * hash wait for that build and reuse its result. Different hashes are indexed independently.</p>
 */
@Slf4j
@Service
public class IndexLifecycleManager {

    private static final String DEFAULT_MEDIA_TYPE = "application/octet-stream";

    private final IndexStore indexStore;
    private final TextExtractor textExtractor;
    private final Chunker chunker;
    private final Tokenizer tokenizer;
    private final IngestionExecutor ingestionExecutor;
    private final Clock clock;
    private final Duration staleThreshold;
    private final String defaultOrphanScope;

    private final Map<String, CompletableFuture<IndexHandle>> inFlight = new ConcurrentHashMap<>();

    public IndexLifecycleManager(final IndexStore indexStore,
                                 final TextExtractor textExtractor,
                                 final Chunker chunker,
                                 final Tokenizer tokenizer,
                                 final IngestionExecutor ingestionExecutor,
                                 final Clock clock,
                                 @Value("${docindex.index.stale-threshold-hours:24}") final long staleThresholdHours,
                                 @Value("${docindex.index.orphan-scope:global}") final String defaultOrphanScope) {
        if (staleThresholdHours <= 0) {
            throw new ConfigException("docindex.index.stale-threshold-hours must be positive, was " + staleThresholdHours);
        }
        if (defaultOrphanScope == null || defaultOrphanScope.isBlank()) {
            throw new ConfigException("docindex.index.orphan-scope must not be blank");
        }
        this.indexStore = indexStore;
        this.textExtractor = textExtractor;
        this.chunker = chunker;
        this.tokenizer = tokenizer;
        this.ingestionExecutor = ingestionExecutor;
        this.clock = clock;
        this.staleThreshold = Duration.ofHours(staleThresholdHours);
        this.defaultOrphanScope = defaultOrphanScope;
    }

    /**
     * Indexes a file in the default orphan scope.
     *
     * @see #ensureIndexed(Path, String)
     */
    public IndexHandle ensureIndexed(final Path path) {
        return ensureIndexed(path, defaultOrphanScope);
    }

    /**
     * Indexes a file unless a fresh index of identical content exists.
     * The file name is the logical name used for orphan cleanup.
     *
     * @param path        file to index
     * @param orphanScope namespace for orphan cleanup
     * @return handle with {@code created = false} if an existing index was reused
     * @throws ExtractionException if the file cannot be read or its format is unsupported
     * @throws IndexWriteException if the index cannot be written after one retry
     */
    public IndexHandle ensureIndexed(final Path path, final String orphanScope) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (!Files.isRegularFile(path)) {
            throw new ExtractionException("Not a readable file: " + path);
        }

        final DocumentSource source;
        try {
            source = new DocumentSource(sha256(path), path.getFileName().toString(), detectMediaType(path), Files.size(path));
        } catch (IOException e) {
            throw new ExtractionException("Unable to read " + path, e);
        }
        return ensureIndexed(source, orphanScope, () -> textExtractor.extract(path));
    }

    /**
     * Indexes a document whose text is produced by {@code extractFn}, which runs only if the index has
     * to be built.
     *
     * @param source      identity and attributes of the document
     * @param orphanScope namespace for orphan cleanup, {@code null} for the default scope
     * @param extractFn   supplier of the document's text units
     * @return handle describing the index
     */
    public IndexHandle ensureIndexed(final DocumentSource source,
                                     final String orphanScope,
                                     final Supplier<List<TextUnit>> extractFn) {
        final String scope = orphanScope == null ? defaultOrphanScope : orphanScope;
        final String hash = source.fileHash();

        final Optional<IndexHandle> reusable = freshHandle(hash);
        if (reusable.isPresent()) {
            log.info("Reusing fresh index {} for {}", abbreviate(hash), source.fileName());
            return reusable.get();
        }

        final CompletableFuture<IndexHandle> mine = new CompletableFuture<>();
        final CompletableFuture<IndexHandle> running = inFlight.putIfAbsent(hash, mine);
        if (running != null) {
            log.debug("Waiting for in-flight build of {}", abbreviate(hash));
            final IndexHandle built = await(running);
            return new IndexHandle(built.fileHash(), built.totalChunks(), false);
        }

        try {
            // another caller may have finished between the freshness check and the guard
            final IndexHandle handle = freshHandle(hash).orElseGet(() -> build(source, scope, extractFn));
            mine.complete(handle);
            return handle;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(hash, mine);
        }
    }

    /**
     * Submits {@link #ensureIndexed(Path)} to the ingestion worker pool.
     */
    public CompletableFuture<IndexHandle> ensureIndexedAsync(final Path path) {
        return CompletableFuture.supplyAsync(() -> ensureIndexed(path), ingestionExecutor);
    }

    /**
     * @param fileHash document hash
     * @return {@code true} if an index exists and is not older than the stale threshold
     */
    public boolean isFresh(final String fileHash) {
        return indexStore.exists(fileHash)
                .map(meta -> !meta.isStale(clock.instant(), staleThreshold))
                .orElse(false);
    }

    public Optional<DocumentMeta> loadIndex(final String fileHash) {
        return indexStore.exists(fileHash);
    }

    /**
     * Deletes every document named {@code fileName} in {@code orphanScope} except {@code keepHash}.
     *
     * @return number of documents removed
     */
    public int cleanupOrphansForName(final String fileName, final String keepHash, final String orphanScope) {
        int removed = 0;
        for (final DocumentMeta meta : indexStore.findByName(fileName, orphanScope)) {
            if (meta.fileHash().equals(keepHash)) {
                continue;
            }
            if (indexStore.deleteDocument(meta.fileHash())) {
                removed++;
                log.info("Removed orphan index {} of {} (replaced by {})",
                        abbreviate(meta.fileHash()), fileName, abbreviate(keepHash));
            }
        }
        return removed;
    }

    /**
     * Deletes every document indexed more than {@code days} days ago.
     *
     * @param days age limit in days, non-negative
     * @return number of documents removed
     */
    public int cleanupOlderThan(final int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative");
        }
        final Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int removed = 0;
        for (final DocumentMeta meta : indexStore.findIndexedBefore(cutoff)) {
            if (indexStore.deleteDocument(meta.fileHash())) {
                removed++;
            }
        }
        log.info("Removed {} index(es) older than {} days", removed, days);
        return removed;
    }

    public IndexStats getStats() {
        return indexStore.stats();
    }

    private Optional<IndexHandle> freshHandle(final String hash) {
        final Optional<DocumentMeta> existing = indexStore.exists(hash);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        final DocumentMeta meta = existing.get();
        if (meta.isStale(clock.instant(), staleThreshold)) {
            log.info("Index {} is stale (indexed at {}), rebuilding", abbreviate(hash), meta.indexedAt());
            return Optional.empty();
        }
        return Optional.of(new IndexHandle(hash, meta.totalChunks(), false));
    }

    /**
     * Extract, chunk, tokenize and store. A stale index of the same hash is replaced by the insert.
     */
    private IndexHandle build(final DocumentSource source, final String scope, final Supplier<List<TextUnit>> extractFn) {
        final String hash = source.fileHash();
        final List<TextUnit> units = extractFn.get();
        final List<Chunk> chunks = chunker.contentAwareChunks(units == null ? List.of() : units);
        if (chunks.isEmpty()) {
            throw new ExtractionException("No text could be extracted from " + source.fileName());
        }

        final List<IndexedChunk> indexed = chunks.stream()
                .map(c -> new IndexedChunk(c, tokenizer.tokenize(c.text())))
                .toList();
        final String fullText = chunks.stream()
                .map(Chunk::text)
                .collect(Collectors.joining("\n"));
        final DocumentMeta meta = DocumentMeta.builder()
                .fileHash(hash)
                .fileName(source.fileName())
                .mediaType(source.mediaType())
                .sizeBytes(source.sizeBytes())
                .indexedAt(clock.instant())
                .totalChunks(indexed.size())
                .orphanScope(scope)
                .build();

        insertWithRetry(meta, indexed, fullText);
        log.info("Indexed {} as {} ({} chunks)", source.fileName(), abbreviate(hash), indexed.size());

        try {
            cleanupOrphansForName(source.fileName(), hash, scope);
        } catch (DocumentIndexException e) {
            // the new index is complete; leftovers are retried on the next index of this name
            log.warn("Orphan cleanup for {} failed", source.fileName(), e);
        }
        return new IndexHandle(hash, indexed.size(), true);
    }

    private void insertWithRetry(final DocumentMeta meta, final List<IndexedChunk> chunks, final String fullText) {
        try {
            indexStore.insertDocument(meta, chunks, fullText);
        } catch (IndexWriteException first) {
            log.warn("Writing index {} failed, retrying once: {}", abbreviate(meta.fileHash()), first.getMessage());
            try {
                indexStore.insertDocument(meta, chunks, fullText);
            } catch (IndexWriteException second) {
                second.addSuppressed(first);
                throw second;
            }
        }
    }

    private static IndexHandle await(final CompletableFuture<IndexHandle> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static String detectMediaType(final Path path) {
        try {
            final String probed = Files.probeContentType(path);
            return probed == null ? DEFAULT_MEDIA_TYPE : probed;
        } catch (IOException e) {
            log.debug("Unable to probe media type of {}", path, e);
            return DEFAULT_MEDIA_TYPE;
        }
    }
}
