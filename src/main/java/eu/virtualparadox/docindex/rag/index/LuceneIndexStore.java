package eu.virtualparadox.docindex.rag.index;

import eu.virtualparadox.docindex.catalog.service.DocumentCatalogService;
import eu.virtualparadox.docindex.error.IndexWriteException;
import eu.virtualparadox.docindex.ingest.model.Chunk;
import eu.virtualparadox.docindex.ingest.model.EUnitKind;
import eu.virtualparadox.docindex.ingest.model.IndexedChunk;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.*;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.MultiTerms;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.search.*;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.util.BytesRef;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static eu.virtualparadox.docindex.util.ContentHashing.abbreviate;
import static eu.virtualparadox.docindex.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link IndexStore} with the document-metadata table in the catalog.
 * <p>
 * Each chunk is stored as one Lucene {@link Document}; the metadata row in the catalog is written
 * only after the chunks are committed, so the row acts as the commit marker of the whole document.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code fileHash} – {@link StringField}, stored: owning document, used for filtering and cascade deletes</li>
 *   <li>{@code chunkKey} – {@link StringField}: {@code hash#chunkId}, exact lookup of one chunk</li>
 *   <li>{@code generation} – {@link StringField}, stored: insert that wrote the chunk, recorded in the catalog row</li>
 *   <li>{@code chunkId}, {@code unitIndex}, {@code offset} – {@link StoredField} ints</li>
 *   <li>{@code unitKind}, {@code text} – {@link StoredField} strings</li>
 *   <li>{@code stemTokens}, {@code segTokens} – {@link TextField}: pre-tokenized columns, whitespace-joined</li>
 * </ul>
 *
 * <p><b>Concurrency:</b> writes are serialized by a lock so that a commit never publishes half of another
 * document; reads go through the {@link SearcherManager} and never block on writers.</p>
 *
 * <p><b>Scores:</b> Lucene's BM25 reports "higher is better" but leaves out the constant {@code (k1 + 1)}
 * numerator of the term-frequency part; {@link #toRelevance(float)} puts it back, so scores follow the
 * textbook formula {@code idf(t) * f * (k1 + 1) / (f + k1 * (1 - b + b * |D| / avgdl))}.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LuceneIndexStore implements IndexStore {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final DocumentCatalogService catalogService;
    private final BM25Similarity similarity;

    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * Removes chunks that no catalog row points to, left behind by a crash between the Lucene commit
     * and the catalog write: all chunks of a hash without a row, and chunks of any generation other than
     * the one recorded in the row.
     */
    @PostConstruct
    public void purgeUncommittedChunks() {
        final List<Query> uncommitted = new ArrayList<>();
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final Terms terms = MultiTerms.getTerms(searcher.getIndexReader(), FIELD_FILE_HASH);
                if (terms == null) {
                    return;
                }
                final TermsEnum termsEnum = terms.iterator();
                BytesRef term;
                while ((term = termsEnum.next()) != null) {
                    final String hash = term.utf8ToString();
                    final Optional<DocumentMeta> row = catalogService.findByHash(hash);
                    final Query leftovers = row.isEmpty()
                            ? new TermQuery(new Term(FIELD_FILE_HASH, hash))
                            : otherGenerations(hash, row.get().generation());
                    if (leftovers != null && searcher.count(leftovers) > 0) {
                        uncommitted.add(leftovers);
                    }
                }
            } finally {
                searcherManager.release(searcher);
            }

            if (uncommitted.isEmpty()) {
                return;
            }
            writeLock.lock();
            try {
                for (final Query leftovers : uncommitted) {
                    writer.deleteDocuments(leftovers);
                    log.warn("Purged uncommitted chunks: {}", leftovers);
                }
                writer.commit();
                searcherManager.maybeRefreshBlocking();
            } finally {
                writeLock.unlock();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to reconcile index with catalog", e);
        }
    }

    @Override
    public void insertDocument(final DocumentMeta meta, final List<IndexedChunk> chunks) {
        insertDocument(meta, chunks, chunks == null ? null : chunks.stream()
                .map(c -> c.chunk().text())
                .collect(Collectors.joining("\n")));
    }

    /**
     * Adds or replaces all chunks of a document, then records its metadata row.
     * <p>
     * Every insert writes a new generation of chunks next to the previous one:
     * <ol>
     *   <li>Validate the batch (nothing is written for a malformed batch)</li>
     *   <li>Add the new chunks tagged with a fresh generation and commit</li>
     *   <li>Save the catalog row pointing at that generation; on failure delete only the new generation,
     *       leaving a previous index of the hash untouched</li>
     *   <li>Delete the chunks of every other generation and commit</li>
     *   <li>Refresh the searcher, so readers switch from the old to the new generation at once</li>
     * </ol>
     */
    @Override
    public void insertDocument(final DocumentMeta meta, final List<IndexedChunk> chunks, final String fullText) {
        validateBatch(meta, chunks);

        final String hash = meta.fileHash();
        final String generation = UUID.randomUUID().toString();
        final Query newGeneration = generation(hash, generation);
        final List<Document> docs = chunks.stream()
                .map(c -> buildLuceneDocument(hash, generation, c))
                .toList();
        final DocumentMeta stored = meta.toBuilder()
                .totalChunks(chunks.size())
                .generation(generation)
                .build();

        writeLock.lock();
        try {
            try {
                writer.addDocuments(docs);
                writer.commit();
            } catch (IOException | RuntimeException e) {
                final IndexWriteException failure = new IndexWriteException("Failed to write chunks of " + abbreviate(hash), e);
                discardChunks(newGeneration, failure);
                throw failure;
            }

            try {
                catalogService.save(stored, fullText);
            } catch (RuntimeException e) {
                final IndexWriteException failure = new IndexWriteException("Failed to record document " + abbreviate(hash), e);
                discardChunks(newGeneration, failure);
                throw failure;
            }

            try {
                writer.deleteDocuments(otherGenerations(hash, generation));
                writer.commit();
            } catch (IOException e) {
                // the row already points at the new generation; leftovers go with the next purge or insert
                throw new IndexWriteException("Failed to drop previous chunks of " + abbreviate(hash), e);
            }

            refreshSearcher();
            log.debug("Stored {} chunks for {}", chunks.size(), abbreviate(hash));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<DocumentMeta> exists(final String fileHash) {
        requireNonBlank(fileHash, "fileHash");
        return catalogService.findByHash(fileHash);
    }

    /**
     * Deletes the catalog row first, then the chunks. A crash in between leaves only chunks without a
     * row, which {@link #purgeUncommittedChunks()} removes on the next start.
     */
    @Override
    public boolean deleteDocument(final String fileHash) {
        requireNonBlank(fileHash, "fileHash");
        writeLock.lock();
        try {
            final boolean removed = catalogService.delete(fileHash);
            writer.deleteDocuments(new Term(FIELD_FILE_HASH, fileHash));
            writer.commit();
            refreshSearcher();
            return removed;
        } catch (IOException e) {
            throw new IndexWriteException("Failed to delete chunks of " + abbreviate(fileHash), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<ScoredChunk> query(final List<String> tokens, final ETokenColumn column, final int limit) {
        return query(tokens, column, null, limit);
    }

    @Override
    public List<ScoredChunk> query(final List<String> tokens,
                                   final ETokenColumn column,
                                   final String fileHash,
                                   final int limit) {
        if (column == null) {
            throw new IllegalArgumentException("column must not be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }

        final Query query = buildQuery(tokens, column, fileHash);
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final TopDocs topDocs = searcher.search(query, limit);
                final StoredFields storedFields = searcher.storedFields();
                final List<ScoredChunk> hits = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    final Document doc = storedFields.document(sd.doc, Set.of(FIELD_FILE_HASH, FIELD_CHUNK_ID));
                    hits.add(new ScoredChunk(
                            doc.get(FIELD_FILE_HASH),
                            doc.getField(FIELD_CHUNK_ID).numericValue().intValue(),
                            toRelevance(sd.score)));
                }
                return hits;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Index query failed on column " + column, e);
        }
    }

    @Override
    public Map<Integer, StoredChunk> loadChunks(final String fileHash, final Collection<Integer> chunkIds) {
        requireNonBlank(fileHash, "fileHash");
        if (chunkIds == null || chunkIds.isEmpty()) {
            return Map.of();
        }

        final BooleanQuery.Builder keys = new BooleanQuery.Builder();
        final Set<Integer> distinct = new TreeSet<>(chunkIds);
        for (final Integer id : distinct) {
            keys.add(new TermQuery(new Term(FIELD_CHUNK_KEY, chunkKey(fileHash, id))), BooleanClause.Occur.SHOULD);
        }

        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final TopDocs topDocs = searcher.search(new ConstantScoreQuery(keys.build()), distinct.size());
                final StoredFields storedFields = searcher.storedFields();
                final Map<Integer, StoredChunk> result = new HashMap<>();
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    final StoredChunk chunk = toStoredChunk(storedFields.document(sd.doc));
                    result.put(chunk.chunkId(), chunk);
                }
                return result;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load chunks of " + abbreviate(fileHash), e);
        }
    }

    @Override
    public Optional<String> loadFullText(final String fileHash) {
        requireNonBlank(fileHash, "fileHash");
        return catalogService.findFullText(fileHash);
    }

    @Override
    public List<DocumentMeta> findByName(final String fileName, final String orphanScope) {
        return catalogService.findByName(fileName, orphanScope);
    }

    @Override
    public List<DocumentMeta> findIndexedBefore(final Instant cutoff) {
        return catalogService.findIndexedBefore(cutoff);
    }

    @Override
    public List<DocumentMeta> listDocuments() {
        return catalogService.listAll();
    }

    @Override
    public IndexStats stats() {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final IndexReader reader = searcher.getIndexReader();
                return new IndexStats(catalogService.count(), reader.numDocs(), catalogService.sumSizeBytes());
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read index statistics", e);
        }
    }

    /**
     * {@code (t1 OR t2 OR ...)} on the column, filtered to one document when a hash is given.
     * Repeated query tokens are collapsed; the BM25 sum then runs over distinct tokens.
     */
    private static Query buildQuery(final List<String> tokens, final ETokenColumn column, final String fileHash) {
        final Set<String> distinct = new LinkedHashSet<>(tokens);
        final int maxClauses = IndexSearcher.getMaxClauseCount();
        final BooleanQuery.Builder terms = new BooleanQuery.Builder();
        int clauses = 0;
        for (final String token : distinct) {
            if (clauses++ >= maxClauses - 1) {
                break;
            }
            terms.add(new TermQuery(new Term(column.field(), token)), BooleanClause.Occur.SHOULD);
        }

        final BooleanQuery.Builder query = new BooleanQuery.Builder()
                .add(terms.build(), BooleanClause.Occur.MUST);
        if (fileHash != null) {
            query.add(new TermQuery(new Term(FIELD_FILE_HASH, fileHash)), BooleanClause.Occur.FILTER);
        }
        return query.build();
    }

    /**
     * Converts a backend score to the public convention: higher is better, scaled by {@code (k1 + 1)}.
     */
    private float toRelevance(final float backendScore) {
        return backendScore * (similarity.getK1() + 1f);
    }

    /**
     * Chunks of {@code fileHash} written by one insert.
     */
    private static Query generation(final String fileHash, final String generation) {
        return new BooleanQuery.Builder()
                .add(new TermQuery(new Term(FIELD_FILE_HASH, fileHash)), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(FIELD_GENERATION, generation)), BooleanClause.Occur.FILTER)
                .build();
    }

    /**
     * Chunks of {@code fileHash} written by any insert but {@code keep}; {@code null} when the row
     * predates generations and every chunk belongs to it.
     */
    private static Query otherGenerations(final String fileHash, final String keep) {
        if (keep == null) {
            return null;
        }
        return new BooleanQuery.Builder()
                .add(new TermQuery(new Term(FIELD_FILE_HASH, fileHash)), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(FIELD_GENERATION, keep)), BooleanClause.Occur.MUST_NOT)
                .build();
    }

    /**
     * Builds a Lucene {@link Document} for a single chunk.
     */
    private static Document buildLuceneDocument(final String fileHash, final String generation, final IndexedChunk indexed) {
        final Chunk c = indexed.chunk();
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_FILE_HASH, fileHash, Field.Store.YES));
        d.add(new StringField(FIELD_GENERATION, generation, Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_KEY, chunkKey(fileHash, c.sequence()), Field.Store.NO));
        d.add(new StoredField(FIELD_CHUNK_ID, c.sequence()));

        // Unit position (stored only)
        d.add(new StoredField(FIELD_UNIT_INDEX, c.unitIndex()));
        d.add(new StoredField(FIELD_UNIT_KIND, c.unitKind().name()));
        d.add(new StoredField(FIELD_OFFSET, c.offset()));
        d.add(new StoredField(FIELD_TEXT, c.text()));

        // Token columns
        d.add(new TextField(FIELD_STEM_TOKENS, String.join(" ", indexed.tokens().stemTokens()), Field.Store.NO));
        d.add(new TextField(FIELD_SEG_TOKENS, String.join(" ", indexed.tokens().segTokens()), Field.Store.NO));

        return d;
    }

    private static StoredChunk toStoredChunk(final Document doc) {
        return new StoredChunk(
                doc.get(FIELD_FILE_HASH),
                doc.getField(FIELD_CHUNK_ID).numericValue().intValue(),
                doc.getField(FIELD_UNIT_INDEX).numericValue().intValue(),
                EUnitKind.valueOf(doc.get(FIELD_UNIT_KIND)),
                doc.getField(FIELD_OFFSET).numericValue().intValue(),
                doc.get(FIELD_TEXT));
    }

    private static void validateBatch(final DocumentMeta meta, final List<IndexedChunk> chunks) {
        if (meta == null) {
            throw new IndexWriteException("document metadata must not be null");
        }
        if (meta.fileHash() == null || meta.fileHash().isBlank()) {
            throw new IndexWriteException("fileHash must not be blank");
        }
        if (meta.fileName() == null || meta.indexedAt() == null || meta.orphanScope() == null) {
            throw new IndexWriteException("fileName, indexedAt and orphanScope are required for " + abbreviate(meta.fileHash()));
        }
        if (chunks == null || chunks.isEmpty()) {
            throw new IndexWriteException("a document needs at least one chunk: " + abbreviate(meta.fileHash()));
        }
        final Set<Integer> seen = new HashSet<>();
        for (final IndexedChunk c : chunks) {
            if (c == null || c.chunk() == null || c.tokens() == null) {
                throw new IndexWriteException("malformed chunk in batch for " + abbreviate(meta.fileHash()));
            }
            if (c.chunk().text() == null || c.chunk().text().isBlank()) {
                throw new IndexWriteException("chunk " + c.chunk().sequence() + " has no text");
            }
            if (!seen.add(c.chunk().sequence())) {
                throw new IndexWriteException("duplicate chunk id " + c.chunk().sequence() + " for " + abbreviate(meta.fileHash()));
            }
        }
    }

    /**
     * Best-effort removal of the generation written by a failed insert; a secondary failure is attached
     * to {@code failure} as suppressed.
     */
    private void discardChunks(final Query generation, final IndexWriteException failure) {
        try {
            writer.deleteDocuments(generation);
            writer.commit();
            log.warn("Rolled back chunks: {}", generation);
        } catch (IOException | RuntimeException e) {
            log.error("Rollback of {} failed", generation, e);
            failure.addSuppressed(e);
        }
    }

    private void refreshSearcher() {
        try {
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new IndexWriteException("Unable to refresh index searcher", e);
        }
    }

    private static void requireNonBlank(final String value, final String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
