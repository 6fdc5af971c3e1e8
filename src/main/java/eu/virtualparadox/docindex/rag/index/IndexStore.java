package eu.virtualparadox.docindex.rag.index;

import eu.virtualparadox.docindex.ingest.model.IndexedChunk;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent inverted index plus document metadata, keyed by content hash.
 * <p>
 * Lifecycle operations:
 * <ul>
 *   <li><b>Insert</b>: write a document and all of its chunks as one unit of work</li>
 *   <li><b>Delete</b>: remove a document and, by cascade, all of its chunks</li>
 *   <li><b>Query</b>: BM25-ranked lookup restricted to one token column</li>
 * </ul>
 * Scores returned by {@link #query} always follow "higher is more relevant".
 */
public interface IndexStore {

    /**
     * Writes a document and its chunks atomically: after a failure the store holds exactly what it held
     * before, either nothing for {@code meta.fileHash()} or the previous index of that hash. On success
     * existing chunks of the same hash are replaced.
     *
     * @param meta     document metadata; {@code totalChunks} is taken from {@code chunks}
     * @param chunks   chunks with precomputed token columns (non-empty, unique sequence numbers)
     * @param fullText full document text kept for regex search (may be {@code null})
     * @throws eu.virtualparadox.docindex.error.IndexWriteException on validation or storage failure
     */
    void insertDocument(final DocumentMeta meta, final List<IndexedChunk> chunks, final String fullText);

    /**
     * Same as {@link #insertDocument(DocumentMeta, List, String)} with the full text rebuilt from the chunks.
     */
    void insertDocument(final DocumentMeta meta, final List<IndexedChunk> chunks);

    /**
     * @param fileHash document hash
     * @return metadata (including {@code indexedAt} for staleness checks), or empty if not indexed
     */
    Optional<DocumentMeta> exists(final String fileHash);

    /**
     * Deletes a document and all of its chunks. Deleting an absent hash is a no-op.
     *
     * @param fileHash document hash
     * @return {@code true} if a document row was removed
     * @throws eu.virtualparadox.docindex.error.IndexWriteException if the index cannot be updated
     */
    boolean deleteDocument(final String fileHash);

    /**
     * BM25 ranking over all documents.
     */
    List<ScoredChunk> query(final List<String> tokens, final ETokenColumn column, final int limit);

    /**
     * BM25 ranking restricted to one column and, if {@code fileHash} is non-null, to one document.
     *
     * @param tokens   query tokens; any of them may match
     * @param column   column to search
     * @param fileHash document filter, or {@code null} for all documents
     * @param limit    maximum number of hits
     * @return hits ordered by descending score
     */
    List<ScoredChunk> query(final List<String> tokens, final ETokenColumn column, final String fileHash, final int limit);

    /**
     * Loads stored chunks of one document by id; unknown ids are skipped.
     */
    Map<Integer, StoredChunk> loadChunks(final String fileHash, final Collection<Integer> chunkIds);

    Optional<String> loadFullText(final String fileHash);

    /**
     * Documents indexed under {@code fileName} inside {@code orphanScope}.
     */
    List<DocumentMeta> findByName(final String fileName, final String orphanScope);

    List<DocumentMeta> findIndexedBefore(final Instant cutoff);

    List<DocumentMeta> listDocuments();

    IndexStats stats();
}
