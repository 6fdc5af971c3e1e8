package eu.virtualparadox.docindex.rag.index;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;

/**
 * Metadata of an indexed document.
 *
 * @param fileHash    SHA-256 hex of the document bytes, the document identity
 * @param fileName    logical name the document was indexed under
 * @param mediaType   detected media type
 * @param sizeBytes   size of the raw bytes
 * @param indexedAt   when the index was built
 * @param totalChunks number of chunks stored for the document
 * @param orphanScope namespace in which name-based orphan cleanup applies
 * @param generation  tag of the chunk set the row points to, assigned by the store on insert
 */
@Builder(toBuilder = true)
public record DocumentMeta(String fileHash,
                           String fileName,
                           String mediaType,
                           long sizeBytes,
                           Instant indexedAt,
                           int totalChunks,
                           String orphanScope,
                           String generation) {

    /**
     * An index is stale once strictly more than {@code threshold} has passed since it was built.
     *
     * @param now       current time
     * @param threshold maximum age of a fresh index
     * @return {@code true} if the index should be rebuilt
     */
    public boolean isStale(final Instant now, final Duration threshold) {
        return Duration.between(indexedAt, now).compareTo(threshold) > 0;
    }
}
