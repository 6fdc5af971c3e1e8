package eu.virtualparadox.docindex.ingest.lifecycle;

/**
 * Result of an indexing request.
 *
 * @param fileHash    content hash of the document
 * @param totalChunks number of chunks in the index
 * @param created     {@code true} if this call built the index, {@code false} if an existing one was reused
 */
public record IndexHandle(String fileHash, int totalChunks, boolean created) {

}
