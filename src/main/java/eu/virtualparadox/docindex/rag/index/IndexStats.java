package eu.virtualparadox.docindex.rag.index;

/**
 * Aggregate figures of the shared index.
 */
public record IndexStats(long totalFiles, long totalChunks, long totalSizeBytes) {

}
