package eu.virtualparadox.docindex.rag.index;

/**
 * @param fileHash owning document
 * @param chunkId  chunk sequence number inside the document
 * @param rawScore BM25 score, higher is more relevant
 */
public record ScoredChunk(String fileHash, int chunkId, float rawScore) {

}
