package eu.virtualparadox.docindex.rag.retriever.model;

/**
 * @param fileHash  Hash of the document the chunk belongs to.
 * @param chunkId   Identifier of the chunk inside the document (match ordinal for regex hits).
 * @param unitLabel Page/slide/sheet/paragraph label of the chunk, empty for regex hits.
 * @param text      The chunk text, possibly padded with neighbouring context.
 * @param score     Relevance score (higher = better).
 */
public record SearchResult(String fileHash, int chunkId, String unitLabel, String text, float score) {

    public SearchResult withText(final String newText) {
        return new SearchResult(fileHash, chunkId, unitLabel, newText, score);
    }
}
