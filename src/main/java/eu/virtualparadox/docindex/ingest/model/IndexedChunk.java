package eu.virtualparadox.docindex.ingest.model;

/**
 * A chunk together with its precomputed token columns, ready to be written to the index.
 */
public record IndexedChunk(Chunk chunk, TokenizedText tokens) {
}
