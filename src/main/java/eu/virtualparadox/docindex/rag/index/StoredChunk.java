package eu.virtualparadox.docindex.rag.index;

import eu.virtualparadox.docindex.ingest.model.EUnitKind;

/**
 * A chunk as read back from the index.
 */
public record StoredChunk(String fileHash, int chunkId, int unitIndex, EUnitKind unitKind, int offset, String text) {

    public String unitLabel() {
        return unitKind.label(unitIndex);
    }
}
