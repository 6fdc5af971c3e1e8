package eu.virtualparadox.docindex.ingest.model;

/**
 * Immutable representation of a text chunk produced by chunking.
 *
 * @param sequence  document-wide sequence number, unique within the document, starting at 0
 * @param unitIndex index of the owning unit as reported by the extractor
 * @param unitKind  kind of the owning unit
 * @param text      raw chunk text, a verbatim slice of the unit text
 * @param offset    character offset of {@code text} inside the owning unit
 */
public record Chunk(int sequence, int unitIndex, EUnitKind unitKind, String text, int offset) {

    public String unitLabel() {
        return unitKind.label(unitIndex);
    }

    public int length() {
        return text.length();
    }
}
