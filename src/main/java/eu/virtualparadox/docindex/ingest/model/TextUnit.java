package eu.virtualparadox.docindex.ingest.model;

/**
 * One logical unit of extracted text (a page, slide, sheet or paragraph block).
 * Paragraphs inside {@code text} are separated by blank lines.
 */
public record TextUnit(int unitIndex, EUnitKind kind, String text) {

    public TextUnit {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
    }

    public String label() {
        return kind.label(unitIndex);
    }
}
