package eu.virtualparadox.docindex.ingest.model;

import java.util.Locale;

/**
 * Kind of logical unit an extractor emits. Unit boundaries are hard chunk boundaries.
 */
public enum EUnitKind {
    PAGE,
    SLIDE,
    SHEET,
    PARAGRAPH;

    /**
     * Human-readable label used in citations, e.g. {@code "page 3"}.
     *
     * @param unitIndex 1-based index of the unit inside its document
     * @return label string
     */
    public String label(final int unitIndex) {
        return name().toLowerCase(Locale.ROOT) + " " + unitIndex;
    }
}
