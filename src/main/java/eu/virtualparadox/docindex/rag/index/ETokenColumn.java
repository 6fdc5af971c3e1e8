package eu.virtualparadox.docindex.rag.index;

import eu.virtualparadox.docindex.util.LuceneConstants;

/**
 * The two searchable token columns of a chunk.
 */
public enum ETokenColumn {
    STEM(LuceneConstants.FIELD_STEM_TOKENS),
    SEGMENTED(LuceneConstants.FIELD_SEG_TOKENS);

    private final String field;

    ETokenColumn(final String field) {
        this.field = field;
    }

    public String field() {
        return field;
    }
}
