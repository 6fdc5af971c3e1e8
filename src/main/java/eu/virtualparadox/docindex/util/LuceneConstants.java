package eu.virtualparadox.docindex.util;

public class LuceneConstants {
    public static final String FIELD_FILE_HASH = "fileHash";
    public static final String FIELD_CHUNK_KEY = "chunkKey";
    public static final String FIELD_GENERATION = "generation";
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_UNIT_INDEX = "unitIndex";
    public static final String FIELD_UNIT_KIND = "unitKind";
    public static final String FIELD_OFFSET = "offset";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_STEM_TOKENS = "stemTokens";
    public static final String FIELD_SEG_TOKENS = "segTokens";

    private LuceneConstants() {
        // prevent instantiation
    }

    /**
     * Exact-match key of one chunk: {@code {fileHash}#{chunkId}}.
     */
    public static String chunkKey(final String fileHash, final int chunkId) {
        return fileHash + "#" + chunkId;
    }
}
