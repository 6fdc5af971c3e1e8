package eu.virtualparadox.docindex.error;

/**
 * A transactional insert or delete against the index store failed.
 * When raised from an insert, nothing of the document is left behind.
 */
public class IndexWriteException extends DocumentIndexException {

    public IndexWriteException(final String message) {
        super(message);
    }

    public IndexWriteException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
