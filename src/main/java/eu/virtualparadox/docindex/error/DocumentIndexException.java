package eu.virtualparadox.docindex.error;

/**
 * Base type for failures raised by the indexing engine.
 * <p>Callers that do not care about the concrete cause can catch this type alone.</p>
 */
public abstract class DocumentIndexException extends RuntimeException {

    protected DocumentIndexException(final String message) {
        super(message);
    }

    protected DocumentIndexException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
