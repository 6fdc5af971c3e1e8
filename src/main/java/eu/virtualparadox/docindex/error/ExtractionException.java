package eu.virtualparadox.docindex.error;

/**
 * The source file could not be turned into text units (unsupported format, corruption,
 * unreadable bytes). Never retried by the engine.
 */
public class ExtractionException extends DocumentIndexException {

    public ExtractionException(final String message) {
        super(message);
    }

    public ExtractionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
