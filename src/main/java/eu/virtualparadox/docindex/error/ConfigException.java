package eu.virtualparadox.docindex.error;

/**
 * Invalid configuration value or combination of values, detected while a component is constructed.
 */
public class ConfigException extends DocumentIndexException {

    public ConfigException(final String message) {
        super(message);
    }
}
