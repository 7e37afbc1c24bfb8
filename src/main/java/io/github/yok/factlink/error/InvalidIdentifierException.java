package io.github.yok.factlink.error;

/**
 * Raised when a schema, table or column name cannot be used as a quoted PostgreSQL identifier.
 *
 * @author Yasuharu.Okawauchi
 */
public class InvalidIdentifierException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public InvalidIdentifierException(String message) {
        super(message);
    }
}
