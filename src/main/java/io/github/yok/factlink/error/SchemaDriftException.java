package io.github.yok.factlink.error;

/**
 * The target table or a required column is missing from the warehouse catalog.
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaDriftException extends WarehouseWriteException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public SchemaDriftException(String message) {
        super(ErrorCategory.SCHEMA_DRIFT, message);
    }

    /**
     * Creates the exception with the catalog query failure as cause.
     *
     * @param message detail message
     * @param cause original cause
     */
    public SchemaDriftException(String message, Throwable cause) {
        super(ErrorCategory.SCHEMA_DRIFT, message, cause);
    }
}
