package io.github.yok.factlink.error;

/**
 * Non-transient connection failure. Propagated without retry.
 *
 * @author Yasuharu.Okawauchi
 */
public class WarehouseConnectionException extends WarehouseWriteException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause driver or pool error
     */
    public WarehouseConnectionException(String message, Throwable cause) {
        super(ErrorCategory.CONNECTION, message, cause);
    }
}
