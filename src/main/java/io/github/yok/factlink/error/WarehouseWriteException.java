package io.github.yok.factlink.error;

import lombok.Getter;

/**
 * Base class of every exception raised by the write path.
 *
 * <p>
 * All subclasses are unchecked and carry an {@link ErrorCategory}. Callers that prefer result
 * objects receive the same information through {@code ErrorDetail}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public abstract class WarehouseWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCategory category;

    /**
     * Creates an exception with a category and message.
     *
     * @param category error category
     * @param message detail message
     */
    protected WarehouseWriteException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    /**
     * Creates an exception with a category, message and cause.
     *
     * @param category error category
     * @param message detail message
     * @param cause original cause
     */
    protected WarehouseWriteException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
