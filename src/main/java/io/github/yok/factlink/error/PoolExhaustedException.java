package io.github.yok.factlink.error;

import lombok.Getter;

/**
 * Raised when connection acquisition kept failing with transient errors until the retry budget
 * (attempt count or caller timeout) ran out.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class PoolExhaustedException extends WarehouseWriteException {

    private static final long serialVersionUID = 1L;

    // Number of acquisition attempts made before giving up
    private final int attempts;

    /**
     * Creates the exception.
     *
     * @param attempts acquisition attempts made
     * @param cause last transient error
     */
    public PoolExhaustedException(int attempts, Throwable cause) {
        super(ErrorCategory.POOL_EXHAUSTED,
                "Failed to acquire connection after " + attempts + " attempt(s): "
                        + (cause == null ? "unknown" : cause.getMessage()),
                cause);
        this.attempts = attempts;
    }
}
