package io.github.yok.factlink.error;

/**
 * The loader was invoked for a fact batch whose reference backfill has not completed
 * successfully.
 *
 * @author Yasuharu.Okawauchi
 */
public class GateViolationException extends WarehouseWriteException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public GateViolationException(String message) {
        super(ErrorCategory.GATE, message);
    }
}
