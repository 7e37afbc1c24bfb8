package io.github.yok.factlink.error;

/**
 * Raised at construction time when configuration is malformed. Never defaulted silently.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigurationException extends WarehouseWriteException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public ConfigurationException(String message) {
        super(ErrorCategory.CONFIGURATION, message);
    }
}
