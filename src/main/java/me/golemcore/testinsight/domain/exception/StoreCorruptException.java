package me.golemcore.testinsight.domain.exception;

/**
 * The settings file exists but cannot be read as a supported settings
 * document. Never downgraded to defaults.
 */
public class StoreCorruptException extends SettingsException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "STORE_CORRUPT";

    public StoreCorruptException(String message) {
        super(CODE, message);
    }

    public StoreCorruptException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
