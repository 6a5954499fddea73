package me.golemcore.testinsight.domain.exception;

/**
 * The encryption key file exists but is unreadable or has the wrong length.
 */
public class KeyCorruptException extends SettingsException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "KEY_CORRUPT";

    public KeyCorruptException(String message) {
        super(CODE, message);
    }

    public KeyCorruptException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
