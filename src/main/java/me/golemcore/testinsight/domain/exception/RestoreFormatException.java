package me.golemcore.testinsight.domain.exception;

/**
 * A backup blob has a missing or unsupported schema version or the wrong
 * shape. Raised before the live document is touched.
 */
public class RestoreFormatException extends SettingsException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "RESTORE_FORMAT";

    public RestoreFormatException(String message) {
        super(CODE, message);
    }

    public RestoreFormatException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
