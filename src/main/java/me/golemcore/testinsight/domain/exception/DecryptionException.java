package me.golemcore.testinsight.domain.exception;

/**
 * Ciphertext could not be opened with the installation key: wrong key,
 * truncated or malformed blob, or tampering.
 */
public class DecryptionException extends SettingsException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "DECRYPTION_FAILED";

    public DecryptionException(String message) {
        super(CODE, message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
