package me.golemcore.testinsight.domain.exception;

/**
 * Base type for failures raised by the settings subsystem. Each subtype carries
 * a stable {@link #getCode() code} so the web layer can tell operational
 * incidents (corrupt store, corrupt key, undecryptable data) apart from bad
 * caller input.
 *
 * <p>
 * Messages must never include secret plaintext.
 */
public abstract class SettingsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String code;

    protected SettingsException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected SettingsException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
