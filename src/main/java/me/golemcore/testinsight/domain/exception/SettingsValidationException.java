package me.golemcore.testinsight.domain.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller input failed domain rules. Carries the errors keyed by field path
 * (e.g. {@code ai.temperature}); nothing was persisted.
 */
public class SettingsValidationException extends SettingsException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "VALIDATION_FAILED";

    private final Map<String, List<String>> errors;

    public SettingsValidationException(Map<String, List<String>> errors) {
        super(CODE, "Settings validation failed for " + errors.keySet());
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }
}
