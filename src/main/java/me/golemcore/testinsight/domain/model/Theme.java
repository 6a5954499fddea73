package me.golemcore.testinsight.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * UI color theme preference.
 */
public enum Theme {

    LIGHT("light"), DARK("dark"), SYSTEM("system");

    private final String value;

    Theme(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Theme fromValue(String value) {
        Theme theme = parse(value);
        if (theme == null) {
            throw new IllegalArgumentException("Unknown theme: " + value);
        }
        return theme;
    }

    /**
     * Lenient lookup, returns null for unknown values.
     */
    public static Theme parse(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Theme theme : values()) {
            if (theme.value.equals(normalized)) {
                return theme;
            }
        }
        return null;
    }
}
