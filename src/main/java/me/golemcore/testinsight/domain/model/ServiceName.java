package me.golemcore.testinsight.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * External services whose credentials are kept in the settings document.
 */
public enum ServiceName {

    JENKINS("jenkins"), GITHUB("github"), AI("ai");

    private final String id;

    ServiceName(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static ServiceName fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (ServiceName service : values()) {
                if (service.id.equals(normalized)) {
                    return service;
                }
            }
        }
        throw new IllegalArgumentException("Unknown service: " + id + ". Supported services: jenkins, github, ai");
    }
}
