package me.golemcore.testinsight.domain.model;

/**
 * Outcome of a single probe against an external service.
 */
public record ProbeResult(boolean ok, ProbeFailureKind failureKind, String message, String details) {

    public static ProbeResult success(String message) {
        return new ProbeResult(true, null, message, null);
    }

    public static ProbeResult failure(ProbeFailureKind kind, String message, String details) {
        return new ProbeResult(false, kind, message, details);
    }
}
