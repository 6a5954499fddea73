package me.golemcore.testinsight.domain.model;

/**
 * Why a connection test failed.
 */
public enum ProbeFailureKind {
    /** Credentials were rejected by the remote service. */
    AUTHENTICATION,
    /** DNS, TLS or socket level failure. */
    NETWORK,
    /** The probe did not finish within the configured timeout. */
    TIMEOUT,
    /** A required setting is missing or malformed. */
    MISCONFIGURATION,
    /** Anything else, including unexpected HTTP statuses. */
    UNEXPECTED
}
