package me.golemcore.testinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a connection test. Failures are values, never exceptions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConnectionTestResult {

    private String service;
    private boolean success;
    private String message;
    private String errorDetails;
    private ProbeFailureKind failureKind;

    public static ConnectionTestResult from(ServiceName service, ProbeResult probe) {
        return ConnectionTestResult.builder()
                .service(service.getId())
                .success(probe.ok())
                .message(probe.message())
                .errorDetails(probe.ok() ? "" : probe.details())
                .failureKind(probe.failureKind())
                .build();
    }

    public static ConnectionTestResult failure(ServiceName service, ProbeFailureKind kind, String message,
            String details) {
        return ConnectionTestResult.builder()
                .service(service.getId())
                .success(false)
                .message(message)
                .errorDetails(details)
                .failureKind(kind)
                .build();
    }
}
