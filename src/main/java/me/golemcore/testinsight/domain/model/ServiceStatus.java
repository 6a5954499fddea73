package me.golemcore.testinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Whether a service has everything it needs to be called, plus its
 * non-secret settings. Secret entries in {@code config} are booleans.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ServiceStatus {
    private boolean configured;
    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();
}
