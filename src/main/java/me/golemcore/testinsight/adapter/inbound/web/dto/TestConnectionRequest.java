package me.golemcore.testinsight.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection test against values that are not (yet) saved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestConnectionRequest {
    private String service;
    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();
}
