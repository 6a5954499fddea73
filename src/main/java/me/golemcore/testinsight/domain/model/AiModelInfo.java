package me.golemcore.testinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A generative model offered by the AI provider.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AiModelInfo {
    private String name;
    private String displayName;
    private String description;
    private String version;
    private Integer inputTokenLimit;
    private Integer outputTokenLimit;
    @Builder.Default
    private List<String> supportedGenerationMethods = new ArrayList<>();
}
