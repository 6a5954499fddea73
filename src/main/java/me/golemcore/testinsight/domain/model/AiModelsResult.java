package me.golemcore.testinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Model listing result. Like {@link ConnectionTestResult}, failures are
 * reported in-band.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AiModelsResult {

    private boolean success;
    @Builder.Default
    private List<AiModelInfo> models = new ArrayList<>();
    private int totalCount;
    private String message;
    private String errorDetails;
    private ProbeFailureKind failureKind;

    public static AiModelsResult of(List<AiModelInfo> models) {
        return AiModelsResult.builder()
                .success(true)
                .models(models)
                .totalCount(models.size())
                .message("Fetched " + models.size() + " models")
                .errorDetails("")
                .build();
    }

    public static AiModelsResult failure(ProbeFailureKind kind, String message, String details) {
        return AiModelsResult.builder()
                .success(false)
                .totalCount(0)
                .message(message)
                .errorDetails(details)
                .failureKind(kind)
                .build();
    }
}
