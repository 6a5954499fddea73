package me.golemcore.testinsight.port.outbound;

import me.golemcore.testinsight.domain.model.AiModelsResult;
import me.golemcore.testinsight.domain.model.ProbeResult;

/**
 * Port for the hosted AI provider (Gemini).
 */
public interface AiProbePort {

    /**
     * Verify that the API key is accepted and, when {@code model} is not blank,
     * that the model exists.
     */
    ProbeResult probe(String apiKey, String model);

    /**
     * List text-generation models visible to the API key.
     */
    AiModelsResult listModels(String apiKey);
}
