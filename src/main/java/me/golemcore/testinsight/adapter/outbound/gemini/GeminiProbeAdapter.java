/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.testinsight.adapter.outbound.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.testinsight.adapter.outbound.probe.ProbeResponses;
import me.golemcore.testinsight.domain.model.AiModelInfo;
import me.golemcore.testinsight.domain.model.AiModelsResult;
import me.golemcore.testinsight.domain.model.ProbeFailureKind;
import me.golemcore.testinsight.domain.model.ProbeResult;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.port.outbound.AiProbePort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Gemini API probe and model listing over the REST API.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /v1beta/models - paged model listing
 * <li>GET /v1beta/models/{model} - single model lookup
 * </ul>
 *
 * <p>
 * The API key travels in the {@code x-goog-api-key} header so it never
 * appears in URLs.
 */
@Component
@Slf4j
public class GeminiProbeAdapter implements AiProbePort {

    private static final String SERVICE_LABEL = "Gemini API";
    private static final String API_KEY_HEADER = "x-goog-api-key";
    private static final String MODEL_PREFIX = "models/";
    private static final String GENERATE_CONTENT = "generateContent";
    private static final int PAGE_SIZE = 1000;
    private static final int MAX_PAGES = 10;

    // Models whose names contain any of these are not text-generation models
    private static final List<String> EXCLUDED_KEYWORDS = List.of(
            "embedding", "embed", "imagen", "imagetext", "video", "audio", "multimodal", "mm", "search",
            "retrieval", "code-", "codechat");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;

    public GeminiProbeAdapter(OkHttpClient baseHttpClient, ObjectMapper objectMapper,
            TestInsightProperties properties) {
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(properties.getProbe().getGeminiApiUrl());
        long timeoutMillis = properties.getConnectionTest().getTimeoutMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public ProbeResult probe(String apiKey, String model) {
        String modelId = normalizeModel(model);
        HttpUrl.Builder url = baseUrl.newBuilder().addPathSegments("v1beta/models");
        if (modelId.isEmpty()) {
            url.addQueryParameter("pageSize", "1");
        } else {
            url.addPathSegment(modelId);
        }

        try (Response response = httpClient.newCall(request(apiKey, url.build())).execute()) {
            ResponseBody body = response.body();
            String bodyText = body != null ? body.string() : null;
            if (response.isSuccessful()) {
                return ProbeResult.success(modelId.isEmpty()
                        ? "Gemini API key is valid"
                        : "Gemini API key is valid and model " + modelId + " is available");
            }
            if (response.code() == 404 && !modelId.isEmpty()) {
                return ProbeResult.failure(ProbeFailureKind.MISCONFIGURATION,
                        "Gemini model " + modelId + " was not found", "HTTP 404");
            }
            if (response.code() == 400 && isInvalidKeyResponse(bodyText)) {
                return ProbeResult.failure(ProbeFailureKind.AUTHENTICATION, SERVICE_LABEL + " authentication failed",
                        "Invalid API key. Please verify your Gemini API key is correct and active.");
            }
            return ProbeResponses.fromStatus(SERVICE_LABEL, response.code(), bodyText);
        } catch (IOException e) {
            log.debug("[Probe] Gemini probe failed: {}", e.getMessage());
            return ProbeResponses.fromException(SERVICE_LABEL, e);
        }
    }

    @Override
    public AiModelsResult listModels(String apiKey) {
        List<AiModelInfo> models = new ArrayList<>();
        String pageToken = null;
        try {
            for (int page = 0; page < MAX_PAGES; page++) {
                HttpUrl.Builder url = baseUrl.newBuilder()
                        .addPathSegments("v1beta/models")
                        .addQueryParameter("pageSize", String.valueOf(PAGE_SIZE));
                if (pageToken != null) {
                    url.addQueryParameter("pageToken", pageToken);
                }

                try (Response response = httpClient.newCall(request(apiKey, url.build())).execute()) {
                    ResponseBody body = response.body();
                    String bodyText = body != null ? body.string() : null;
                    if (!response.isSuccessful()) {
                        ProbeResult failure = response.code() == 400 && isInvalidKeyResponse(bodyText)
                                ? ProbeResult.failure(ProbeFailureKind.AUTHENTICATION,
                                        SERVICE_LABEL + " authentication failed",
                                        "Invalid API key. Please verify your Gemini API key is correct and active.")
                                : ProbeResponses.fromStatus(SERVICE_LABEL, response.code(), bodyText);
                        log.warn("[Probe] Gemini model listing failed: HTTP {}", response.code());
                        return AiModelsResult.failure(failure.failureKind(), failure.message(), failure.details());
                    }

                    JsonNode root = objectMapper.readTree(bodyText == null ? "{}" : bodyText);
                    for (JsonNode node : root.path("models")) {
                        AiModelInfo info = toModelInfo(node);
                        if (info != null) {
                            models.add(info);
                        }
                    }
                    pageToken = root.path("nextPageToken").asText(null);
                }
                if (pageToken == null || pageToken.isBlank()) {
                    break;
                }
            }
        } catch (IOException e) {
            log.debug("[Probe] Gemini model listing failed: {}", e.getMessage());
            ProbeResult failure = ProbeResponses.fromException(SERVICE_LABEL, e);
            return AiModelsResult.failure(failure.failureKind(), failure.message(), failure.details());
        }

        log.info("[Probe] Fetched {} Gemini text-generation models", models.size());
        return AiModelsResult.of(models);
    }

    /**
     * Returns {@code null} for models that are not text-generation models.
     */
    AiModelInfo toModelInfo(JsonNode node) {
        String fullName = node.path("name").asText("");
        String name = fullName.startsWith(MODEL_PREFIX) ? fullName.substring(MODEL_PREFIX.length()) : fullName;
        if (name.isEmpty()) {
            return null;
        }

        List<String> methods = new ArrayList<>();
        for (JsonNode method : node.path("supportedGenerationMethods")) {
            methods.add(method.asText());
        }
        if (methods.isEmpty()) {
            return null;
        }

        String lowerName = name.toLowerCase(Locale.ROOT);
        for (String keyword : EXCLUDED_KEYWORDS) {
            if (lowerName.contains(keyword)) {
                log.debug("[Probe] Excluding model {} (keyword '{}')", name, keyword);
                return null;
            }
        }
        if (!methods.contains(GENERATE_CONTENT)) {
            log.debug("[Probe] Excluding model {} (no {} support)", name, GENERATE_CONTENT);
            return null;
        }

        return AiModelInfo.builder()
                .name(name)
                .displayName(node.path("displayName").asText(name))
                .description(node.path("description").asText(null))
                .version(node.path("version").asText(null))
                .inputTokenLimit(node.has("inputTokenLimit") ? node.get("inputTokenLimit").asInt() : null)
                .outputTokenLimit(node.has("outputTokenLimit") ? node.get("outputTokenLimit").asInt() : null)
                .supportedGenerationMethods(methods)
                .build();
    }

    private Request request(String apiKey, HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header(API_KEY_HEADER, apiKey)
                .get()
                .build();
    }

    private static boolean isInvalidKeyResponse(String body) {
        return body != null && (body.contains("API_KEY_INVALID") || body.contains("API key not valid"));
    }

    private static String normalizeModel(String model) {
        if (model == null) {
            return "";
        }
        String trimmed = model.trim();
        return trimmed.startsWith(MODEL_PREFIX) ? trimmed.substring(MODEL_PREFIX.length()) : trimmed;
    }
}
