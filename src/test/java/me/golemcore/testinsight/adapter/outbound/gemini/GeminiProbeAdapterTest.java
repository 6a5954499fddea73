package me.golemcore.testinsight.adapter.outbound.gemini;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.testinsight.domain.model.AiModelInfo;
import me.golemcore.testinsight.domain.model.AiModelsResult;
import me.golemcore.testinsight.domain.model.ProbeFailureKind;
import me.golemcore.testinsight.domain.model.ProbeResult;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeminiProbeAdapterTest {

    private static final String API_KEY = "AIzaSy" + "k".repeat(33);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private GeminiProbeAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new GeminiProbeAdapter(client, objectMapper, new TestInsightProperties());
    }

    @Test
    void shouldSendKeyInHeaderNotQuery() {
        engine.enqueueJson(200, "{\"models\":[]}");

        ProbeResult result = adapter.probe(API_KEY, "");

        assertTrue(result.ok());
        Request request = engine.takeRequest();
        assertEquals(API_KEY, request.header("x-goog-api-key"));
        assertNull(request.url().queryParameter("key"));
        assertEquals("/v1beta/models", request.url().encodedPath());
        assertEquals("1", request.url().queryParameter("pageSize"));
    }

    @Test
    void shouldCheckConfiguredModel() {
        engine.enqueueJson(200, "{\"name\":\"models/gemini-1.5-pro\"}");

        ProbeResult result = adapter.probe(API_KEY, "models/gemini-1.5-pro");

        assertTrue(result.ok());
        assertEquals("/v1beta/models/gemini-1.5-pro", engine.takeRequest().url().encodedPath());
    }

    @Test
    void shouldReportMissingModelAsMisconfiguration() {
        engine.enqueueJson(404, "{\"error\":{\"code\":404}}");

        ProbeResult result = adapter.probe(API_KEY, "gemini-9000");

        assertEquals(ProbeFailureKind.MISCONFIGURATION, result.failureKind());
        assertEquals("Gemini model gemini-9000 was not found", result.message());
    }

    @Test
    void shouldReportInvalidKey() {
        engine.enqueueJson(400, "{\"error\":{\"status\":\"INVALID_ARGUMENT\","
                + "\"details\":[{\"reason\":\"API_KEY_INVALID\"}]}}");

        ProbeResult result = adapter.probe(API_KEY, null);

        assertFalse(result.ok());
        assertEquals(ProbeFailureKind.AUTHENTICATION, result.failureKind());
    }

    @Test
    void shouldReportQuotaExceeded() {
        engine.enqueueJson(429, "{\"error\":{\"status\":\"RESOURCE_EXHAUSTED\"}}");

        assertEquals(ProbeFailureKind.NETWORK, adapter.probe(API_KEY, "").failureKind());
    }

    @Test
    void shouldListOnlyTextGenerationModelsAcrossPages() {
        engine.enqueueJson(200, """
                {"models": [
                  {"name": "models/gemini-1.5-pro", "displayName": "Gemini 1.5 Pro",
                   "inputTokenLimit": 1048576, "outputTokenLimit": 8192,
                   "supportedGenerationMethods": ["generateContent", "countTokens"]},
                  {"name": "models/text-embedding-004", "supportedGenerationMethods": ["embedContent"]}
                 ],
                 "nextPageToken": "page-2"}
                """);
        engine.enqueueJson(200, """
                {"models": [
                  {"name": "models/gemini-1.5-flash", "supportedGenerationMethods": ["generateContent"]},
                  {"name": "models/aqa", "supportedGenerationMethods": ["generateAnswer"]}
                 ]}
                """);

        AiModelsResult result = adapter.listModels(API_KEY);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getTotalCount());
        assertEquals(List.of("gemini-1.5-pro", "gemini-1.5-flash"),
                result.getModels().stream().map(AiModelInfo::getName).toList());
        assertEquals("Fetched 2 models", result.getMessage());

        Request first = engine.takeRequest();
        assertEquals("1000", first.url().queryParameter("pageSize"));
        Request second = engine.takeRequest();
        assertEquals("page-2", second.url().queryParameter("pageToken"));
    }

    @Test
    void shouldReportListingFailure() {
        engine.enqueueJson(403, "{\"error\":{\"status\":\"PERMISSION_DENIED\"}}");

        AiModelsResult result = adapter.listModels(API_KEY);

        assertFalse(result.isSuccess());
        assertEquals(ProbeFailureKind.AUTHENTICATION, result.getFailureKind());
        assertTrue(result.getModels().isEmpty());
    }

    @Test
    void toModelInfoShouldStripPrefixAndKeepLimits() throws IOException {
        AiModelInfo info = adapter.toModelInfo(objectMapper.readTree("""
                {"name": "models/gemini-pro", "displayName": "Gemini Pro", "version": "001",
                 "inputTokenLimit": 30720, "outputTokenLimit": 2048,
                 "supportedGenerationMethods": ["generateContent"]}
                """));

        assertNotNull(info);
        assertEquals("gemini-pro", info.getName());
        assertEquals("Gemini Pro", info.getDisplayName());
        assertEquals(30720, info.getInputTokenLimit());
        assertEquals(2048, info.getOutputTokenLimit());
    }

    @Test
    void toModelInfoShouldExcludeImageModels() throws IOException {
        assertNull(adapter.toModelInfo(objectMapper.readTree("""
                {"name": "models/imagen-3.0", "supportedGenerationMethods": ["generateContent"]}
                """)));
    }
}
