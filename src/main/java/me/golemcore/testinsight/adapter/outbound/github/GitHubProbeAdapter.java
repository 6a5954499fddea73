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

package me.golemcore.testinsight.adapter.outbound.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.testinsight.adapter.outbound.probe.ProbeResponses;
import me.golemcore.testinsight.domain.model.ProbeResult;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.port.outbound.GitHubProbePort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * GitHub connectivity probe: {@code GET /user} with the personal access
 * token.
 */
@Component
@Slf4j
public class GitHubProbeAdapter implements GitHubProbePort {

    private static final String SERVICE_LABEL = "GitHub";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;

    public GitHubProbeAdapter(OkHttpClient baseHttpClient, ObjectMapper objectMapper,
            TestInsightProperties properties) {
        this.objectMapper = objectMapper;
        this.apiUrl = stripTrailingSlash(properties.getProbe().getGithubApiUrl());
        long timeoutMillis = properties.getConnectionTest().getTimeoutMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public ProbeResult probe(String token) {
        Request request = new Request.Builder()
                .url(apiUrl + "/user")
                .header("Authorization", "token " + token)
                .header("Accept", "application/vnd.github.v3+json")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String bodyText = body != null ? body.string() : null;
            if (response.isSuccessful()) {
                return ProbeResult.success(successMessage(bodyText));
            }
            return ProbeResponses.fromStatus(SERVICE_LABEL, response.code(), bodyText);
        } catch (IOException e) {
            log.debug("[Probe] GitHub probe failed: {}", e.getMessage());
            return ProbeResponses.fromException(SERVICE_LABEL, e);
        }
    }

    private String successMessage(String body) {
        if (body == null || body.isBlank()) {
            return "Connected to GitHub";
        }
        try {
            JsonNode login = objectMapper.readTree(body).path("login");
            if (login.isTextual()) {
                return "Connected to GitHub as " + login.asText();
            }
        } catch (IOException e) {
            log.debug("[Probe] Could not parse GitHub user response: {}", e.getMessage());
        }
        return "Connected to GitHub";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
