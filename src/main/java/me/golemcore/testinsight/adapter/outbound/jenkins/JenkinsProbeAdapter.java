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

package me.golemcore.testinsight.adapter.outbound.jenkins;

import me.golemcore.testinsight.adapter.outbound.probe.ProbeResponses;
import me.golemcore.testinsight.domain.model.ProbeFailureKind;
import me.golemcore.testinsight.domain.model.ProbeResult;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.port.outbound.JenkinsProbePort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.concurrent.TimeUnit;

/**
 * Jenkins connectivity probe: {@code GET {url}/api/json} with HTTP Basic auth.
 *
 * <p>
 * When certificate verification is disabled for the server, the request goes
 * through a client that accepts any certificate and host name. That client is
 * used for nothing else.
 */
@Component
@Slf4j
public class JenkinsProbeAdapter implements JenkinsProbePort {

    private static final String SERVICE_LABEL = "Jenkins";
    private static final String VERSION_HEADER = "X-Jenkins";

    private final OkHttpClient httpClient;
    private volatile OkHttpClient insecureClient;

    public JenkinsProbeAdapter(OkHttpClient baseHttpClient, TestInsightProperties properties) {
        long timeoutMillis = properties.getConnectionTest().getTimeoutMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .followRedirects(false)
                .build();
    }

    @Override
    public ProbeResult probe(String url, String username, String apiToken, boolean verifySsl) {
        HttpUrl baseUrl = HttpUrl.parse(url);
        if (baseUrl == null) {
            return ProbeResult.failure(ProbeFailureKind.MISCONFIGURATION, "Jenkins URL is not a valid HTTP(S) URL",
                    "Unparseable URL");
        }
        HttpUrl apiUrl = baseUrl.newBuilder().addPathSegments("api/json").build();
        Request request = new Request.Builder()
                .url(apiUrl)
                .header("Authorization", Credentials.basic(username, apiToken, StandardCharsets.UTF_8))
                .header("Accept", "application/json")
                .get()
                .build();

        OkHttpClient client;
        try {
            client = verifySsl ? httpClient : insecureClient();
        } catch (GeneralSecurityException e) {
            return ProbeResult.failure(ProbeFailureKind.UNEXPECTED, "Could not disable TLS verification",
                    e.getMessage());
        }

        log.debug("[Probe] Jenkins probe: {} (verifySsl={})", apiUrl.host(), verifySsl);
        try (Response response = client.newCall(request).execute()) {
            if (response.isSuccessful()) {
                String version = response.header(VERSION_HEADER);
                String message = version != null
                        ? "Connected to Jenkins " + version
                        : "Connected to Jenkins";
                return ProbeResult.success(message);
            }
            if (response.code() >= 300 && response.code() < 400) {
                return redirectFailure(response);
            }
            ResponseBody body = response.body();
            return ProbeResponses.fromStatus(SERVICE_LABEL, response.code(), body != null ? body.string() : null);
        } catch (IOException e) {
            log.debug("[Probe] Jenkins probe failed: {}", e.getMessage());
            return ProbeResponses.fromException(SERVICE_LABEL, e);
        }
    }

    private ProbeResult redirectFailure(Response response) {
        String location = response.header("Location");
        HttpUrl target = location != null ? response.request().url().resolve(location) : null;
        String message = target != null
                ? "Jenkins URL redirects to " + target + ", update the configured URL"
                : "Jenkins URL redirects elsewhere, check the configured URL";
        return ProbeResult.failure(ProbeFailureKind.MISCONFIGURATION, message, "HTTP " + response.code());
    }

    private OkHttpClient insecureClient() throws GeneralSecurityException {
        OkHttpClient client = insecureClient;
        if (client != null) {
            return client;
        }
        synchronized (this) {
            if (insecureClient == null) {
                X509TrustManager trustAll = new TrustAllManager();
                SSLContext sslContext = SSLContext.getInstance("TLS");
                sslContext.init(null, new TrustManager[] { trustAll }, new SecureRandom());
                SSLSocketFactory socketFactory = sslContext.getSocketFactory();
                insecureClient = httpClient.newBuilder()
                        .sslSocketFactory(socketFactory, trustAll)
                        .hostnameVerifier((hostname, session) -> true)
                        .build();
                log.warn("[Probe] TLS certificate verification disabled for Jenkins probes");
            }
            return insecureClient;
        }
    }

    private static final class TrustAllManager implements X509TrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // accepts any client certificate
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // accepts any server certificate
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
