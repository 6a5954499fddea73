package me.golemcore.testinsight.adapter.outbound.probe;

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

import me.golemcore.testinsight.domain.model.ProbeFailureKind;
import me.golemcore.testinsight.domain.model.ProbeResult;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;

/**
 * Maps HTTP status codes and transport errors to probe results, shared by the
 * probe adapters.
 */
public final class ProbeResponses {

    private static final int MAX_DETAILS_LENGTH = 300;

    private ProbeResponses() {
    }

    public static ProbeResult fromStatus(String serviceLabel, int status, String body) {
        String details = "HTTP " + status + truncate(body);
        if (status == 401) {
            return ProbeResult.failure(ProbeFailureKind.AUTHENTICATION,
                    serviceLabel + " authentication failed", details);
        }
        if (status == 403) {
            return ProbeResult.failure(ProbeFailureKind.AUTHENTICATION,
                    serviceLabel + " permission denied", details);
        }
        if (status == 404) {
            return ProbeResult.failure(ProbeFailureKind.MISCONFIGURATION,
                    serviceLabel + " endpoint not found, check the configured URL", details);
        }
        if (status == 429) {
            return ProbeResult.failure(ProbeFailureKind.NETWORK,
                    serviceLabel + " rate limit or quota exceeded", details);
        }
        if (status >= 500) {
            return ProbeResult.failure(ProbeFailureKind.NETWORK, serviceLabel + " server error", details);
        }
        return ProbeResult.failure(ProbeFailureKind.UNEXPECTED,
                serviceLabel + " returned an unexpected response", details);
    }

    public static ProbeResult fromException(String serviceLabel, IOException e) {
        String details = e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
        if (e instanceof InterruptedIOException) {
            return ProbeResult.failure(ProbeFailureKind.TIMEOUT, serviceLabel + " did not respond in time", details);
        }
        if (e instanceof UnknownHostException) {
            return ProbeResult.failure(ProbeFailureKind.NETWORK, serviceLabel + " host could not be resolved",
                    details);
        }
        if (e instanceof SSLException) {
            return ProbeResult.failure(ProbeFailureKind.NETWORK, serviceLabel + " TLS handshake failed", details);
        }
        if (e instanceof ConnectException) {
            return ProbeResult.failure(ProbeFailureKind.NETWORK, serviceLabel + " refused the connection", details);
        }
        return ProbeResult.failure(ProbeFailureKind.NETWORK, serviceLabel + " connection error", details);
    }

    private static String truncate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        if (trimmed.length() > MAX_DETAILS_LENGTH) {
            trimmed = trimmed.substring(0, MAX_DETAILS_LENGTH) + "...";
        }
        return " - " + trimmed;
    }
}
