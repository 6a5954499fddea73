package me.golemcore.testinsight;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the TestInsight settings service.
 *
 * <p>
 * TestInsight triages failing test runs by forwarding test output to a hosted
 * AI model. This service owns the credentials and preferences the rest of the
 * tool depends on.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Encrypted at rest</b> - Jenkins, GitHub and AI secrets are sealed with
 * AES-GCM using a per-installation key</li>
 * <li><b>Partial updates</b> - blank secret fields keep the stored value</li>
 * <li><b>Connection tests</b> - bounded-time probes against Jenkins, GitHub and
 * the Gemini API</li>
 * <li><b>Backup / restore</b> - portable, still-encrypted snapshots</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → SettingsController (WebFlux)
 * Domain Layer       → SettingsService, SettingsStore, SettingsValidator
 * Infrastructure     → LocalStorageAdapter, probe adapters (OkHttp)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under {@code testinsight.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TestInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(TestInsightApplication.class, args);
    }

}
