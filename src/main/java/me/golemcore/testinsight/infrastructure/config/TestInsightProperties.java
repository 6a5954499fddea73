package me.golemcore.testinsight.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties, bound from application.yml.
 *
 * <p>
 * All configuration is organized under the {@code testinsight.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location and file names</li>
 * <li>{@link HttpProperties} - shared OkHttp client timeouts</li>
 * <li>{@link ConnectionTestProperties} - probe timeout and executor size</li>
 * <li>{@link ProbeProperties} - base URLs of the external services</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "testinsight")
@Data
public class TestInsightProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private ConnectionTestProperties connectionTest = new ConnectionTestProperties();
    private ProbeProperties probe = new ProbeProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.testinsight/data";
        private String settingsDirectory = "settings";
        private String settingsFile = "settings.json";
        private String keysDirectory = "keys";
        private String keyFile = "settings.key";
        private String backupsDirectory = "backups";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class ConnectionTestProperties {
        private long timeoutMillis = 15000;
        private int maxConcurrentProbes = 4;
    }

    @Data
    public static class ProbeProperties {
        private String githubApiUrl = "https://api.github.com";
        private String geminiApiUrl = "https://generativelanguage.googleapis.com";
    }
}
