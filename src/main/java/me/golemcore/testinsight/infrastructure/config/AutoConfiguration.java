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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.testinsight.domain.exception.SettingsException;
import me.golemcore.testinsight.domain.service.SecretsStatusReporter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;

/**
 * Spring configuration for shared infrastructure beans and startup
 * diagnostics.
 *
 * <p>
 * On startup, logs the storage location and which secrets are configured
 * (presence only). A corrupt settings file or key is reported loudly but does
 * not stop the application, so an operator can still restore a backup through
 * the API.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final TestInsightProperties properties;
    private final SecretsStatusReporter secretsStatusReporter;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("TestInsight settings service starting...");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        try {
            Map<String, Map<String, Boolean>> status = secretsStatusReporter.status();
            log.info("Configured secrets: {}", status);
        } catch (SettingsException e) {
            log.error("[Settings] Settings are unreadable at startup ({}): {}", e.getCode(), e.getMessage());
        }
    }
}
