package me.golemcore.testinsight.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Root settings aggregate, one per installation. Persisted to
 * {@code settings/settings.json} by
 * {@link me.golemcore.testinsight.domain.service.SettingsStore}.
 *
 * <p>
 * Secret fields are {@link Secret} values; once persisted they always hold
 * ciphertext.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SettingsDocument {

    /**
     * Version 1 is the legacy layout without {@code schema_version} and with
     * plaintext secret strings.
     */
    public static final int LEGACY_SCHEMA_VERSION = 1;
    public static final int CURRENT_SCHEMA_VERSION = 2;

    @Builder.Default
    private JenkinsSettings jenkins = new JenkinsSettings();

    @Builder.Default
    private GitHubSettings github = new GitHubSettings();

    @Builder.Default
    private AiSettings ai = new AiSettings();

    @Builder.Default
    private PreferencesSettings preferences = new PreferencesSettings();

    @Builder.Default
    private int schemaVersion = CURRENT_SCHEMA_VERSION;

    private Instant lastUpdated;

    public static SettingsDocument defaults() {
        return SettingsDocument.builder().build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class JenkinsSettings {
        private String url;
        private String username;
        private Secret apiToken;
        @Builder.Default
        private boolean verifySsl = true;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class GitHubSettings {
        private Secret token;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class AiSettings {
        @JsonAlias({ "gemini_api_key", "geminiApiKey" })
        private Secret apiKey;
        @Builder.Default
        private String model = "";
        @Builder.Default
        private double temperature = 0.7;
        @Builder.Default
        private int maxTokens = 4096;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class PreferencesSettings {
        @Builder.Default
        private Theme theme = Theme.SYSTEM;
        @Builder.Default
        private String language = "en";
        @Builder.Default
        private boolean autoRefresh = true;
        @Builder.Default
        private int resultsPerPage = 20;
    }
}
