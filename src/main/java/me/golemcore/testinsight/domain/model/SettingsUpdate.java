package me.golemcore.testinsight.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial settings update. A {@code null} section or field means "not
 * submitted" and leaves the stored value alone. Secret fields are plaintext;
 * a blank secret also means "keep the stored secret".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettingsUpdate {

    private JenkinsUpdate jenkins;
    private GitHubUpdate github;
    private AiUpdate ai;
    private PreferencesUpdate preferences;

    public boolean isEmpty() {
        return jenkins == null && github == null && ai == null && preferences == null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JenkinsUpdate {
        private String url;
        private String username;
        @JsonAlias("api_token")
        private String apiToken;
        @JsonAlias("verify_ssl")
        private Boolean verifySsl;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitHubUpdate {
        private String token;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AiUpdate {
        @JsonAlias({ "api_key", "gemini_api_key", "geminiApiKey" })
        private String apiKey;
        private String model;
        private Double temperature;
        @JsonAlias("max_tokens")
        private Integer maxTokens;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PreferencesUpdate {
        private String theme;
        private String language;
        @JsonAlias("auto_refresh")
        private Boolean autoRefresh;
        @JsonAlias("results_per_page")
        private Integer resultsPerPage;
    }
}
