package me.golemcore.testinsight.domain.service;

import me.golemcore.testinsight.domain.model.Secret;
import me.golemcore.testinsight.domain.model.SecretField;
import me.golemcore.testinsight.domain.model.SettingsDocument;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Field-keyed validation of a settings document. Pure: the document is only
 * read and the result depends on nothing else.
 *
 * <p>
 * Secrets that are still plaintext (freshly supplied, not yet encrypted) get
 * format checks. Encrypted secrets are only checked for presence.
 */
@Component
public class SettingsValidator {

    static final double MIN_TEMPERATURE = 0.0;
    static final double MAX_TEMPERATURE = 2.0;
    static final int MIN_MAX_TOKENS = 1;
    static final int MAX_MAX_TOKENS = 32768;
    static final int MIN_RESULTS_PER_PAGE = 1;
    static final int MAX_RESULTS_PER_PAGE = 500;
    static final int MIN_GITHUB_TOKEN_LENGTH = 10;
    static final String AI_KEY_PREFIX = "AIzaSy";
    static final int AI_KEY_LENGTH = 39;

    private static final List<String> SCRIPT_PATTERNS = List.of(
            "javascript:", "<script", "</script", "onclick=", "onerror=");
    private static final String TOKEN_FORBIDDEN_CHARS = "<>\"'&";
    private static final String USERNAME_FORBIDDEN_CHARS = "<>\"'&;|";

    public Map<String, List<String>> validate(SettingsDocument document) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        validateJenkins(document.getJenkins(), errors);
        validateGitHub(document.getGithub(), errors);
        validateAi(document.getAi(), errors);
        validatePreferences(document.getPreferences(), errors);
        return errors;
    }

    private void validateJenkins(SettingsDocument.JenkinsSettings jenkins, Map<String, List<String>> errors) {
        if (jenkins == null) {
            return;
        }
        String username = jenkins.getUsername();
        if (!isBlank(username) && containsAny(username, USERNAME_FORBIDDEN_CHARS)) {
            add(errors, "jenkins.username", "Username contains invalid characters");
        }

        Secret token = jenkins.getApiToken();
        if (isFresh(token) && containsAny(token.getValue(), TOKEN_FORBIDDEN_CHARS)) {
            add(errors, SecretField.JENKINS_API_TOKEN.path(), "Token contains invalid characters");
        }

        String url = jenkins.getUrl();
        if (isBlank(url)) {
            return;
        }
        validateUrl(url, "jenkins.url", "Jenkins URL", errors);
        if (isBlank(username)) {
            add(errors, "jenkins.username", "Jenkins username is required when URL is provided");
        }
        if (!Secret.isPresent(token)) {
            add(errors, SecretField.JENKINS_API_TOKEN.path(), "Jenkins API token is required when URL is provided");
        }
    }

    private void validateGitHub(SettingsDocument.GitHubSettings github, Map<String, List<String>> errors) {
        if (github == null || !isFresh(github.getToken())) {
            return;
        }
        String token = github.getToken().getValue().trim();
        String path = SecretField.GITHUB_TOKEN.path();
        if (containsAny(token, TOKEN_FORBIDDEN_CHARS)) {
            add(errors, path, "Token contains invalid characters");
            return;
        }
        if (token.length() < MIN_GITHUB_TOKEN_LENGTH) {
            add(errors, path, "GitHub token appears to be too short");
        }
    }

    private void validateAi(SettingsDocument.AiSettings ai, Map<String, List<String>> errors) {
        if (ai == null) {
            return;
        }
        if (isFresh(ai.getApiKey())) {
            String apiKey = ai.getApiKey().getValue().trim();
            String path = SecretField.AI_API_KEY.path();
            if (containsAny(apiKey, TOKEN_FORBIDDEN_CHARS)) {
                add(errors, path, "Token contains invalid characters");
            } else {
                if (!apiKey.startsWith(AI_KEY_PREFIX)) {
                    add(errors, path, "Gemini API key should start with '" + AI_KEY_PREFIX + "'");
                }
                if (apiKey.length() != AI_KEY_LENGTH) {
                    add(errors, path, "Gemini API key should be " + AI_KEY_LENGTH + " characters long");
                }
            }
        }

        double temperature = ai.getTemperature();
        if (Double.isNaN(temperature) || temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE) {
            add(errors, "ai.temperature", "Temperature must be between 0.0 and 2.0");
        }
        if (ai.getMaxTokens() < MIN_MAX_TOKENS || ai.getMaxTokens() > MAX_MAX_TOKENS) {
            add(errors, "ai.max_tokens", "Max tokens must be between " + MIN_MAX_TOKENS + " and " + MAX_MAX_TOKENS);
        }
    }

    private void validatePreferences(SettingsDocument.PreferencesSettings preferences,
            Map<String, List<String>> errors) {
        if (preferences == null) {
            return;
        }
        if (preferences.getTheme() == null) {
            add(errors, "preferences.theme", "Theme must be one of: light, dark, system");
        }
        if (isBlank(preferences.getLanguage())) {
            add(errors, "preferences.language", "Language is required");
        }
        int resultsPerPage = preferences.getResultsPerPage();
        if (resultsPerPage < MIN_RESULTS_PER_PAGE || resultsPerPage > MAX_RESULTS_PER_PAGE) {
            add(errors, "preferences.results_per_page", "Results per page must be between "
                    + MIN_RESULTS_PER_PAGE + " and " + MAX_RESULTS_PER_PAGE);
        }
    }

    private void validateUrl(String url, String path, String label, Map<String, List<String>> errors) {
        String trimmed = url.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String pattern : SCRIPT_PATTERNS) {
            if (lower.contains(pattern)) {
                add(errors, path, "URL contains potentially dangerous content: " + pattern);
                return;
            }
        }

        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            add(errors, path, label + " must start with http:// or https://");
            return;
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                add(errors, path, label + " must include a host");
            }
        } catch (URISyntaxException e) {
            add(errors, path, label + " is not a valid URL");
        }
    }

    private static boolean isFresh(Secret secret) {
        return Secret.hasValue(secret) && !Secret.isSealed(secret);
    }

    private static boolean containsAny(String value, String chars) {
        for (int i = 0; i < value.length(); i++) {
            if (chars.indexOf(value.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void add(Map<String, List<String>> errors, String path, String message) {
        errors.computeIfAbsent(path, key -> new ArrayList<>()).add(message);
    }
}
