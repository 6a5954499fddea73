package me.golemcore.testinsight.domain.service;

import lombok.RequiredArgsConstructor;
import me.golemcore.testinsight.domain.model.Secret;
import me.golemcore.testinsight.domain.model.SecretField;
import me.golemcore.testinsight.domain.model.ServiceName;
import me.golemcore.testinsight.domain.model.ServiceStatus;
import me.golemcore.testinsight.domain.model.SettingsDocument;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports which secrets are configured. Works from presence flags only and
 * never decrypts.
 */
@Service
@RequiredArgsConstructor
public class SecretsStatusReporter {

    private final SettingsService settingsService;

    public Map<String, Map<String, Boolean>> status() {
        return status(settingsService.currentSnapshot());
    }

    public Map<String, Map<String, Boolean>> status(SettingsDocument document) {
        Map<String, Map<String, Boolean>> status = new LinkedHashMap<>();
        for (SecretField field : SecretField.values()) {
            status.computeIfAbsent(field.getSection(), section -> new LinkedHashMap<>())
                    .put(field.getField(), Secret.isPresent(field.get(document)));
        }
        return status;
    }

    public Map<String, ServiceStatus> serviceStatus() {
        return serviceStatus(settingsService.currentSnapshot());
    }

    public Map<String, ServiceStatus> serviceStatus(SettingsDocument document) {
        Map<String, ServiceStatus> result = new LinkedHashMap<>();

        SettingsDocument.JenkinsSettings jenkins = document.getJenkins();
        boolean jenkinsToken = Secret.isPresent(jenkins.getApiToken());
        Map<String, Object> jenkinsConfig = new LinkedHashMap<>();
        jenkinsConfig.put("url", jenkins.getUrl());
        jenkinsConfig.put("username", jenkins.getUsername());
        jenkinsConfig.put("has_api_token", jenkinsToken);
        jenkinsConfig.put("verify_ssl", jenkins.isVerifySsl());
        result.put(ServiceName.JENKINS.getId(), ServiceStatus.builder()
                .configured(hasText(jenkins.getUrl()) && hasText(jenkins.getUsername()) && jenkinsToken)
                .config(jenkinsConfig)
                .build());

        boolean gitHubToken = Secret.isPresent(document.getGithub().getToken());
        Map<String, Object> gitHubConfig = new LinkedHashMap<>();
        gitHubConfig.put("has_token", gitHubToken);
        result.put(ServiceName.GITHUB.getId(), ServiceStatus.builder()
                .configured(gitHubToken)
                .config(gitHubConfig)
                .build());

        SettingsDocument.AiSettings ai = document.getAi();
        boolean aiKey = Secret.isPresent(ai.getApiKey());
        Map<String, Object> aiConfig = new LinkedHashMap<>();
        aiConfig.put("has_api_key", aiKey);
        aiConfig.put("model", ai.getModel());
        aiConfig.put("temperature", ai.getTemperature());
        aiConfig.put("max_tokens", ai.getMaxTokens());
        result.put(ServiceName.AI.getId(), ServiceStatus.builder()
                .configured(aiKey)
                .config(aiConfig)
                .build());

        return result;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
