package me.golemcore.testinsight.domain.service;

import me.golemcore.testinsight.domain.model.Secret;
import me.golemcore.testinsight.domain.model.ServiceStatus;
import me.golemcore.testinsight.domain.model.SettingsDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SecretsStatusReporterTest {

    private SettingsService settingsService;
    private SecretsStatusReporter reporter;
    private SettingsDocument document;

    @BeforeEach
    void setUp() {
        settingsService = mock(SettingsService.class);
        reporter = new SecretsStatusReporter(settingsService);
        document = SettingsDocument.defaults();
        when(settingsService.currentSnapshot()).thenReturn(document);
    }

    @Test
    void shouldReportNothingConfiguredOnDefaults() {
        Map<String, Map<String, Boolean>> status = reporter.status();

        assertEquals(Map.of(
                "jenkins", Map.of("api_token", false),
                "github", Map.of("token", false),
                "ai", Map.of("api_key", false)), status);
    }

    @Test
    void shouldReportPresenceWithoutDecrypting() {
        document.getGithub().setToken(Secret.sealed("not-really-ciphertext"));
        document.getAi().setApiKey(Secret.redacted(Secret.sealed("x")));

        Map<String, Map<String, Boolean>> status = reporter.status();

        assertTrue(status.get("github").get("token"));
        assertTrue(status.get("ai").get("api_key"));
        assertFalse(status.get("jenkins").get("api_token"));
    }

    @Test
    void jenkinsIsConfiguredOnlyWithUrlUsernameAndToken() {
        document.getJenkins().setUrl("https://ci.example.com");
        document.getJenkins().setUsername("admin");
        assertFalse(reporter.serviceStatus().get("jenkins").isConfigured());

        document.getJenkins().setApiToken(Secret.sealed("ciphertext"));
        ServiceStatus jenkins = reporter.serviceStatus().get("jenkins");

        assertTrue(jenkins.isConfigured());
        assertEquals("https://ci.example.com", jenkins.getConfig().get("url"));
        assertEquals(true, jenkins.getConfig().get("has_api_token"));
        assertEquals(true, jenkins.getConfig().get("verify_ssl"));
    }

    @Test
    void serviceStatusShouldNeverExposeSecretValues() {
        document.getGithub().setToken(Secret.sealed("ciphertext-github"));
        document.getAi().setApiKey(Secret.sealed("ciphertext-ai"));

        Map<String, ServiceStatus> status = reporter.serviceStatus();

        assertTrue(status.get("github").isConfigured());
        assertTrue(status.get("ai").isConfigured());
        assertFalse(status.toString().contains("ciphertext"));
        assertEquals(0.7, status.get("ai").getConfig().get("temperature"));
        assertEquals(4096, status.get("ai").getConfig().get("max_tokens"));
    }
}
