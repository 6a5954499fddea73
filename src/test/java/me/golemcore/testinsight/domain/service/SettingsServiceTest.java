package me.golemcore.testinsight.domain.service;

import me.golemcore.testinsight.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.testinsight.domain.exception.RestoreFormatException;
import me.golemcore.testinsight.domain.exception.SettingsValidationException;
import me.golemcore.testinsight.domain.model.ConnectionTestResult;
import me.golemcore.testinsight.domain.model.ProbeFailureKind;
import me.golemcore.testinsight.domain.model.Secret;
import me.golemcore.testinsight.domain.model.ServiceName;
import me.golemcore.testinsight.domain.model.SettingsDocument;
import me.golemcore.testinsight.domain.model.SettingsUpdate;
import me.golemcore.testinsight.domain.model.Theme;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.security.EncryptionKeyManager;
import me.golemcore.testinsight.security.SecretCipher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SettingsServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final String GEMINI_KEY = "AIzaSy" + "x".repeat(33);
    private static final String JENKINS_TOKEN = "11aa22bb33cc44dd";
    private static final String GITHUB_TOKEN = "ghp_abcdefghijklmnop";

    @TempDir
    Path tempDir;

    private ConnectionTestService connectionTestService;
    private SettingsService service;

    @BeforeEach
    void setUp() {
        connectionTestService = mock(ConnectionTestService.class);
        service = createService(tempDir.resolve("primary"), connectionTestService);
    }

    // ==================== Reads ====================

    @Test
    void shouldReturnDefaultsOnFreshInstall() {
        SettingsDocument settings = service.getSettings();

        assertEquals(Theme.SYSTEM, settings.getPreferences().getTheme());
        assertEquals(0.7, settings.getAi().getTemperature());
        assertNull(settings.getJenkins().getApiToken());
    }

    @Test
    void shouldRedactSecretsInResponses() {
        SettingsDocument updated = service.updateSettings(jenkinsUpdate());

        Secret token = updated.getJenkins().getApiToken();
        assertNull(token.getValue());
        assertTrue(token.getPresent());
        assertTrue(token.getEncrypted());

        Secret reread = service.getSettings().getJenkins().getApiToken();
        assertNull(reread.getValue());
        assertTrue(reread.getPresent());
    }

    @Test
    void shouldNeverWritePlaintextSecretsToDisk() throws IOException {
        service.updateSettings(jenkinsUpdate());
        service.updateSettings(SettingsUpdate.builder()
                .github(SettingsUpdate.GitHubUpdate.builder().token(GITHUB_TOKEN).build())
                .ai(SettingsUpdate.AiUpdate.builder().apiKey(GEMINI_KEY).build())
                .build());

        String file = Files.readString(tempDir.resolve("primary/settings/settings.json"));
        assertFalse(file.contains(JENKINS_TOKEN));
        assertFalse(file.contains(GITHUB_TOKEN));
        assertFalse(file.contains(GEMINI_KEY));
    }

    // ==================== Updates ====================

    @Test
    void shouldKeepStoredSecretWhenUpdateOmitsIt() {
        service.updateSettings(jenkinsUpdate());
        SettingsDocument before = service.currentSnapshot();

        service.updateSettings(SettingsUpdate.builder()
                .jenkins(SettingsUpdate.JenkinsUpdate.builder().username("other-user").apiToken("").build())
                .build());

        SettingsDocument after = service.currentSnapshot();
        assertEquals("other-user", after.getJenkins().getUsername());
        assertEquals(before.getJenkins().getApiToken(), after.getJenkins().getApiToken());
    }

    @Test
    void shouldReplaceSecretWhenNewValueGiven() {
        service.updateSettings(jenkinsUpdate());
        service.updateSettings(SettingsUpdate.builder()
                .jenkins(SettingsUpdate.JenkinsUpdate.builder().apiToken("  new-token-value  ").build())
                .build());

        service.testConnection(ServiceName.JENKINS, Map.of());

        verify(connectionTestService).testJenkins("https://jenkins.example.com", "admin", "new-token-value", true);
    }

    @Test
    void shouldLeaveUnsubmittedSectionsUntouched() {
        service.updateSettings(jenkinsUpdate());

        service.updateSettings(SettingsUpdate.builder()
                .preferences(SettingsUpdate.PreferencesUpdate.builder().theme("dark").resultsPerPage(100).build())
                .build());

        SettingsDocument settings = service.getSettings();
        assertEquals(Theme.DARK, settings.getPreferences().getTheme());
        assertEquals(100, settings.getPreferences().getResultsPerPage());
        assertEquals("en", settings.getPreferences().getLanguage());
        assertEquals("https://jenkins.example.com", settings.getJenkins().getUrl());
        assertTrue(settings.getJenkins().getApiToken().getPresent());
    }

    @Test
    void shouldNormalizeBlankUrlToNull() {
        service.updateSettings(SettingsUpdate.builder()
                .jenkins(SettingsUpdate.JenkinsUpdate.builder().url("   ").username("  ").build())
                .build());

        assertNull(service.getSettings().getJenkins().getUrl());
        assertNull(service.getSettings().getJenkins().getUsername());
    }

    @Test
    void shouldStampLastUpdatedFromClock() {
        SettingsDocument updated = service.updateSettings(SettingsUpdate.builder()
                .preferences(SettingsUpdate.PreferencesUpdate.builder().language("de").build())
                .build());

        assertEquals(NOW, updated.getLastUpdated());
    }

    @Test
    void shouldRejectInvalidUpdateAndKeepPreviousState() throws IOException {
        service.updateSettings(jenkinsUpdate());
        Path file = tempDir.resolve("primary/settings/settings.json");
        String before = Files.readString(file);

        SettingsValidationException error = assertThrows(SettingsValidationException.class,
                () -> service.updateSettings(SettingsUpdate.builder()
                        .ai(SettingsUpdate.AiUpdate.builder().temperature(5.0).build())
                        .build()));

        assertEquals(List.of("Temperature must be between 0.0 and 2.0"), error.getErrors().get("ai.temperature"));
        assertEquals(0.7, service.getSettings().getAi().getTemperature());
        assertEquals(before, Files.readString(file));
    }

    @Test
    void shouldRejectUnknownTheme() {
        SettingsValidationException error = assertThrows(SettingsValidationException.class,
                () -> service.updateSettings(SettingsUpdate.builder()
                        .preferences(SettingsUpdate.PreferencesUpdate.builder().theme("purple").build())
                        .build()));

        assertTrue(error.getErrors().containsKey("preferences.theme"));
    }

    @Test
    void shouldRejectNullUpdate() {
        assertThrows(SettingsValidationException.class, () -> service.updateSettings(null));
    }

    @Test
    void shouldAcceptValidGeminiKey() {
        SettingsDocument updated = service.updateSettings(SettingsUpdate.builder()
                .ai(SettingsUpdate.AiUpdate.builder().apiKey(GEMINI_KEY).model("gemini-1.5-flash").build())
                .build());

        assertTrue(updated.getAi().getApiKey().getPresent());
        assertEquals("gemini-1.5-flash", updated.getAi().getModel());
    }

    @Test
    void shouldRejectMalformedGeminiKey() {
        SettingsValidationException error = assertThrows(SettingsValidationException.class,
                () -> service.updateSettings(SettingsUpdate.builder()
                        .ai(SettingsUpdate.AiUpdate.builder().apiKey("AIzaSy-short").build())
                        .build()));

        assertEquals(List.of("Gemini API key should be 39 characters long"), error.getErrors().get("ai.api_key"));
        assertNull(service.getSettings().getAi().getApiKey());
    }

    @Test
    void concurrentDisjointUpdatesShouldBothSurvive() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 10; round++) {
                CountDownLatch start = new CountDownLatch(1);
                String url = "https://jenkins-" + round + ".example.com";
                int pageSize = 10 + round;
                List<Future<SettingsDocument>> results = new ArrayList<>();
                results.add(executor.submit(() -> {
                    start.await();
                    return service.updateSettings(SettingsUpdate.builder()
                            .jenkins(SettingsUpdate.JenkinsUpdate.builder()
                                    .url(url).username("admin").apiToken(JENKINS_TOKEN).build())
                            .build());
                }));
                results.add(executor.submit(() -> {
                    start.await();
                    return service.updateSettings(SettingsUpdate.builder()
                            .preferences(SettingsUpdate.PreferencesUpdate.builder().resultsPerPage(pageSize).build())
                            .build());
                }));
                start.countDown();
                for (Future<SettingsDocument> result : results) {
                    result.get(10, TimeUnit.SECONDS);
                }

                SettingsDocument settings = service.getSettings();
                assertEquals(url, settings.getJenkins().getUrl());
                assertEquals(pageSize, settings.getPreferences().getResultsPerPage());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldPersistAcrossServiceInstances() {
        service.updateSettings(jenkinsUpdate());

        SettingsService reopened = createService(tempDir.resolve("primary"), connectionTestService);

        assertEquals("https://jenkins.example.com", reopened.getSettings().getJenkins().getUrl());
        reopened.testConnection(ServiceName.JENKINS, Map.of());
        verify(connectionTestService).testJenkins("https://jenkins.example.com", "admin", JENKINS_TOKEN, true);
    }

    // ==================== Reset ====================

    @Test
    void resetShouldBackUpThenRestoreDefaults() {
        service.updateSettings(jenkinsUpdate());

        SettingsDocument reset = service.resetToDefaults();

        assertNull(reset.getJenkins().getUrl());
        assertNull(service.getSettings().getJenkins().getApiToken());

        List<String> backups = service.listBackupFiles();
        assertEquals(List.of("settings_backup_20260301_101530.json"), backups);

        service.restoreFromBackupFile(backups.get(0));
        assertEquals("https://jenkins.example.com", service.getSettings().getJenkins().getUrl());
    }

    // ==================== Validation ====================

    @Test
    void validateCurrentShouldReportNoErrorsForSavedSettings() {
        service.updateSettings(jenkinsUpdate());

        assertTrue(service.validateCurrent().isEmpty());
    }

    // ==================== Connection tests ====================

    @Test
    void testConnectionShouldPreferOverrideValues() {
        service.updateSettings(jenkinsUpdate());

        service.testConnection(ServiceName.JENKINS, Map.of(
                "url", "https://staging.example.com",
                "api_token", "override-token",
                "verify_ssl", false));

        verify(connectionTestService).testJenkins("https://staging.example.com", "admin", "override-token", false);
    }

    @Test
    void testConnectionOverrideShouldNotBePersisted() {
        service.updateSettings(jenkinsUpdate());

        service.testConnection(ServiceName.JENKINS, Map.of("url", "https://staging.example.com"));

        assertEquals("https://jenkins.example.com", service.getSettings().getJenkins().getUrl());
    }

    @Test
    void testConnectionShouldDecryptStoredGitHubToken() {
        service.updateSettings(SettingsUpdate.builder()
                .github(SettingsUpdate.GitHubUpdate.builder().token(GITHUB_TOKEN).build())
                .build());
        ConnectionTestResult ok = ConnectionTestResult.builder().service("github").success(true).build();
        when(connectionTestService.testGitHub(GITHUB_TOKEN)).thenReturn(ok);

        assertEquals(ok, service.testConnection(ServiceName.GITHUB, null));
    }

    @Test
    void testConnectionShouldPassAiModel() {
        service.updateSettings(SettingsUpdate.builder()
                .ai(SettingsUpdate.AiUpdate.builder().apiKey(GEMINI_KEY).model("gemini-pro").build())
                .build());

        service.testConnection(ServiceName.AI, Map.of());

        verify(connectionTestService).testAi(GEMINI_KEY, "gemini-pro");
    }

    @Test
    void testConnectionShouldReportUndecryptableSecret() throws IOException {
        Path root = tempDir.resolve("primary");
        byte[] bogus = new byte[40];
        bogus[0] = 1;
        Files.writeString(root.resolve("settings/settings.json"), """
                {"schema_version": 2,
                 "github": {"token": {"value": "%s", "encrypted": true, "present": true}}}
                """.formatted(Base64.getEncoder().encodeToString(bogus)));
        SettingsService reopened = createService(root, connectionTestService);

        ConnectionTestResult result = reopened.testConnection(ServiceName.GITHUB, Map.of());

        assertFalse(result.isSuccess());
        assertEquals(ProbeFailureKind.MISCONFIGURATION, result.getFailureKind());
        verify(connectionTestService, never()).testGitHub(anyString());
    }

    @Test
    void listAiModelsShouldUseStoredKeyWithoutOverride() {
        service.updateSettings(SettingsUpdate.builder()
                .ai(SettingsUpdate.AiUpdate.builder().apiKey(GEMINI_KEY).build())
                .build());

        service.listAiModels(null);
        service.listAiModels(" header-key ");

        verify(connectionTestService).listAiModels(GEMINI_KEY);
        verify(connectionTestService).listAiModels("header-key");
    }

    // ==================== Backup / restore ====================

    @Test
    void restoringExportedBackupShouldBeIdempotent() {
        service.updateSettings(jenkinsUpdate());
        String exported = service.exportBackup();

        service.restore(exported);

        assertEquals(exported, service.exportBackup());
    }

    @Test
    void restoreShouldBringBackPreviousSettings() {
        service.updateSettings(jenkinsUpdate());
        String exported = service.exportBackup();
        service.updateSettings(SettingsUpdate.builder()
                .jenkins(SettingsUpdate.JenkinsUpdate.builder().url("https://other.example.com").build())
                .build());

        SettingsDocument restored = service.restore(exported);

        assertEquals("https://jenkins.example.com", restored.getJenkins().getUrl());
        assertNull(restored.getJenkins().getApiToken().getValue());
    }

    @Test
    void restoreShouldRejectBackupWithoutSchemaVersion() {
        service.updateSettings(jenkinsUpdate());

        assertThrows(RestoreFormatException.class, () -> service.restore(
                "{\"format\": \"testinsight-settings-backup\", \"settings\": {}}"));
        assertEquals("https://jenkins.example.com", service.getSettings().getJenkins().getUrl());
    }

    @Test
    void restoreShouldRejectBackupFromNewerVersion() {
        assertThrows(RestoreFormatException.class, () -> service.restore(
                "{\"format\": \"testinsight-settings-backup\", \"schema_version\": 3, \"settings\": {}}"));
    }

    @Test
    void restoreShouldRejectSecretsFromAnotherInstallation() {
        SettingsService other = createService(tempDir.resolve("other"), mock(ConnectionTestService.class));
        other.updateSettings(jenkinsUpdate());
        String foreignBackup = other.exportBackup();

        RestoreFormatException error = assertThrows(RestoreFormatException.class,
                () -> service.restore(foreignBackup));

        assertTrue(error.getMessage().contains("jenkins.api_token"));
        assertNull(service.getSettings().getJenkins().getUrl());
    }

    @Test
    void restoreShouldRejectInvalidSettings() {
        String backup = """
                {"format": "testinsight-settings-backup", "schema_version": 2,
                 "settings": {"ai": {"temperature": 9.5}}}
                """;

        assertThrows(RestoreFormatException.class, () -> service.restore(backup));
        assertEquals(0.7, service.getSettings().getAi().getTemperature());
    }

    @Test
    void backupFilesShouldGetUniqueNamesWithinOneSecond() {
        String first = service.createBackupFile();
        String second = service.createBackupFile();

        assertEquals("settings_backup_20260301_101530.json", first);
        assertEquals("settings_backup_20260301_101530_1.json", second);
        assertEquals(2, service.listBackupFiles().size());
    }

    @Test
    void concurrentBackupsWithinOneSecondShouldAllBeKept() throws Exception {
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return service.createBackupFile();
                }));
            }
            start.countDown();

            Set<String> names = new HashSet<>();
            for (Future<String> result : results) {
                names.add(result.get(10, TimeUnit.SECONDS));
            }

            assertEquals(writers, names.size());
            assertEquals(names, new HashSet<>(service.listBackupFiles()));
            for (String name : names) {
                assertTrue(Files.exists(tempDir.resolve("primary").resolve("backups").resolve(name)));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void listBackupFilesShouldOrderSequenceNumbersNumerically() {
        for (int i = 0; i < 12; i++) {
            service.createBackupFile();
        }

        List<String> names = service.listBackupFiles();

        assertEquals(12, names.size());
        assertEquals("settings_backup_20260301_101530_11.json", names.get(0));
        assertEquals("settings_backup_20260301_101530_10.json", names.get(1));
        assertEquals("settings_backup_20260301_101530_9.json", names.get(2));
        assertEquals("settings_backup_20260301_101530.json", names.get(11));
    }

    @Test
    void restoreFromBackupFileShouldRejectUnsafeNames() {
        assertThrows(IllegalArgumentException.class, () -> service.restoreFromBackupFile("../settings.json"));
    }

    @Test
    void restoreFromBackupFileShouldReportMissingFile() {
        assertThrows(NoSuchElementException.class,
                () -> service.restoreFromBackupFile("settings_backup_20200101_000000.json"));
    }

    private static SettingsUpdate jenkinsUpdate() {
        return SettingsUpdate.builder()
                .jenkins(SettingsUpdate.JenkinsUpdate.builder()
                        .url("https://jenkins.example.com")
                        .username("admin")
                        .apiToken(JENKINS_TOKEN)
                        .build())
                .build();
    }

    private static SettingsService createService(Path root, ConnectionTestService connectionTestService) {
        TestInsightProperties properties = new TestInsightProperties();
        properties.getStorage().setBasePath(root.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        SecretCipher cipher = new SecretCipher(new EncryptionKeyManager(storage, properties));
        SettingsStore store = new SettingsStore(storage, cipher, properties);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return new SettingsService(store, new SettingsValidator(), cipher, connectionTestService, storage,
                properties, clock);
    }
}
