package me.golemcore.testinsight.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.testinsight.domain.exception.DecryptionException;
import me.golemcore.testinsight.domain.exception.RestoreFormatException;
import me.golemcore.testinsight.domain.exception.SettingsException;
import me.golemcore.testinsight.domain.exception.SettingsValidationException;
import me.golemcore.testinsight.domain.model.AiModelsResult;
import me.golemcore.testinsight.domain.model.ConnectionTestResult;
import me.golemcore.testinsight.domain.model.ProbeFailureKind;
import me.golemcore.testinsight.domain.model.Secret;
import me.golemcore.testinsight.domain.model.SecretField;
import me.golemcore.testinsight.domain.model.ServiceName;
import me.golemcore.testinsight.domain.model.SettingsBackup;
import me.golemcore.testinsight.domain.model.SettingsDocument;
import me.golemcore.testinsight.domain.model.SettingsUpdate;
import me.golemcore.testinsight.domain.model.Theme;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.port.outbound.StoragePort;
import me.golemcore.testinsight.security.SecretCipher;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owns the settings document. All mutations go through a single lock so that
 * load, merge, validate and save run as one unit; readers use an immutable
 * snapshot that is swapped on every successful write.
 *
 * <p>
 * Secrets leave this service only in redacted form. Plaintext exists briefly
 * while an update is merged and while a connection test runs.
 */
@Service
@Slf4j
public class SettingsService {

    static final String BACKUP_FILE_PREFIX = "settings_backup_";
    static final String BACKUP_FILE_SUFFIX = ".json";
    private static final DateTimeFormatter BACKUP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern BACKUP_FILE_NAME = Pattern
            .compile("settings_backup_(\\d{8}_\\d{6})(?:_(\\d+))?\\.json");
    private static final Comparator<String> NEWEST_BACKUP_FIRST = Comparator
            .comparing(SettingsService::backupTimestamp)
            .thenComparingInt(SettingsService::backupSequence)
            .reversed();
    private static final int MAX_BACKUP_NAME_ATTEMPTS = 100;

    private final SettingsStore store;
    private final SettingsValidator validator;
    private final SecretCipher secretCipher;
    private final ConnectionTestService connectionTestService;
    private final StoragePort storagePort;
    private final TestInsightProperties properties;
    private final Clock clock;

    private final ReentrantLock mutationLock = new ReentrantLock();
    private final AtomicReference<SettingsDocument> snapshot = new AtomicReference<>();

    public SettingsService(SettingsStore store, SettingsValidator validator, SecretCipher secretCipher,
            ConnectionTestService connectionTestService, StoragePort storagePort, TestInsightProperties properties,
            Clock clock) {
        this.store = store;
        this.validator = validator;
        this.secretCipher = secretCipher;
        this.connectionTestService = connectionTestService;
        this.storagePort = storagePort;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Reads ====================

    public SettingsDocument getSettings() {
        return redact(currentSnapshot());
    }

    /**
     * Current document as last loaded or saved. Shared and must not be
     * mutated.
     */
    SettingsDocument currentSnapshot() {
        SettingsDocument current = snapshot.get();
        if (current != null) {
            return current;
        }
        mutationLock.lock();
        try {
            current = snapshot.get();
            if (current == null) {
                current = store.load();
                snapshot.set(current);
                log.info("[Settings] Loaded settings document (schema version {})", current.getSchemaVersion());
            }
            return current;
        } finally {
            mutationLock.unlock();
        }
    }

    // ==================== Mutations ====================

    public SettingsDocument updateSettings(SettingsUpdate update) {
        if (update == null) {
            throw new SettingsValidationException(Map.of("settings", List.of("Update body is required")));
        }

        mutationLock.lock();
        try {
            SettingsDocument merged = store.load();
            applyUpdate(merged, update);

            Map<String, List<String>> errors = validator.validate(merged);
            if (!errors.isEmpty()) {
                log.info("[Settings] Rejected update, invalid fields: {}", errors.keySet());
                throw new SettingsValidationException(errors);
            }

            sealFreshSecrets(merged);
            merged.setLastUpdated(clock.instant());
            store.save(merged);
            snapshot.set(merged);
            log.info("[Settings] Settings updated: {}", sectionsOf(update));
            return redact(merged);
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Replace the document with defaults after writing a backup of the current
     * one. Returns the redacted defaults.
     */
    public SettingsDocument resetToDefaults() {
        mutationLock.lock();
        try {
            SettingsDocument current = store.load();
            String backupName = writeBackupFile(current);

            SettingsDocument defaults = SettingsDocument.defaults();
            defaults.setLastUpdated(clock.instant());
            store.save(defaults);
            snapshot.set(defaults);
            log.info("[Settings] Reset settings to defaults, previous settings saved as {}", backupName);
            return redact(defaults);
        } finally {
            mutationLock.unlock();
        }
    }

    // ==================== Validation ====================

    public Map<String, List<String>> validate(SettingsDocument document) {
        return validator.validate(document);
    }

    public Map<String, List<String>> validateCurrent() {
        return validator.validate(currentSnapshot());
    }

    // ==================== Connection tests ====================

    /**
     * Probe a service using override values where given and the stored
     * settings otherwise. Override values are never persisted. Never throws.
     */
    public ConnectionTestResult testConnection(ServiceName service, Map<String, Object> override) {
        Map<String, Object> config = override != null ? override : Map.of();
        try {
            SettingsDocument current = currentSnapshot();
            return switch (service) {
            case JENKINS -> {
                SettingsDocument.JenkinsSettings jenkins = current.getJenkins();
                yield connectionTestService.testJenkins(
                        stringValue(config, jenkins.getUrl(), "url"),
                        stringValue(config, jenkins.getUsername(), "username"),
                        secretValue(config, current, SecretField.JENKINS_API_TOKEN, "api_token", "apiToken"),
                        booleanValue(config, jenkins.isVerifySsl(), "verify_ssl", "verifySsl"));
            }
            case GITHUB -> connectionTestService.testGitHub(
                    secretValue(config, current, SecretField.GITHUB_TOKEN, "token"));
            case AI -> connectionTestService.testAi(
                    secretValue(config, current, SecretField.AI_API_KEY, "api_key", "apiKey", "gemini_api_key"),
                    stringValue(config, current.getAi().getModel(), "model"));
            };
        } catch (DecryptionException e) {
            log.error("[Settings] Stored {} credential cannot be decrypted: {}", service.getId(), e.getMessage());
            return ConnectionTestResult.failure(service, ProbeFailureKind.MISCONFIGURATION,
                    "Stored credential cannot be decrypted", e.getCode());
        } catch (SettingsException e) {
            log.error("[Settings] Settings unavailable for {} connection test: {}", service.getId(), e.getMessage());
            return ConnectionTestResult.failure(service, ProbeFailureKind.UNEXPECTED,
                    "Settings could not be loaded", e.getCode());
        } catch (RuntimeException e) {
            log.error("[Settings] {} connection test failed unexpectedly", service.getId(), e);
            return ConnectionTestResult.failure(service, ProbeFailureKind.UNEXPECTED,
                    "Connection test failed unexpectedly", e.getClass().getSimpleName());
        }
    }

    /**
     * List text-generation models, using {@code apiKeyOverride} when not blank
     * and the stored key otherwise. Never throws.
     */
    public AiModelsResult listAiModels(String apiKeyOverride) {
        try {
            String apiKey = isBlank(apiKeyOverride)
                    ? secretCipher.open(SecretField.AI_API_KEY.get(currentSnapshot()))
                    : apiKeyOverride.trim();
            return connectionTestService.listAiModels(apiKey);
        } catch (SettingsException e) {
            log.error("[Settings] Cannot resolve AI key for model listing: {}", e.getMessage());
            return AiModelsResult.failure(ProbeFailureKind.MISCONFIGURATION,
                    "Stored AI API key cannot be used", e.getCode());
        }
    }

    // ==================== Backup / restore ====================

    public SettingsBackup backup() {
        return SettingsBackup.builder()
                .schemaVersion(SettingsDocument.CURRENT_SCHEMA_VERSION)
                .createdAt(clock.instant())
                .settings(store.copy(currentSnapshot()))
                .build();
    }

    public String exportBackup() {
        return store.toBackupJson(backup());
    }

    /**
     * Replace the whole document with the one in {@code blob}. The backup is
     * fully checked before the lock is taken; on any failure the live
     * document is untouched.
     */
    public SettingsDocument restore(String blob) {
        SettingsDocument restored = store.parseBackup(blob);
        verifySecretsReadable(restored);

        Map<String, List<String>> errors = validator.validate(restored);
        if (!errors.isEmpty()) {
            throw new RestoreFormatException("Backup settings are invalid: " + errors.keySet());
        }

        mutationLock.lock();
        try {
            if (restored.getLastUpdated() == null) {
                restored.setLastUpdated(clock.instant());
            }
            store.save(restored);
            snapshot.set(restored);
            log.info("[Settings] Settings restored from backup");
            return redact(restored);
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Write a timestamped backup of the current document to the backups
     * directory and return its file name.
     */
    public String createBackupFile() {
        return writeBackupFile(currentSnapshot());
    }

    /**
     * Backup file names, newest first.
     */
    public List<String> listBackupFiles() {
        List<String> names = storagePort.listObjects(backupsDirectory(), BACKUP_FILE_PREFIX).join();
        return names.stream()
                .filter(name -> BACKUP_FILE_NAME.matcher(name).matches())
                .sorted(NEWEST_BACKUP_FIRST)
                .toList();
    }

    public SettingsDocument restoreFromBackupFile(String name) {
        if (name == null || !BACKUP_FILE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid backup file name: " + name);
        }
        String blob = storagePort.getText(backupsDirectory(), name).join();
        if (blob == null) {
            throw new NoSuchElementException("Backup file not found: " + name);
        }
        SettingsDocument restored = restore(blob);
        log.info("[Settings] Restored settings from backup file {}", name);
        return restored;
    }

    private String writeBackupFile(SettingsDocument document) {
        SettingsBackup backup = SettingsBackup.builder()
                .schemaVersion(SettingsDocument.CURRENT_SCHEMA_VERSION)
                .createdAt(clock.instant())
                .settings(document)
                .build();
        byte[] content = store.toBackupJson(backup).getBytes(StandardCharsets.UTF_8);
        String stem = BACKUP_FILE_PREFIX + LocalDateTime.now(clock).format(BACKUP_TIMESTAMP);
        String candidate = stem + BACKUP_FILE_SUFFIX;
        for (int attempt = 1; attempt <= MAX_BACKUP_NAME_ATTEMPTS; attempt++) {
            if (Boolean.TRUE.equals(storagePort.putObjectIfAbsent(backupsDirectory(), candidate, content).join())) {
                log.info("[Settings] Wrote settings backup {}", candidate);
                return candidate;
            }
            candidate = stem + "_" + attempt + BACKUP_FILE_SUFFIX;
        }
        throw new IllegalStateException("Too many backups for timestamp " + stem);
    }

    private static String backupTimestamp(String name) {
        Matcher matcher = BACKUP_FILE_NAME.matcher(name);
        return matcher.matches() ? matcher.group(1) : "";
    }

    private static int backupSequence(String name) {
        Matcher matcher = BACKUP_FILE_NAME.matcher(name);
        if (!matcher.matches() || matcher.group(2) == null) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private void verifySecretsReadable(SettingsDocument document) {
        for (SecretField field : SecretField.values()) {
            try {
                secretCipher.open(field.get(document));
            } catch (DecryptionException e) {
                throw new RestoreFormatException("Backup secret " + field.path()
                        + " cannot be decrypted with this installation's key", e);
            }
        }
    }

    // ==================== Merge ====================

    private void applyUpdate(SettingsDocument target, SettingsUpdate update) {
        SettingsUpdate.JenkinsUpdate jenkinsUpdate = update.getJenkins();
        if (jenkinsUpdate != null) {
            SettingsDocument.JenkinsSettings jenkins = target.getJenkins();
            if (jenkinsUpdate.getUrl() != null) {
                jenkins.setUrl(blankToNull(jenkinsUpdate.getUrl()));
                warnOnPlainHttp(jenkins.getUrl());
            }
            if (jenkinsUpdate.getUsername() != null) {
                jenkins.setUsername(blankToNull(jenkinsUpdate.getUsername()));
            }
            if (jenkinsUpdate.getVerifySsl() != null) {
                jenkins.setVerifySsl(jenkinsUpdate.getVerifySsl());
            }
            mergeSecret(target, SecretField.JENKINS_API_TOKEN, jenkinsUpdate.getApiToken());
        }

        SettingsUpdate.GitHubUpdate gitHubUpdate = update.getGithub();
        if (gitHubUpdate != null) {
            mergeSecret(target, SecretField.GITHUB_TOKEN, gitHubUpdate.getToken());
        }

        SettingsUpdate.AiUpdate aiUpdate = update.getAi();
        if (aiUpdate != null) {
            SettingsDocument.AiSettings ai = target.getAi();
            if (aiUpdate.getModel() != null) {
                ai.setModel(aiUpdate.getModel().trim());
            }
            if (aiUpdate.getTemperature() != null) {
                ai.setTemperature(aiUpdate.getTemperature());
            }
            if (aiUpdate.getMaxTokens() != null) {
                ai.setMaxTokens(aiUpdate.getMaxTokens());
            }
            mergeSecret(target, SecretField.AI_API_KEY, aiUpdate.getApiKey());
        }

        SettingsUpdate.PreferencesUpdate preferencesUpdate = update.getPreferences();
        if (preferencesUpdate != null) {
            SettingsDocument.PreferencesSettings preferences = target.getPreferences();
            if (preferencesUpdate.getTheme() != null) {
                preferences.setTheme(Theme.parse(preferencesUpdate.getTheme()));
            }
            if (preferencesUpdate.getLanguage() != null) {
                preferences.setLanguage(preferencesUpdate.getLanguage().trim());
            }
            if (preferencesUpdate.getAutoRefresh() != null) {
                preferences.setAutoRefresh(preferencesUpdate.getAutoRefresh());
            }
            if (preferencesUpdate.getResultsPerPage() != null) {
                preferences.setResultsPerPage(preferencesUpdate.getResultsPerPage());
            }
        }
    }

    // Blank means "keep the stored secret"
    private void mergeSecret(SettingsDocument target, SecretField field, String incoming) {
        if (isBlank(incoming)) {
            return;
        }
        field.set(target, Secret.plain(incoming.trim()));
    }

    private void sealFreshSecrets(SettingsDocument document) {
        for (SecretField field : SecretField.values()) {
            field.set(document, secretCipher.sealIfPlain(field.get(document)));
        }
    }

    private SettingsDocument redact(SettingsDocument document) {
        SettingsDocument copy = store.copy(document);
        for (SecretField field : SecretField.values()) {
            field.set(copy, Secret.redacted(field.get(copy)));
        }
        return copy;
    }

    private void warnOnPlainHttp(String url) {
        if (url != null && url.toLowerCase(Locale.ROOT).startsWith("http://")) {
            log.warn("[Settings] Jenkins URL uses plain HTTP, credentials will be sent unencrypted");
        }
    }

    // ==================== Override resolution ====================

    private String secretValue(Map<String, Object> config, SettingsDocument current, SecretField field,
            String... keys) {
        String override = stringValue(config, null, keys);
        if (!isBlank(override)) {
            return override.trim();
        }
        return secretCipher.open(field.get(current));
    }

    private static String stringValue(Map<String, Object> config, String fallback, String... keys) {
        for (String key : keys) {
            Object value = config.get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value).trim();
            }
        }
        return fallback;
    }

    private static boolean booleanValue(Map<String, Object> config, boolean fallback, String... keys) {
        for (String key : keys) {
            Object value = config.get(key);
            if (value instanceof Boolean booleanValue) {
                return booleanValue;
            }
            if (value instanceof String stringValue && !stringValue.isBlank()) {
                return Boolean.parseBoolean(stringValue.trim());
            }
        }
        return fallback;
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String backupsDirectory() {
        return properties.getStorage().getBackupsDirectory();
    }

    private static List<String> sectionsOf(SettingsUpdate update) {
        List<String> sections = new ArrayList<>();
        if (update.getJenkins() != null) {
            sections.add("jenkins");
        }
        if (update.getGithub() != null) {
            sections.add("github");
        }
        if (update.getAi() != null) {
            sections.add("ai");
        }
        if (update.getPreferences() != null) {
            sections.add("preferences");
        }
        return sections;
    }
}
