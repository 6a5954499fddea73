package me.golemcore.testinsight.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.testinsight.domain.exception.RestoreFormatException;
import me.golemcore.testinsight.domain.exception.StoreCorruptException;
import me.golemcore.testinsight.domain.model.Secret;
import me.golemcore.testinsight.domain.model.SecretField;
import me.golemcore.testinsight.domain.model.SettingsBackup;
import me.golemcore.testinsight.domain.model.SettingsDocument;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.port.outbound.StoragePort;
import me.golemcore.testinsight.security.SecretCipher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Durable representation of the settings document in
 * {@code settings/settings.json}.
 *
 * <p>
 * The file is snake_case JSON carrying {@code schema_version}. A file without
 * a version is the legacy layout (plaintext secret strings); it is migrated,
 * its secrets encrypted and the result written back on first load. Legacy
 * values that are Fernet tokens are dropped. Anything
 * that cannot be read as a supported document raises
 * {@link StoreCorruptException}.
 */
@Service
@Slf4j
public class SettingsStore {

    private static final String SCHEMA_VERSION_FIELD = "schema_version";
    private static final String LAST_UPDATED_FIELD = "last_updated";
    private static final String SETTINGS_FIELD = "settings";
    private static final String FORMAT_FIELD = "format";
    private static final int LEGACY_TOKEN_MIN_LENGTH = 40;
    private static final Pattern LEGACY_TOKEN_ALPHABET = Pattern.compile("[A-Za-z0-9_=-]+");
    private static final byte FERNET_VERSION = (byte) 0x80;

    private final StoragePort storagePort;
    private final SecretCipher secretCipher;
    private final TestInsightProperties properties;
    private final ObjectMapper mapper;

    public SettingsStore(StoragePort storagePort, SecretCipher secretCipher, TestInsightProperties properties) {
        this.storagePort = storagePort;
        this.secretCipher = secretCipher;
        this.properties = properties;
        this.mapper = createMapper();
    }

    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        return mapper;
    }

    /**
     * Load the stored document, or defaults if nothing has been saved yet.
     */
    public SettingsDocument load() {
        String json = readText(settingsDirectory(), settingsFile());
        if (json == null) {
            return SettingsDocument.defaults();
        }

        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StoreCorruptException("Settings file is not valid JSON: " + locationOf(e), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new StoreCorruptException("Settings file does not contain a JSON object");
        }

        int version = schemaVersionOf(tree);
        if (version > SettingsDocument.CURRENT_SCHEMA_VERSION) {
            throw new StoreCorruptException("Settings file has schema version " + version
                    + ", newer than supported version " + SettingsDocument.CURRENT_SCHEMA_VERSION);
        }
        if (version < SettingsDocument.LEGACY_SCHEMA_VERSION) {
            throw new StoreCorruptException("Settings file has invalid schema version " + version);
        }

        SettingsDocument document;
        try {
            document = toDocument((ObjectNode) tree, version);
        } catch (IOException e) {
            throw new StoreCorruptException("Settings file has an invalid shape: " + locationOf(e), e);
        }

        if (version == SettingsDocument.LEGACY_SCHEMA_VERSION) {
            dropLegacyEncryptedSecrets(document);
        }
        boolean sealed = sealPlainSecrets(document);
        if (version < SettingsDocument.CURRENT_SCHEMA_VERSION) {
            save(document);
            log.info("[Settings] Migrated settings file from schema version {} to {}", version,
                    SettingsDocument.CURRENT_SCHEMA_VERSION);
        } else if (sealed) {
            save(document);
            log.warn("[Settings] Settings file contained unencrypted secrets, re-saved encrypted");
        }
        return document;
    }

    /**
     * Atomically replace the stored document, keeping the previous file as
     * {@code settings.json.bak}. Secrets must already be encrypted.
     */
    public void save(SettingsDocument document) {
        assertNoPlaintext(document);
        document.setSchemaVersion(SettingsDocument.CURRENT_SCHEMA_VERSION);
        String json = writeJson(document);
        try {
            storagePort.putTextAtomic(settingsDirectory(), settingsFile(), json, true).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Failed to persist settings: " + cause.getMessage(), cause);
        }
        log.debug("[Settings] Saved settings document");
    }

    /**
     * Independent deep copy, so callers can mutate without touching a shared
     * snapshot.
     */
    public SettingsDocument copy(SettingsDocument document) {
        try {
            return mapper.readValue(mapper.writeValueAsBytes(document), SettingsDocument.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to copy settings document", e);
        }
    }

    public String toBackupJson(SettingsBackup backup) {
        assertNoPlaintext(backup.getSettings());
        return writeJson(backup);
    }

    /**
     * Parse a backup produced by {@link #toBackupJson}. Schema version 1
     * backups are migrated and their plaintext secrets encrypted; the returned
     * document never holds plaintext.
     */
    public SettingsDocument parseBackup(String blob) {
        if (blob == null || blob.isBlank()) {
            throw new RestoreFormatException("Backup is empty");
        }

        JsonNode tree;
        try {
            tree = mapper.readTree(blob);
        } catch (JsonProcessingException e) {
            throw new RestoreFormatException("Backup is not valid JSON: " + locationOf(e), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new RestoreFormatException("Backup does not contain a JSON object");
        }

        JsonNode format = tree.get(FORMAT_FIELD);
        if (format == null || !SettingsBackup.FORMAT.equals(format.asText())) {
            throw new RestoreFormatException("Backup format must be '" + SettingsBackup.FORMAT + "'");
        }

        JsonNode versionNode = tree.get(SCHEMA_VERSION_FIELD);
        if (versionNode == null || !versionNode.isInt()) {
            throw new RestoreFormatException("Backup has no schema version");
        }
        int version = versionNode.intValue();
        if (version < SettingsDocument.LEGACY_SCHEMA_VERSION || version > SettingsDocument.CURRENT_SCHEMA_VERSION) {
            throw new RestoreFormatException("Unsupported backup schema version " + version + " (supported: "
                    + SettingsDocument.LEGACY_SCHEMA_VERSION + ".." + SettingsDocument.CURRENT_SCHEMA_VERSION + ")");
        }

        JsonNode settings = tree.get(SETTINGS_FIELD);
        if (settings == null || !settings.isObject()) {
            throw new RestoreFormatException("Backup has no settings object");
        }
        ObjectNode settingsNode = (ObjectNode) settings;
        JsonNode innerVersion = settingsNode.get(SCHEMA_VERSION_FIELD);
        if (innerVersion != null && (!innerVersion.isInt() || innerVersion.intValue() != version)) {
            throw new RestoreFormatException("Backup settings schema version does not match the backup header");
        }
        if (version == SettingsDocument.LEGACY_SCHEMA_VERSION) {
            settingsNode.remove(SCHEMA_VERSION_FIELD);
        }

        SettingsDocument document;
        try {
            document = toDocument(settingsNode, version);
        } catch (IOException e) {
            throw new RestoreFormatException("Backup settings have an invalid shape: " + locationOf(e), e);
        }
        if (version == SettingsDocument.LEGACY_SCHEMA_VERSION) {
            dropLegacyEncryptedSecrets(document);
        }
        sealPlainSecrets(document);
        return document;
    }

    private SettingsDocument toDocument(ObjectNode tree, int version) throws IOException {
        if (version == SettingsDocument.LEGACY_SCHEMA_VERSION) {
            migrateLegacyTree(tree);
        }
        SettingsDocument document = mapper.treeToValue(tree, SettingsDocument.class);
        fillMissingSections(document);
        return document;
    }

    /**
     * Legacy files have no version field and write timestamps without an
     * offset. Secret strings are accepted as plaintext by the model itself.
     */
    private void migrateLegacyTree(ObjectNode tree) {
        tree.put(SCHEMA_VERSION_FIELD, SettingsDocument.CURRENT_SCHEMA_VERSION);

        JsonNode lastUpdated = tree.get(LAST_UPDATED_FIELD);
        if (lastUpdated != null && lastUpdated.isTextual()) {
            Instant parsed = parseLegacyTimestamp(lastUpdated.asText());
            if (parsed != null) {
                tree.put(LAST_UPDATED_FIELD, parsed.toString());
            } else {
                tree.remove(LAST_UPDATED_FIELD);
            }
        }
    }

    private Instant parseLegacyTimestamp(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                log.warn("[Settings] Dropping unparseable legacy last_updated value");
                return null;
            }
        }
    }

    private int schemaVersionOf(JsonNode tree) {
        JsonNode version = tree.get(SCHEMA_VERSION_FIELD);
        if (version == null || version.isNull()) {
            return SettingsDocument.LEGACY_SCHEMA_VERSION;
        }
        if (!version.isInt()) {
            throw new StoreCorruptException("Settings file has a non-numeric schema version");
        }
        return version.intValue();
    }

    private void fillMissingSections(SettingsDocument document) {
        if (document.getJenkins() == null) {
            document.setJenkins(new SettingsDocument.JenkinsSettings());
        }
        if (document.getGithub() == null) {
            document.setGithub(new SettingsDocument.GitHubSettings());
        }
        if (document.getAi() == null) {
            document.setAi(new SettingsDocument.AiSettings());
        }
        if (document.getPreferences() == null) {
            document.setPreferences(new SettingsDocument.PreferencesSettings());
        }
    }

    /**
     * Legacy files may hold secrets as Fernet tokens under a key this service
     * never had. Such values cannot be recovered, so the field is cleared and
     * must be entered again.
     */
    private void dropLegacyEncryptedSecrets(SettingsDocument document) {
        for (SecretField field : SecretField.values()) {
            Secret current = field.get(document);
            if (!Secret.isSealed(current) && Secret.hasValue(current)
                    && isLegacyFernetToken(current.getValue())) {
                field.set(document, null);
                log.warn("[Settings] Dropping legacy encrypted {}, it has to be re-entered", field.path());
            }
        }
    }

    static boolean isLegacyFernetToken(String value) {
        if (value == null || value.length() <= LEGACY_TOKEN_MIN_LENGTH
                || !LEGACY_TOKEN_ALPHABET.matcher(value).matches()) {
            return false;
        }
        try {
            byte[] decoded = Base64.getUrlDecoder().decode(value);
            return decoded.length > 0 && decoded[0] == FERNET_VERSION;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private boolean sealPlainSecrets(SettingsDocument document) {
        boolean changed = false;
        for (SecretField field : SecretField.values()) {
            Secret current = field.get(document);
            Secret sealed = secretCipher.sealIfPlain(current);
            if (sealed != current) {
                field.set(document, sealed);
                changed = true;
            }
        }
        return changed;
    }

    private void assertNoPlaintext(SettingsDocument document) {
        List<String> plaintext = Arrays.stream(SecretField.values())
                .filter(field -> Secret.hasValue(field.get(document)) && !Secret.isSealed(field.get(document)))
                .map(SecretField::path)
                .collect(Collectors.toList());
        if (!plaintext.isEmpty()) {
            throw new IllegalStateException("Refusing to write unencrypted secrets: " + plaintext);
        }
    }

    private String writeJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settings", e);
        }
    }

    private String readText(String directory, String path) {
        CompletableFuture<String> future = storagePort.getText(directory, path);
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StoreCorruptException("Settings file is unreadable: " + cause.getMessage(), cause);
        }
    }

    /**
     * Describes where parsing failed by field path only. Jackson messages can
     * echo input values, which may be secrets.
     */
    private static String locationOf(IOException e) {
        if (e instanceof JsonMappingException mappingException && !mappingException.getPath().isEmpty()) {
            return mappingException.getPath().stream()
                    .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                    .collect(Collectors.joining("."));
        }
        if (e instanceof JsonProcessingException processingException
                && processingException.getLocation() != null) {
            return "line " + processingException.getLocation().getLineNr()
                    + ", column " + processingException.getLocation().getColumnNr();
        }
        return e.getClass().getSimpleName();
    }

    private String settingsDirectory() {
        return properties.getStorage().getSettingsDirectory();
    }

    private String settingsFile() {
        return properties.getStorage().getSettingsFile();
    }
}
