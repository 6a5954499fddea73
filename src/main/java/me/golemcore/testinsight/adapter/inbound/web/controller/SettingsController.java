package me.golemcore.testinsight.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.testinsight.adapter.inbound.web.dto.BackupFileResponse;
import me.golemcore.testinsight.adapter.inbound.web.dto.TestConnectionRequest;
import me.golemcore.testinsight.domain.model.AiModelsResult;
import me.golemcore.testinsight.domain.model.ConnectionTestResult;
import me.golemcore.testinsight.domain.model.ServiceName;
import me.golemcore.testinsight.domain.model.ServiceStatus;
import me.golemcore.testinsight.domain.model.SettingsDocument;
import me.golemcore.testinsight.domain.model.SettingsUpdate;
import me.golemcore.testinsight.domain.service.SecretsStatusReporter;
import me.golemcore.testinsight.domain.service.SettingsService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Settings management endpoints. Every response carries secrets in redacted
 * form only.
 *
 * <p>
 * Service calls touch the disk or the network, so they run on the bounded
 * elastic scheduler rather than the event loop.
 */
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
@Slf4j
public class SettingsController {

    private static final DateTimeFormatter DOWNLOAD_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String AI_KEY_HEADER = "X-AI-Api-Key";

    private final SettingsService settingsService;
    private final SecretsStatusReporter secretsStatusReporter;

    @GetMapping
    public Mono<ResponseEntity<SettingsDocument>> getSettings() {
        return blocking(() -> ResponseEntity.ok(settingsService.getSettings()));
    }

    @PutMapping
    public Mono<ResponseEntity<SettingsDocument>> updateSettings(@RequestBody SettingsUpdate update) {
        return blocking(() -> ResponseEntity.ok(settingsService.updateSettings(update)));
    }

    @PostMapping("/reset")
    public Mono<ResponseEntity<SettingsDocument>> resetSettings() {
        return blocking(() -> ResponseEntity.ok(settingsService.resetToDefaults()));
    }

    @GetMapping("/validate")
    public Mono<ResponseEntity<Map<String, List<String>>>> validateSettings() {
        return blocking(() -> ResponseEntity.ok(settingsService.validateCurrent()));
    }

    @GetMapping("/secrets-status")
    public Mono<ResponseEntity<Map<String, Map<String, Boolean>>>> getSecretsStatus() {
        return blocking(() -> ResponseEntity.ok(secretsStatusReporter.status()));
    }

    @GetMapping("/service-status")
    public Mono<ResponseEntity<Map<String, ServiceStatus>>> getServiceStatus() {
        return blocking(() -> ResponseEntity.ok(secretsStatusReporter.serviceStatus()));
    }

    // ==================== Connection tests ====================

    @PostMapping("/test-connection")
    public Mono<ResponseEntity<ConnectionTestResult>> testConnection(@RequestParam("service") String service) {
        ServiceName serviceName = ServiceName.fromId(service);
        return blocking(() -> ResponseEntity.ok(settingsService.testConnection(serviceName, Map.of())));
    }

    @PostMapping("/test-connection-with-config")
    public Mono<ResponseEntity<ConnectionTestResult>> testConnectionWithConfig(
            @RequestBody TestConnectionRequest request) {
        ServiceName serviceName = ServiceName.fromId(request.getService());
        return blocking(() -> ResponseEntity.ok(settingsService.testConnection(serviceName, request.getConfig())));
    }

    @GetMapping("/ai/models")
    public Mono<ResponseEntity<AiModelsResult>> getAiModels(
            @RequestHeader(value = AI_KEY_HEADER, required = false) String apiKey) {
        return blocking(() -> ResponseEntity.ok(settingsService.listAiModels(apiKey)));
    }

    // ==================== Backup / restore ====================

    @GetMapping("/backup")
    public Mono<ResponseEntity<String>> downloadBackup() {
        return blocking(() -> {
            String json = settingsService.exportBackup();
            String filename = "testinsight_settings_backup_" + LocalDateTime.now().format(DOWNLOAD_TIMESTAMP)
                    + ".json";
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            ContentDisposition.attachment().filename(filename).build().toString())
                    .body(json);
        });
    }

    @PostMapping("/restore")
    public Mono<ResponseEntity<SettingsDocument>> restore(@RequestBody String backup) {
        return blocking(() -> ResponseEntity.ok(settingsService.restore(backup)));
    }

    @PostMapping("/backups")
    public Mono<ResponseEntity<BackupFileResponse>> createBackupFile() {
        return blocking(() -> ResponseEntity.ok(new BackupFileResponse(settingsService.createBackupFile())));
    }

    @GetMapping("/backups")
    public Mono<ResponseEntity<List<String>>> listBackupFiles() {
        return blocking(() -> ResponseEntity.ok(settingsService.listBackupFiles()));
    }

    @PostMapping("/backups/{name}/restore")
    public Mono<ResponseEntity<SettingsDocument>> restoreBackupFile(@PathVariable String name) {
        return blocking(() -> ResponseEntity.ok(settingsService.restoreFromBackupFile(name)));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
