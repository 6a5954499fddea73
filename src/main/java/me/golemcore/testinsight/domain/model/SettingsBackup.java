package me.golemcore.testinsight.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Portable backup of the full settings document. Secrets stay encrypted with
 * the key of the installation that produced the backup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettingsBackup {

    public static final String FORMAT = "testinsight-settings-backup";

    @Builder.Default
    private String format = FORMAT;
    private int schemaVersion;
    private Instant createdAt;
    private SettingsDocument settings;
}
