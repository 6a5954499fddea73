/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.testinsight.adapter.outbound.storage;

import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores all data in a local workspace directory with subdirectories for
 * different data types:
 * <ul>
 * <li>settings/ - the settings document and its .bak copy
 * <li>keys/ - the encryption key (owner-only permissions)
 * <li>backups/ - timestamped settings backups
 * </ul>
 *
 * <p>
 * Base path configured via {@code testinsight.storage.base-path}, defaults to
 * {@code ${user.home}/.testinsight/data}.
 *
 * @see me.golemcore.testinsight.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final Set<PosixFilePermission> OWNER_ONLY_FILE = PosixFilePermissions.fromString("rw-------");
    private static final Set<PosixFilePermission> OWNER_ONLY_DIR = PosixFilePermissions.fromString("rwx------");

    private final TestInsightProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        TestInsightProperties.StorageProperties storage = properties.getStorage();
        String basePathStr = storage.getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);

            for (String dir : List.of(storage.getSettingsDirectory(), storage.getBackupsDirectory())) {
                Files.createDirectories(basePath.resolve(dir));
            }
            createRestrictedDirectory(basePath.resolve(storage.getKeysDirectory()));

            log.info("Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<byte[]> getObject(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readAllBytes(filePath);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return getObject(directory, path).thenApply(bytes -> {
            if (bytes == null) {
                return null;
            }
            return new String(bytes, StandardCharsets.UTF_8);
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolvePath(directory, path);
            return Files.exists(filePath);
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path dirPath = basePath.resolve(directory);
                if (!Files.exists(dirPath)) {
                    return Collections.emptyList();
                }

                try (Stream<Path> paths = Files.walk(dirPath)) {
                    return paths
                            .filter(Files::isRegularFile)
                            .map(p -> dirPath.relativize(p).toString())
                            .filter(name -> prefix == null || prefix.isEmpty() || name.startsWith(prefix))
                            .sorted()
                            .toList();
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to list files: " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            // Unique per writer so two concurrent saves never share a temp file
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + "." + UUID.randomUUID() + ".tmp");
            Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

            try {
                Path parent = targetPath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }

                // 1. Write to temp file with fsync
                byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
                writeSynced(tempPath, bytes, StandardOpenOption.CREATE_NEW);

                // 2. Verify written content is readable
                byte[] verification = Files.readAllBytes(tempPath);
                if (verification.length != bytes.length) {
                    throw new IOException("Verification failed: size mismatch");
                }

                // 3. Backup existing file if requested
                if (backup && Files.exists(targetPath)) {
                    Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("[Storage] Created backup: {}", backupPath);
                }

                // 4. Atomic rename
                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }

                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);

            } catch (IOException e) {
                deleteQuietly(tempPath);
                throw new RuntimeException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> putObjectIfAbsent(String directory, String path, byte[] content) {
        return CompletableFuture.supplyAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + "." + UUID.randomUUID() + ".tmp");

            try {
                Path parent = targetPath.getParent();
                if (parent != null) {
                    createRestrictedDirectory(parent);
                }
                if (Files.exists(targetPath)) {
                    return false;
                }

                // 1. Fully write an owner-only temp file
                createRestrictedFile(tempPath);
                writeSynced(tempPath, content, StandardOpenOption.TRUNCATE_EXISTING);

                // 2. Publish it under the final name; link creation fails if the target exists
                try {
                    Files.createLink(targetPath, tempPath);
                    log.debug("[Storage] Exclusive create completed: {}/{}", directory, path);
                    return true;
                } catch (FileAlreadyExistsException e) {
                    return false;
                } catch (UnsupportedOperationException | FileSystemException e) {
                    log.warn("[Storage] Hard links not supported, using exclusive create: {}", e.getMessage());
                    return createExclusively(targetPath, content);
                }
            } catch (IOException e) {
                throw new RuntimeException("Exclusive write failed: " + directory + "/" + path, e);
            } finally {
                deleteQuietly(tempPath);
            }
        });
    }

    private boolean createExclusively(Path targetPath, byte[] content) throws IOException {
        try {
            createRestrictedFile(targetPath);
        } catch (FileAlreadyExistsException e) {
            return false;
        }
        writeSynced(targetPath, content, StandardOpenOption.TRUNCATE_EXISTING);
        return true;
    }

    private void writeSynced(Path path, byte[] bytes, StandardOpenOption mode) throws IOException {
        try (OutputStream os = Files.newOutputStream(path,
                mode,
                StandardOpenOption.WRITE,
                StandardOpenOption.SYNC);
                FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            os.write(bytes);
            os.flush();
            channel.force(true); // fsync: metadata + data
        }
    }

    private void createRestrictedFile(Path path) throws IOException {
        if (supportsPosix(path)) {
            Files.createFile(path, PosixFilePermissions.asFileAttribute(OWNER_ONLY_FILE));
        } else {
            Files.createFile(path);
        }
    }

    private void createRestrictedDirectory(Path dir) throws IOException {
        if (Files.isDirectory(dir)) {
            return;
        }
        Files.createDirectories(dir);
        if (supportsPosix(dir)) {
            Files.setPosixFilePermissions(dir, OWNER_ONLY_DIR);
        }
    }

    private boolean supportsPosix(Path path) {
        return path.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanupEx) {
            log.warn("[Storage] Failed to cleanup temp file: {}", path);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
