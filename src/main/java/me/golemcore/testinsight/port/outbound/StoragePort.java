package me.golemcore.testinsight.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage operations within the local workspace. Files are
 * organized by directory (settings, keys, backups).
 */
public interface StoragePort {

    /**
     * Read binary content from file, or {@code null} if it does not exist.
     */
    CompletableFuture<byte[]> getObject(String directory, String path);

    /**
     * Read text content from file, or {@code null} if it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * List files by prefix, relative to {@code directory}.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Atomically write text content to file with optional backup.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>If backup enabled: copy existing file to .bak</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     * A concurrent reader sees either the old or the new content, never a
     * partial write.
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    /**
     * Publish a file only if none exists yet, readable and writable by the owner
     * only where the filesystem supports POSIX permissions.
     *
     * <p>
     * The content is fully written before the file becomes visible under its
     * final name, so a concurrent reader never observes a partial file.
     *
     * @return {@code true} if this call created the file, {@code false} if it
     *         already existed (the existing content is left untouched)
     */
    CompletableFuture<Boolean> putObjectIfAbsent(String directory, String path, byte[] content);
}
