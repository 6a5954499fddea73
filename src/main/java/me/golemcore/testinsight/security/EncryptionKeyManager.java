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

package me.golemcore.testinsight.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.testinsight.domain.exception.KeyCorruptException;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the installation's AES-256 key stored in {@code keys/settings.key}.
 *
 * <p>
 * The key is generated on first use and published with an exclusive create,
 * so concurrent first runs (threads or processes) all end up with the key of
 * whichever writer won. Once loaded it is cached for the life of the process.
 * Key bytes are never logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EncryptionKeyManager {

    public static final int KEY_LENGTH_BYTES = 32;
    private static final String KEY_ALGORITHM = "AES";
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final StoragePort storagePort;
    private final TestInsightProperties properties;

    private final AtomicReference<SecretKey> cachedKey = new AtomicReference<>();
    private final Object keyLock = new Object();

    public SecretKey getOrCreateKey() {
        SecretKey key = cachedKey.get();
        if (key != null) {
            return key;
        }
        synchronized (keyLock) {
            key = cachedKey.get();
            if (key == null) {
                key = loadOrCreate();
                cachedKey.set(key);
            }
            return key;
        }
    }

    /**
     * Whether a key file has been written for this installation. Does not load
     * or create the key.
     */
    public boolean keyExists() {
        if (cachedKey.get() != null) {
            return true;
        }
        return Boolean.TRUE.equals(await(storagePort.exists(keysDirectory(), keyFile())));
    }

    private SecretKey loadOrCreate() {
        byte[] existing = readKeyFile();
        if (existing != null) {
            log.debug("[Crypto] Loaded settings encryption key");
            return toKey(existing);
        }

        byte[] generated = new byte[KEY_LENGTH_BYTES];
        SECURE_RANDOM.nextBytes(generated);
        try {
            boolean created = Boolean.TRUE.equals(
                    await(storagePort.putObjectIfAbsent(keysDirectory(), keyFile(), generated)));
            if (created) {
                log.info("[Crypto] Generated new settings encryption key at {}/{}", keysDirectory(), keyFile());
                return toKey(generated);
            }
        } finally {
            Arrays.fill(generated, (byte) 0);
        }

        log.info("[Crypto] Encryption key was created concurrently, loading it");
        byte[] winner = readKeyFile();
        if (winner == null) {
            throw new KeyCorruptException("Key file disappeared after concurrent creation");
        }
        return toKey(winner);
    }

    private byte[] readKeyFile() {
        return await(storagePort.getObject(keysDirectory(), keyFile()));
    }

    private SecretKey toKey(byte[] bytes) {
        if (bytes.length != KEY_LENGTH_BYTES) {
            throw new KeyCorruptException("Encryption key has invalid length: expected "
                    + KEY_LENGTH_BYTES + " bytes, found " + bytes.length);
        }
        return new SecretKeySpec(bytes, KEY_ALGORITHM);
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new KeyCorruptException("Encryption key file is unreadable: " + cause.getMessage(), cause);
        }
    }

    private String keysDirectory() {
        return properties.getStorage().getKeysDirectory();
    }

    private String keyFile() {
        return properties.getStorage().getKeyFile();
    }
}
