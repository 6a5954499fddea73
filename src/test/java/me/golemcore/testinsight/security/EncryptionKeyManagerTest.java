package me.golemcore.testinsight.security;

import me.golemcore.testinsight.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.testinsight.domain.exception.KeyCorruptException;
import me.golemcore.testinsight.infrastructure.config.TestInsightProperties;
import me.golemcore.testinsight.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.crypto.SecretKey;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EncryptionKeyManagerTest {

    @TempDir
    Path tempDir;

    private TestInsightProperties properties;
    private LocalStorageAdapter storage;

    @BeforeEach
    void setUp() {
        properties = new TestInsightProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
    }

    @Test
    void shouldGenerateKeyOnFirstUse() throws Exception {
        EncryptionKeyManager manager = new EncryptionKeyManager(storage, properties);
        assertFalse(manager.keyExists());

        SecretKey key = manager.getOrCreateKey();

        assertEquals(EncryptionKeyManager.KEY_LENGTH_BYTES, key.getEncoded().length);
        assertTrue(manager.keyExists());
        assertArrayEquals(key.getEncoded(), Files.readAllBytes(tempDir.resolve("keys/settings.key")));
    }

    @Test
    void shouldCacheKey() {
        EncryptionKeyManager manager = new EncryptionKeyManager(storage, properties);

        assertSame(manager.getOrCreateKey(), manager.getOrCreateKey());
    }

    @Test
    void shouldReuseExistingKeyAcrossInstances() {
        SecretKey first = new EncryptionKeyManager(storage, properties).getOrCreateKey();
        SecretKey second = new EncryptionKeyManager(storage, properties).getOrCreateKey();

        assertArrayEquals(first.getEncoded(), second.getEncoded());
    }

    @Test
    void concurrentFirstUseShouldAgreeOnOneKey() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SecretKey>> keys = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                EncryptionKeyManager manager = new EncryptionKeyManager(storage, properties);
                keys.add(executor.submit(() -> {
                    start.await();
                    return manager.getOrCreateKey();
                }));
            }
            start.countDown();

            byte[] first = keys.get(0).get(10, TimeUnit.SECONDS).getEncoded();
            for (Future<SecretKey> key : keys) {
                assertArrayEquals(first, key.get(10, TimeUnit.SECONDS).getEncoded());
            }
            assertArrayEquals(first, Files.readAllBytes(tempDir.resolve("keys/settings.key")));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldRejectKeyWithWrongLength() throws Exception {
        Files.write(tempDir.resolve("keys/settings.key"), new byte[16]);
        EncryptionKeyManager manager = new EncryptionKeyManager(storage, properties);

        KeyCorruptException error = assertThrows(KeyCorruptException.class, manager::getOrCreateKey);
        assertEquals(KeyCorruptException.CODE, error.getCode());
        assertTrue(error.getMessage().contains("invalid length"));
    }

    @Test
    void shouldNeverOverwriteCorruptKey() throws Exception {
        byte[] corrupt = new byte[5];
        Arrays.fill(corrupt, (byte) 3);
        Files.write(tempDir.resolve("keys/settings.key"), corrupt);
        EncryptionKeyManager manager = new EncryptionKeyManager(storage, properties);

        assertThrows(KeyCorruptException.class, manager::getOrCreateKey);
        assertArrayEquals(corrupt, Files.readAllBytes(tempDir.resolve("keys/settings.key")));
    }

    @Test
    void shouldWrapStorageFailure() {
        StoragePort failingStorage = mock(StoragePort.class);
        when(failingStorage.getObject(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("disk gone")));
        EncryptionKeyManager manager = new EncryptionKeyManager(failingStorage, properties);

        assertThrows(KeyCorruptException.class, manager::getOrCreateKey);
    }
}
