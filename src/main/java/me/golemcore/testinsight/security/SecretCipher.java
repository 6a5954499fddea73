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
import me.golemcore.testinsight.domain.exception.DecryptionException;
import me.golemcore.testinsight.domain.model.Secret;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-GCM encryption of individual secret values.
 *
 * <p>
 * Blob layout, Base64 encoded: {@code version(1) | iv(12) | ciphertext+tag}.
 * Every call draws a fresh IV, so equal plaintexts never produce equal blobs.
 */
@Component
@RequiredArgsConstructor
public class SecretCipher {

    static final byte FORMAT_VERSION = 1;
    private static final String ENCRYPTION_ALGO = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int HEADER_LENGTH = 1 + GCM_IV_LENGTH;
    private static final int MIN_BLOB_LENGTH = HEADER_LENGTH + GCM_TAG_LENGTH / 8;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final EncryptionKeyManager keyManager;

    public String encrypt(String plaintext, SecretKey key) {
        byte[] iv = new byte[GCM_IV_LENGTH];
        SECURE_RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] blob = new byte[HEADER_LENGTH + encrypted.length];
            blob[0] = FORMAT_VERSION;
            System.arraycopy(iv, 0, blob, 1, GCM_IV_LENGTH);
            System.arraycopy(encrypted, 0, blob, HEADER_LENGTH, encrypted.length);
            return Base64.getEncoder().encodeToString(blob);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    public String decrypt(String blob, SecretKey key) {
        if (blob == null) {
            throw new DecryptionException("Ciphertext is missing");
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(blob);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Ciphertext is not valid Base64", e);
        }
        if (decoded.length < MIN_BLOB_LENGTH) {
            throw new DecryptionException("Ciphertext is truncated");
        }
        if (decoded[0] != FORMAT_VERSION) {
            throw new DecryptionException("Unsupported ciphertext version: " + decoded[0]);
        }

        try {
            Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, decoded, 1, GCM_IV_LENGTH));
            byte[] original = cipher.doFinal(decoded, HEADER_LENGTH, decoded.length - HEADER_LENGTH);
            return new String(original, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Ciphertext failed authentication (wrong key or tampered data)", e);
        }
    }

    /**
     * Encrypt plaintext with the installation key.
     */
    public Secret seal(String plaintext) {
        return Secret.sealed(encrypt(plaintext, keyManager.getOrCreateKey()));
    }

    /**
     * Returns an encrypted secret unchanged, seals a plaintext one, and maps an
     * empty secret to {@code null}.
     */
    public Secret sealIfPlain(Secret secret) {
        if (!Secret.hasValue(secret)) {
            return null;
        }
        if (Secret.isSealed(secret)) {
            return secret;
        }
        return seal(secret.getValue().trim());
    }

    /**
     * Decrypt a stored secret, or return {@code null} if none is stored.
     */
    public String open(Secret secret) {
        if (!Secret.hasValue(secret)) {
            return null;
        }
        if (!Secret.isSealed(secret)) {
            return secret.getValue();
        }
        return decrypt(secret.getValue(), keyManager.getOrCreateKey());
    }
}
