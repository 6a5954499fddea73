package me.golemcore.testinsight.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A secret settings value. When {@code encrypted} is true, {@code value} holds
 * Base64 ciphertext produced by
 * {@link me.golemcore.testinsight.security.SecretCipher}; otherwise it is
 * plaintext that has not been sealed yet (API input or a legacy file).
 * {@code present} can be read without touching the value.
 *
 * <p>
 * Accepts either a bare JSON string (plaintext) or the
 * {@code {value, encrypted, present}} object form.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Secret {

    private String value;

    @Builder.Default
    private Boolean encrypted = false;

    @Builder.Default
    private Boolean present = false;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Secret fromJson(Object source) {
        if (source == null) {
            return null;
        }

        if (source instanceof String) {
            String value = (String) source;
            return plain(value);
        }

        if (source instanceof Map<?, ?>) {
            Map<?, ?> map = (Map<?, ?>) source;
            Object valueObj = map.get("value");
            Object encryptedObj = map.get("encrypted");
            Object presentObj = map.get("present");
            String value = valueObj != null ? String.valueOf(valueObj) : null;
            boolean encrypted = encryptedObj instanceof Boolean && (Boolean) encryptedObj;
            boolean present = presentObj instanceof Boolean && (Boolean) presentObj;
            if (!present && value != null && !value.isBlank()) {
                present = true;
            }
            return Secret.builder()
                    .value(value)
                    .encrypted(encrypted)
                    .present(present)
                    .build();
        }

        throw new IllegalArgumentException("Secret must be a string or an object, got "
                + source.getClass().getSimpleName());
    }

    public static Secret plain(String value) {
        return Secret.builder()
                .value(value)
                .encrypted(false)
                .present(value != null && !value.isBlank())
                .build();
    }

    public static Secret sealed(String ciphertext) {
        return Secret.builder()
                .value(ciphertext)
                .encrypted(true)
                .present(true)
                .build();
    }

    public static Secret redacted(Secret source) {
        if (source == null) {
            return null;
        }
        return Secret.builder()
                .value(null)
                .encrypted(Boolean.TRUE.equals(source.getEncrypted()))
                .present(isPresent(source))
                .build();
    }

    /**
     * Presence check that never looks inside the ciphertext.
     */
    public static boolean isPresent(Secret secret) {
        if (secret == null) {
            return false;
        }
        return Boolean.TRUE.equals(secret.getPresent()) || hasValue(secret);
    }

    public static boolean isSealed(Secret secret) {
        return hasValue(secret) && Boolean.TRUE.equals(secret.getEncrypted());
    }

    public static boolean hasValue(Secret secret) {
        return secret != null && secret.getValue() != null && !secret.getValue().isBlank();
    }
}
