package com.market.chat.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Derives the AES-256 message keys once at startup.
 *
 * The first key encrypts; legacy keys are only ever tried for decryption.
 * Without {@code chat.encryption.secret} the application refuses to start
 * unless {@code chat.dev-mode} is on.
 */
@Component
@Slf4j
public class EncryptionKeyProvider {

    static final String DEV_SEED = "marketplace-chat-dev-seed-do-not-use-in-production";
    static final int ITERATIONS = 65_536;
    static final int KEY_LENGTH_BITS = 256;

    private final SecretKey currentKey;
    private final List<SecretKey> legacyKeys;

    public EncryptionKeyProvider(
            @Value("${chat.encryption.secret:}") String secret,
            @Value("${chat.encryption.salt:marketplace-chat}") String salt,
            @Value("${chat.encryption.legacy-secrets:}") List<String> legacySecrets,
            @Value("${chat.dev-mode:false}") boolean devMode) {

        if (secret == null || secret.isBlank()) {
            if (!devMode) {
                throw new IllegalStateException(
                    "chat.encryption.secret must be set (or chat.dev-mode=true for local development)");
            }
            log.warn("⚠️ chat.encryption.secret is not set; using the development seed. Never run like this in production");
            secret = DEV_SEED;
        }

        this.currentKey = deriveKey(secret, salt);

        List<SecretKey> keys = new ArrayList<>();
        if (legacySecrets != null) {
            for (String legacy : legacySecrets) {
                if (legacy == null || legacy.isBlank()) {
                    continue;
                }
                keys.add(deriveKey(legacy.trim(), salt));
            }
        }
        this.legacyKeys = List.copyOf(keys);
        log.info("Message encryption keys ready: legacyKeys={}", legacyKeys.size());
    }

    public SecretKey currentKey() {
        return currentKey;
    }

    public List<SecretKey> legacyKeys() {
        return legacyKeys;
    }

    static SecretKey deriveKey(String secret, String salt) {
        char[] password = secret.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(password, salt.getBytes(StandardCharsets.UTF_8), ITERATIONS, KEY_LENGTH_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            byte[] keyBytes = factory.generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to derive message encryption key", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
        }
    }
}
