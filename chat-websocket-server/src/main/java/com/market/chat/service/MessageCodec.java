package com.market.chat.service;

import com.market.chat.domain.DecodedContent;
import com.market.chat.domain.EncodedMessage;
import com.market.chat.exception.EncodingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Turns plaintext into storable ciphertext and back.
 *
 * <p>Wire form: {@code <marker><b64 nonce>:<b64 tag>:<b64 ciphertext>} where the
 * marker is {@code C} (gzip before encryption) or {@code P} (plain). Values
 * without a marker are read as plain.
 */
@Service
@Slf4j
public class MessageCodec {

    public static final int MAX_PLAINTEXT_LENGTH = 100_000;
    public static final int MAX_CIPHERTEXT_LENGTH = 200_000;
    static final int COMPRESSION_THRESHOLD = 100;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH_BYTES = 12;
    private static final int TAG_LENGTH_BYTES = 16;
    private static final char COMPRESSED_MARKER = 'C';
    private static final char PLAIN_MARKER = 'P';

    private final EncryptionKeyProvider keyProvider;
    private final SecureRandom secureRandom = new SecureRandom();

    public MessageCodec(EncryptionKeyProvider keyProvider) {
        this.keyProvider = keyProvider;
    }

    public EncodedMessage encode(String plaintext) {
        if (plaintext == null) {
            throw new EncodingException("Cannot encrypt: content is null");
        }
        if (plaintext.length() > MAX_PLAINTEXT_LENGTH) {
            throw new EncodingException("Message too large: " + plaintext.length()
                + " characters (max " + MAX_PLAINTEXT_LENGTH + ")");
        }

        byte[] raw = plaintext.getBytes(StandardCharsets.UTF_8);
        byte[] payload = raw;
        boolean compressed = false;
        if (plaintext.length() > COMPRESSION_THRESHOLD) {
            try {
                payload = gzip(raw);
                compressed = true;
            } catch (IOException e) {
                log.warn("Compression failed, storing uncompressed: {}", e.getMessage());
            }
        }

        byte[] nonce = new byte[NONCE_LENGTH_BYTES];
        secureRandom.nextBytes(nonce);
        byte[] sealed;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keyProvider.currentKey(), new GCMParameterSpec(TAG_LENGTH_BYTES * 8, nonce));
            sealed = cipher.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new EncodingException("Failed to encrypt message", e);
        }

        // JCE appends the tag to the ciphertext
        byte[] body = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH_BYTES);
        byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH_BYTES, sealed.length);

        Base64.Encoder b64 = Base64.getEncoder();
        String ciphertext = (compressed ? COMPRESSED_MARKER : PLAIN_MARKER)
            + b64.encodeToString(nonce) + ":" + b64.encodeToString(tag) + ":" + b64.encodeToString(body);
        if (ciphertext.length() > MAX_CIPHERTEXT_LENGTH) {
            throw new EncodingException("Encrypted message too large: " + ciphertext.length()
                + " characters (max " + MAX_CIPHERTEXT_LENGTH + ")");
        }

        return EncodedMessage.builder()
            .ciphertext(ciphertext)
            .contentHash(digest(plaintext))
            .compressed(compressed)
            .build();
    }

    public String decode(String ciphertext) {
        return decodeWithKeyInfo(ciphertext).getPlaintext();
    }

    /**
     * Decode with the current key first, then each legacy key.
     */
    public DecodedContent decodeWithKeyInfo(String ciphertext) {
        Sealed sealed = parse(ciphertext);

        byte[] payload = tryOpen(sealed, keyProvider.currentKey());
        boolean legacy = false;
        if (payload == null) {
            for (SecretKey key : keyProvider.legacyKeys()) {
                payload = tryOpen(sealed, key);
                if (payload != null) {
                    legacy = true;
                    break;
                }
            }
        }
        if (payload == null) {
            throw new EncodingException(
                "Decryption authentication failed - message may have been encrypted with a different key or is corrupted");
        }

        if (sealed.compressed) {
            try {
                payload = gunzip(payload);
            } catch (IOException e) {
                throw new EncodingException("Failed to decompress message", e);
            }
        }
        return new DecodedContent(new String(payload, StandardCharsets.UTF_8), legacy);
    }

    public static String digest(String plaintext) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(plaintext.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Sealed parse(String ciphertext) {
        if (ciphertext == null) {
            throw new EncodingException("Invalid encrypted data: cannot be null");
        }
        if (ciphertext.isEmpty()) {
            throw new EncodingException("Invalid encrypted data: cannot be empty");
        }
        if (ciphertext.length() > MAX_CIPHERTEXT_LENGTH) {
            throw new EncodingException("Encrypted data too large: " + ciphertext.length()
                + " characters (max " + MAX_CIPHERTEXT_LENGTH + ")");
        }

        char marker = ciphertext.charAt(0);
        boolean compressed = marker == COMPRESSED_MARKER;
        String body = marker == COMPRESSED_MARKER || marker == PLAIN_MARKER ? ciphertext.substring(1) : ciphertext;

        String[] parts = body.split(":", -1);
        if (parts.length != 3) {
            throw new EncodingException("Invalid encrypted data format: expected nonce:tag:ciphertext");
        }

        byte[] nonce;
        byte[] tag;
        byte[] data;
        try {
            Base64.Decoder b64 = Base64.getDecoder();
            nonce = b64.decode(parts[0]);
            tag = b64.decode(parts[1]);
            data = b64.decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new EncodingException("Invalid encrypted data format: not base64", e);
        }
        if (nonce.length != NONCE_LENGTH_BYTES) {
            throw new EncodingException("Invalid nonce length: expected " + NONCE_LENGTH_BYTES + " bytes, got " + nonce.length);
        }
        if (tag.length != TAG_LENGTH_BYTES) {
            throw new EncodingException("Invalid auth tag length: expected " + TAG_LENGTH_BYTES + " bytes, got " + tag.length);
        }

        byte[] joined = new byte[data.length + tag.length];
        System.arraycopy(data, 0, joined, 0, data.length);
        System.arraycopy(tag, 0, joined, data.length, tag.length);
        return new Sealed(compressed, nonce, joined);
    }

    private static byte[] tryOpen(Sealed sealed, SecretKey key) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BYTES * 8, sealed.nonce));
            return cipher.doFinal(sealed.dataAndTag);
        } catch (GeneralSecurityException e) {
            return null;
        }
    }

    private static byte[] gzip(byte[] input) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(input.length / 2 + 16);
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(input);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] input) throws IOException {
        try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(input))) {
            byte[] result = gz.readNBytes(MAX_PLAINTEXT_LENGTH * 4 + 1);
            if (result.length > MAX_PLAINTEXT_LENGTH * 4) {
                throw new IOException("Decompressed content exceeds limit");
            }
            return result;
        }
    }

    private static final class Sealed {
        private final boolean compressed;
        private final byte[] nonce;
        private final byte[] dataAndTag;

        private Sealed(boolean compressed, byte[] nonce, byte[] dataAndTag) {
            this.compressed = compressed;
            this.nonce = nonce;
            this.dataAndTag = dataAndTag;
        }
    }
}
