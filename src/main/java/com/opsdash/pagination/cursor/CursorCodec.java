package com.opsdash.pagination.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdash.domain.model.Result;
import org.bouncycastle.crypto.generators.SCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns cursor payloads into opaque, authenticated tokens and back.
 *
 * <p>Token layout (base64url, no padding): {@code nonce(16) || tag(16) || ciphertext}.
 * The ciphertext is AES-256-GCM over the JSON {@code {"v":"1.0", <fields>..., "t":<millis>}}.
 * The key is derived once from the configured secret with scrypt and a fixed salt.
 *
 * <p>Every decoding failure collapses into {@link CursorError.Invalid}; the failing
 * step is only logged at debug level. Instances are immutable and thread-safe.
 */
public class CursorCodec {

    private static final Logger log = LoggerFactory.getLogger(CursorCodec.class);

    public static final String VERSION_KEY = "v";
    public static final String ISSUED_AT_KEY = "t";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 16;
    private static final int TAG_LENGTH = 16;
    private static final int KEY_LENGTH = 32;
    private static final byte[] KEY_SALT = "salt".getBytes(StandardCharsets.UTF_8);
    private static final int SCRYPT_COST = 16384;
    private static final int SCRYPT_BLOCK_SIZE = 8;
    private static final int SCRYPT_PARALLELISM = 1;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final CodecConfig config;
    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();
    private final ObjectMapper mapper = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .enable(DeserializationFeature.USE_LONG_FOR_INTS)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public CursorCodec(CodecConfig config) {
        this.config = config;
        byte[] derived = SCrypt.generate(
            config.secret().getBytes(StandardCharsets.UTF_8),
            KEY_SALT,
            SCRYPT_COST,
            SCRYPT_BLOCK_SIZE,
            SCRYPT_PARALLELISM,
            KEY_LENGTH);
        this.key = new SecretKeySpec(derived, "AES");
    }

    public CodecConfig config() {
        return config;
    }

    /**
     * Mints a token for the given field values, stamped with the current time.
     */
    public String mint(Map<String, Object> fields) {
        return encode(CursorPayload.of(fields, config.clock().millis()));
    }

    public String encode(CursorPayload payload) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(VERSION_KEY, payload.version());
        payload.fields().forEach((name, value) -> {
            if (VERSION_KEY.equals(name) || ISSUED_AT_KEY.equals(name)) {
                throw new IllegalArgumentException("Cursor field name '" + name + "' is reserved");
            }
            json.put(name, value);
        });
        json.put(ISSUED_AT_KEY, payload.issuedAtMillis());

        try {
            byte[] plain = mapper.writeValueAsBytes(json);
            byte[] nonce = new byte[NONCE_LENGTH];
            random.nextBytes(nonce);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            // JCE appends the tag to the ciphertext
            byte[] sealed = cipher.doFinal(plain);
            int cipherLength = sealed.length - TAG_LENGTH;

            byte[] combined = new byte[NONCE_LENGTH + TAG_LENGTH + cipherLength];
            System.arraycopy(nonce, 0, combined, 0, NONCE_LENGTH);
            System.arraycopy(sealed, cipherLength, combined, NONCE_LENGTH, TAG_LENGTH);
            System.arraycopy(sealed, 0, combined, NONCE_LENGTH + TAG_LENGTH, cipherLength);
            return ENCODER.encodeToString(combined);
        } catch (JsonProcessingException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt cursor", e);
        }
    }

    public Result<CursorPayload, CursorError> decode(String token) {
        if (token == null || token.isBlank()) {
            return invalid("empty token");
        }

        byte[] combined;
        try {
            combined = DECODER.decode(token);
        } catch (IllegalArgumentException e) {
            return invalid("malformed base64");
        }
        // Unused trailing bits must not let two different strings decode to the same bytes
        if (!ENCODER.encodeToString(combined).equals(token)) {
            return invalid("non-canonical base64");
        }
        if (combined.length <= NONCE_LENGTH + TAG_LENGTH) {
            return invalid("token too short");
        }

        byte[] plain;
        try {
            int cipherLength = combined.length - NONCE_LENGTH - TAG_LENGTH;
            byte[] sealed = new byte[cipherLength + TAG_LENGTH];
            System.arraycopy(combined, NONCE_LENGTH + TAG_LENGTH, sealed, 0, cipherLength);
            System.arraycopy(combined, NONCE_LENGTH, sealed, cipherLength, TAG_LENGTH);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, combined, 0, NONCE_LENGTH));
            plain = cipher.doFinal(sealed);
        } catch (GeneralSecurityException e) {
            return invalid("decryption failed: " + e.getClass().getSimpleName());
        }

        LinkedHashMap<String, Object> json;
        try {
            json = mapper.readValue(plain, JSON_OBJECT);
        } catch (Exception e) {
            return invalid("payload is not a JSON object");
        }
        if (json == null) {
            return invalid("payload is null");
        }

        Object version = json.remove(VERSION_KEY);
        Object issuedAt = json.remove(ISSUED_AT_KEY);
        if (!CursorPayload.CURRENT_VERSION.equals(version)) {
            return invalid("unsupported version " + version);
        }
        if (!(issuedAt instanceof Long issuedAtMillis)) {
            return invalid("missing issue timestamp");
        }

        CursorPayload payload;
        try {
            payload = new CursorPayload((String) version, json, issuedAtMillis);
        } catch (IllegalArgumentException | ArithmeticException e) {
            return invalid("unsupported field value");
        }

        long age = config.clock().millis() - issuedAtMillis;
        if (age > config.ttl().toMillis()) {
            log.debug("Rejected cursor: expired {} ms ago", age - config.ttl().toMillis());
            return Result.failure(new CursorError.Expired(age));
        }
        return Result.success(payload);
    }

    private static Result<CursorPayload, CursorError> invalid(String reason) {
        log.debug("Rejected cursor: {}", reason);
        return Result.failure(CursorError.Invalid.INSTANCE);
    }
}
