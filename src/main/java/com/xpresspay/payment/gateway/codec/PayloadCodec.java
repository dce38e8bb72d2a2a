package com.xpresspay.payment.gateway.codec;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.xpresspay.payment.gateway.exception.EncryptionException;
import com.xpresspay.payment.gateway.model.Credentials;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.util.DigestUtils;

/**
 * Encrypts card and account payloads the way the gateway expects them.
 *
 * <p>Wire format ({@code alg: "3DES-24"}):
 * <ol>
 *   <li>Key: the first 12 characters of the secret after the {@code XPSECK-} prefix,
 *       followed by the last 12 hex characters of the MD5 of the full secret.
 *       24 ASCII characters, used as-is as the Triple DES key.</li>
 *   <li>Plaintext: compact JSON of the payload, fields in insertion order, pure ASCII
 *       (see {@link AsciiJsonEscapes}).</li>
 *   <li>Cipher: Triple DES, ECB mode, PKCS#5 padding; ciphertext Base64-encoded.</li>
 * </ol>
 *
 * <p>The gateway has no channel for an IV, hence ECB. The secret key never leaves this class
 * except as derived key bytes. Stateless and thread-safe.
 */
public class PayloadCodec {

  public static final String ALGORITHM = "3DES-24";
  static final int KEY_LENGTH = 24;

  private static final String TRANSFORMATION = "DESede/ECB/PKCS5Padding";
  private static final int KEY_PART_LENGTH = 12;

  private final ObjectMapper objectMapper;

  /**
   * The mapper is private to the codec: the plaintext bytes are part of the wire format and
   * must not follow an application's Jackson settings.
   */
  public PayloadCodec() {
    JsonFactory factory = new JsonFactoryBuilder()
        .characterEscapes(new AsciiJsonEscapes())
        .build();
    this.objectMapper = JsonMapper.builder(factory)
        .disable(SerializationFeature.INDENT_OUTPUT)
        .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();
  }

  /**
   * Derives the 24-byte cipher key from the merchant secret.
   *
   * @throws EncryptionException if the secret is missing or too short
   */
  public byte[] deriveKey(String secretKey) {
    if (secretKey == null || secretKey.isEmpty()) {
      throw new EncryptionException(
          "A secret key is required to encrypt card and account payloads");
    }
    String stripped = secretKey.replace(Credentials.SECRET_KEY_PREFIX, "");
    if (stripped.length() < KEY_PART_LENGTH) {
      throw new EncryptionException("Secret key is too short to derive an encryption key. "
          + "Ensure you are using the full key from your Xpresspay dashboard.");
    }
    String md5Hex = DigestUtils.md5DigestAsHex(secretKey.getBytes(StandardCharsets.UTF_8));
    String combined = stripped.substring(0, KEY_PART_LENGTH)
        + md5Hex.substring(md5Hex.length() - KEY_PART_LENGTH);
    byte[] key = combined.getBytes(StandardCharsets.UTF_8);
    if (key.length != KEY_LENGTH) {
      throw new EncryptionException("Secret key must contain ASCII characters only");
    }
    return key;
  }

  /** Derives the key from {@code credentials} and encrypts {@code payload}. */
  public String encrypt(Credentials credentials, Map<String, ?> payload) {
    return encrypt(deriveKey(credentials.getSecretKey()), payload);
  }

  /**
   * Serialises {@code payload} to compact JSON and encrypts it.
   *
   * @return Base64 ciphertext, sent as the {@code request} field
   * @throws EncryptionException if a value is not a string, number, boolean, list or map,
   *     or the cipher fails
   */
  public String encrypt(byte[] key, Map<String, ?> payload) {
    String plaintext = serialize(payload);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "DESede"));
      byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(encrypted);
    } catch (GeneralSecurityException e) {
      throw new EncryptionException("Encryption failed: " + e.getMessage(), e);
    }
  }

  /**
   * Reverses {@link #encrypt(byte[], Map)}.
   *
   * @throws EncryptionException if the ciphertext is not valid Base64, was produced with
   *     another key, or does not hold a JSON object
   */
  public Map<String, Object> decrypt(byte[] key, String ciphertext) {
    byte[] plaintext;
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "DESede"));
      plaintext = cipher.doFinal(Base64.getDecoder().decode(ciphertext));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new EncryptionException("Decryption failed: " + e.getMessage(), e);
    }
    try {
      return objectMapper.readValue(plaintext, new TypeReference<LinkedHashMap<String, Object>>() {
      });
    } catch (IOException e) {
      throw new EncryptionException("Decrypted payload is not a JSON object", e);
    }
  }

  private String serialize(Map<String, ?> payload) {
    if (payload == null) {
      throw new EncryptionException("Failed to serialize payload to JSON: payload is null");
    }
    requireSerializable("payload", payload);
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new EncryptionException("Failed to serialize payload to JSON: " + e.getMessage(), e);
    }
  }

  private void requireSerializable(String path, Object value) {
    if (value == null || value instanceof CharSequence || value instanceof Number
        || value instanceof Boolean) {
      return;
    }
    if (value instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        if (!(entry.getKey() instanceof String)) {
          throw new EncryptionException(
              "Failed to serialize payload to JSON: non-string key at " + path);
        }
        requireSerializable(path + "." + entry.getKey(), entry.getValue());
      }
      return;
    }
    if (value instanceof Collection) {
      int index = 0;
      for (Object element : (Collection<?>) value) {
        requireSerializable(path + "[" + index++ + "]", element);
      }
      return;
    }
    throw new EncryptionException("Failed to serialize payload to JSON: "
        + value.getClass().getName() + " at " + path + " is not a JSON value");
  }
}
