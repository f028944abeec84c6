package com.codeheadsystems.locker.model;

import com.codeheadsystems.locker.crypto.model.WrappedVaultKey;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Persisted form of an account's wrapped vault key, stored as one document per account.
 * <p>
 * Binary fields are base64 because the document store holds JSON. {@code iterations} may be
 * absent in records written before the KDF cost was recorded; {@link #DEFAULT_ITERATIONS} is
 * assumed for those.
 *
 * @param saltBase64              base64 master-key salt (32 bytes)
 * @param vaultKeyIvBase64        base64 IV used to wrap the vault key (16 bytes)
 * @param encryptedVaultKeyBase64 base64 wrapped vault key
 * @param iterations              KDF cost the master key was derived at, or null
 * @param createdAt               ISO-8601 creation time, or null
 * @param updatedAt               ISO-8601 time of the last re-wrap, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VaultKeyDocument(
    @JsonProperty("salt") String saltBase64,
    @JsonProperty("vaultKeyIV") String vaultKeyIvBase64,
    @JsonProperty("encryptedVaultKey") String encryptedVaultKeyBase64,
    @JsonProperty("iterations") Integer iterations,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt) {

  public static final int DEFAULT_ITERATIONS = 100_000;

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  /**
   * Builds the document for a wrapped vault key.
   *
   * @param wrapped the domain record
   * @return the document
   */
  public static VaultKeyDocument fromWrappedVaultKey(WrappedVaultKey wrapped) {
    return new VaultKeyDocument(B64.encodeToString(wrapped.salt()),
        B64.encodeToString(wrapped.vaultKeyIv()),
        B64.encodeToString(wrapped.encryptedVaultKey()),
        wrapped.iterations(),
        format(wrapped.createdAt()),
        format(wrapped.updatedAt()));
  }

  static byte[] decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }

  static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  static Instant parse(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid timestamp in field: " + fieldName, e);
    }
  }

  /**
   * Converts to the domain record.
   *
   * @return the wrapped vault key
   * @throws IllegalArgumentException if a required field is missing or malformed
   */
  public WrappedVaultKey wrappedVaultKey() {
    return new WrappedVaultKey(
        decode(saltBase64, "salt"),
        decode(vaultKeyIvBase64, "vaultKeyIV"),
        decode(encryptedVaultKeyBase64, "encryptedVaultKey"),
        iterations == null ? DEFAULT_ITERATIONS : iterations,
        parse(createdAt, "created_at"),
        parse(updatedAt, "updated_at"));
  }
}
