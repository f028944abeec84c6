package com.codeheadsystems.locker.model;

import com.codeheadsystems.locker.crypto.model.SecretRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted form of one stored secret. The blob is kept exactly as the codec produced it.
 *
 * @param id                the record id
 * @param website           the site
 * @param username          the login name
 * @param encryptedPassword the base64 ciphertext blob
 * @param createdAt         ISO-8601 creation time
 * @param updatedAt         ISO-8601 last update time
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecretDocument(
    @JsonProperty("id") String id,
    @JsonProperty("website") String website,
    @JsonProperty("username") String username,
    @JsonProperty("encrypted_password") String encryptedPassword,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt) {

  /**
   * Builds the document for a secret record.
   *
   * @param record the domain record
   * @return the document
   */
  public static SecretDocument fromSecretRecord(SecretRecord record) {
    return new SecretDocument(record.id(),
        record.website(),
        record.username(),
        record.encryptedPassword(),
        VaultKeyDocument.format(record.createdAt()),
        VaultKeyDocument.format(record.updatedAt()));
  }

  /**
   * Converts to the domain record.
   *
   * @return the secret record
   * @throws IllegalArgumentException if the id is missing or a timestamp is malformed
   */
  public SecretRecord secretRecord() {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Missing required field: id");
    }
    return new SecretRecord(id,
        website == null ? "" : website,
        username == null ? "" : username,
        encryptedPassword == null ? "" : encryptedPassword,
        VaultKeyDocument.parse(createdAt, "created_at"),
        VaultKeyDocument.parse(updatedAt, "updated_at"));
  }
}
