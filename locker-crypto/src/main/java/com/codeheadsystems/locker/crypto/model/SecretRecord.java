package com.codeheadsystems.locker.crypto.model;

import java.time.Instant;

/**
 * One stored secret. Only {@code encryptedPassword} is interpreted by the vault; the rest is
 * carried through untouched.
 *
 * @param id                the record id
 * @param website           the site the secret belongs to
 * @param username          the login name at that site
 * @param encryptedPassword the base64 ciphertext blob
 * @param createdAt         the creation time
 * @param updatedAt         the last update time
 */
public record SecretRecord(String id,
                           String website,
                           String username,
                           String encryptedPassword,
                           Instant createdAt,
                           Instant updatedAt) {

  /**
   * Returns a copy holding a new blob and update time.
   *
   * @param encryptedPassword the new blob
   * @param updatedAt         the update time
   * @return the secret record
   */
  public SecretRecord withEncryptedPassword(String encryptedPassword, Instant updatedAt) {
    return new SecretRecord(id, website, username, encryptedPassword, createdAt, updatedAt);
  }

  @Override
  public String toString() {
    return "SecretRecord[id=" + id + ", website=" + website + ", username=" + username + "]";
  }
}
