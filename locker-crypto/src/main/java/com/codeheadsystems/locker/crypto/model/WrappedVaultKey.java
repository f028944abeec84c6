package com.codeheadsystems.locker.crypto.model;

import java.time.Instant;

/**
 * The per-account record that protects the vault key: the master-key salt, the IV used to wrap
 * the vault key, and the wrapped vault key itself.
 *
 * @param salt              the salt the master key is derived with; fixed for the account's lifetime
 * @param vaultKeyIv        the IV used for the most recent wrap
 * @param encryptedVaultKey the vault key encrypted under the master key
 * @param iterations        the KDF cost the master key was derived at
 * @param createdAt         when the account's vault key was generated
 * @param updatedAt         when the vault key was last re-wrapped
 */
public record WrappedVaultKey(byte[] salt,
                              byte[] vaultKeyIv,
                              byte[] encryptedVaultKey,
                              int iterations,
                              Instant createdAt,
                              Instant updatedAt) {
}
