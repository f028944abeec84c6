package com.codeheadsystems.locker.crypto.kdf;

/**
 * Password-based key derivation: turns a user secret and a salt into fixed-length key material.
 * <p>
 * Implementations must be deterministic and free of side effects, and must never log their
 * inputs or outputs.
 */
public interface KeyDerivation {

  /**
   * Derives key material.
   *
   * @param secret       the user secret, UTF-8 encoded
   * @param salt         the per-account (or per-blob, for legacy data) salt
   * @param outputLength the number of bytes to derive
   * @return the derived key
   * @throws com.codeheadsystems.locker.crypto.exceptions.VaultException with
   *                     {@code KEY_DERIVATION} if any input is malformed
   */
  byte[] derive(byte[] secret, byte[] salt, int outputLength);

  /**
   * The cost parameter this instance runs with.
   *
   * @return the iteration count
   */
  int iterations();

  /**
   * Returns an instance of the same construction with a different cost.
   *
   * @param iterations the iteration count
   * @return the key derivation
   */
  KeyDerivation withIterations(int iterations);
}
