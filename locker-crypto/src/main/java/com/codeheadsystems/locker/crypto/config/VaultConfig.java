package com.codeheadsystems.locker.crypto.config;

import com.codeheadsystems.locker.crypto.cipher.AesCbcCipher;
import com.codeheadsystems.locker.crypto.cipher.SymmetricCipher;
import com.codeheadsystems.locker.crypto.common.RandomProvider;
import com.codeheadsystems.locker.crypto.kdf.KeyDerivation;
import com.codeheadsystems.locker.crypto.kdf.Pbkdf2KeyDerivation;

/**
 * Configuration for the vault crypto layer.
 * Holds the key derivation, the cipher, the random source, and the batch width used when
 * decrypting many records at once.
 *
 * @param keyDerivation  derives master keys (and legacy per-blob keys)
 * @param cipher         wraps the vault key and encrypts secrets
 * @param randomProvider source of salts, IVs and vault keys
 * @param batchSize      how many decryptions a batch runs concurrently
 */
public record VaultConfig(
    KeyDerivation keyDerivation,
    SymmetricCipher cipher,
    RandomProvider randomProvider,
    int batchSize
) {

  // Salt length, fixed by the legacy blob layout
  public static final int SALT_LENGTH = 32;
  public static final int DEFAULT_BATCH_SIZE = 5;

  /**
   * Default configuration for production use: PBKDF2-HMAC-SHA256 at 100,000 iterations,
   * AES-256-CBC.
   */
  public static final VaultConfig DEFAULT = new VaultConfig(
      new Pbkdf2KeyDerivation(Pbkdf2KeyDerivation.DEFAULT_ITERATIONS),
      new AesCbcCipher(),
      new RandomProvider(),
      DEFAULT_BATCH_SIZE
  );

  public VaultConfig {
    if (keyDerivation == null || cipher == null || randomProvider == null) {
      throw new IllegalArgumentException("keyDerivation, cipher and randomProvider are required");
    }
    if (batchSize < 1) {
      throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
    }
  }

  /**
   * Creates a test configuration with a cheap KDF. Do not use in production.
   */
  public static VaultConfig forTesting() {
    return new VaultConfig(
        new Pbkdf2KeyDerivation(1_000),
        new AesCbcCipher(),
        new RandomProvider(),
        DEFAULT_BATCH_SIZE
    );
  }

  /**
   * Returns a new config identical to this one but deriving keys at the given cost.
   */
  public VaultConfig withIterations(int iterations) {
    return new VaultConfig(keyDerivation.withIterations(iterations), cipher, randomProvider, batchSize);
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   */
  public VaultConfig withRandomProvider(RandomProvider randomProvider) {
    return new VaultConfig(keyDerivation, cipher, randomProvider, batchSize);
  }

  /**
   * Returns a new config identical to this one but with a different batch size.
   */
  public VaultConfig withBatchSize(int batchSize) {
    return new VaultConfig(keyDerivation, cipher, randomProvider, batchSize);
  }

  public int kdfIterations() {
    return keyDerivation.iterations();
  }

  public int keyLength() {
    return cipher.keyLength();
  }

  public int ivLength() {
    return cipher.ivLength();
  }

  public int blockSize() {
    return cipher.blockSize();
  }
}
