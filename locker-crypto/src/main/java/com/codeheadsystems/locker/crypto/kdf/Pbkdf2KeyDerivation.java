package com.codeheadsystems.locker.crypto.kdf;

import com.codeheadsystems.locker.crypto.exceptions.VaultErrorKind;
import com.codeheadsystems.locker.crypto.exceptions.VaultException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * PBKDF2 with HMAC-SHA256 (RFC 8018 §5.2).
 * <p>
 * Empty secrets and salts are rejected.
 */
public class Pbkdf2KeyDerivation implements KeyDerivation {

  /**
   * Production cost.
   */
  public static final int DEFAULT_ITERATIONS = 100_000;

  private final int iterations;

  /**
   * Instantiates PBKDF2-HMAC-SHA256 at {@link #DEFAULT_ITERATIONS}.
   */
  public Pbkdf2KeyDerivation() {
    this(DEFAULT_ITERATIONS);
  }

  /**
   * Instantiates PBKDF2-HMAC-SHA256 at the given cost.
   *
   * @param iterations the iteration count, must be positive
   */
  public Pbkdf2KeyDerivation(final int iterations) {
    if (iterations < 1) {
      throw new IllegalArgumentException("Iterations must be positive: " + iterations);
    }
    this.iterations = iterations;
  }

  @Override
  public byte[] derive(byte[] secret, byte[] salt, int outputLength) {
    if (secret == null || secret.length == 0) {
      throw new VaultException(VaultErrorKind.KEY_DERIVATION, "Secret must not be empty");
    }
    if (salt == null || salt.length == 0) {
      throw new VaultException(VaultErrorKind.KEY_DERIVATION, "Salt must not be empty");
    }
    if (outputLength < 1) {
      throw new VaultException(VaultErrorKind.KEY_DERIVATION,
          "Output length must be positive: " + outputLength);
    }
    PKCS5S2ParametersGenerator gen = new PKCS5S2ParametersGenerator(new SHA256Digest());
    gen.init(secret, salt, iterations);
    KeyParameter key = (KeyParameter) gen.generateDerivedParameters(outputLength * 8);
    return key.getKey();
  }

  @Override
  public int iterations() {
    return iterations;
  }

  @Override
  public KeyDerivation withIterations(int iterations) {
    return iterations == this.iterations ? this : new Pbkdf2KeyDerivation(iterations);
  }
}
