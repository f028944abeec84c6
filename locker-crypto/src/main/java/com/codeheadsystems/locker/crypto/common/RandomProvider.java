package com.codeheadsystems.locker.crypto.common;

import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for salts, IVs and vault keys, and by the password generator for per-character selection.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    if (len < 0) {
      throw new IllegalArgumentException("Length must not be negative: " + len);
    }
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Returns a uniformly distributed index in {@code [0, bound)}.
   *
   * @param bound the exclusive upper bound, must be positive
   * @return the index
   */
  public int nextIndex(int bound) {
    return random.nextInt(bound);
  }
}
